package com.deskmind.core.tools;

import com.deskmind.core.model.ToolDescriptor;

import java.util.Map;

/**
 * A desktop capability the executors can call by name.
 * <p>
 * Every {@code Tool} bean in the application context is registered at startup.
 * Implementations must be thread-safe: calls of one assistant turn run concurrently.
 */
public interface Tool {

    /** Unique registry name, lower_snake_case. */
    String name();

    /** One-line description shown to the model. */
    String description();

    /**
     * Runs the tool.
     *
     * @param args arguments from the tool call, never null
     * @return output text fed back into the transcript
     * @throws Exception any failure; the tool stage records it as the call's output
     */
    String invoke(Map<String, Object> args) throws Exception;

    default ToolDescriptor descriptor() {
        return new ToolDescriptor(name(), description());
    }
}
