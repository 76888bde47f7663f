package com.deskmind.core.tools;

import com.deskmind.core.model.ToolDescriptor;
import com.deskmind.core.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Catalog of invocable tools.
 */
public interface ToolRegistry {

    List<ToolDescriptor> listTools();

    boolean contains(String name);

    /**
     * Invokes the named tool.
     *
     * @return {@link ToolResult#notFound} when no such tool is registered
     * @throws ToolExecutionException when the tool itself fails
     */
    ToolResult invoke(String name, Map<String, Object> args);
}
