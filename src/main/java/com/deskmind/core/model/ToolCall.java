package com.deskmind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request, emitted by an executor, to invoke one registered tool.
 *
 * @param id   identifier unique within the emitting turn (e.g. "call_0")
 * @param name registered tool name
 * @param args tool arguments; values are plain JSON-like objects
 */
public record ToolCall(
    String id,
    String name,
    Map<String, Object> args
) implements Serializable {

    /** Built-in call meaning "no action"; answered by the tool stage without touching the registry. */
    public static final String NO_OP = "no_op";

    public ToolCall {
        // LinkedHashMap keeps null values that Map.copyOf would reject
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    /** Compact "name {args}" form for prompts and logs. */
    public String describe() {
        return name + " " + args;
    }

    public static ToolCall noOp(String reason) {
        return new ToolCall("call_0", NO_OP, Map.of("reason", reason == null ? "" : reason));
    }

    public boolean isNoOp() {
        return NO_OP.equals(name);
    }
}
