package com.deskmind.core.model;

import java.io.Serializable;

/**
 * Outcome of a registry invocation.
 *
 * @param found  false when no tool with the requested name is registered
 * @param output text returned by the tool (may describe a tool-side failure)
 */
public record ToolResult(
    boolean found,
    String output
) implements Serializable {

    public static ToolResult of(String output) {
        return new ToolResult(true, output == null ? "" : output);
    }

    public static ToolResult notFound(String name) {
        return new ToolResult(false, "Tool '" + name + "' is not registered");
    }
}
