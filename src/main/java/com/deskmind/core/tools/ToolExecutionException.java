package com.deskmind.core.tools;

/**
 * Thrown by the registry when a registered tool fails while running.
 */
public class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super("Tool '" + toolName + "' failed: "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
