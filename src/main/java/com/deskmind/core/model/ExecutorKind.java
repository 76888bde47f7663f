package com.deskmind.core.model;

import java.util.Locale;

/**
 * The three executor variants a subtask can be assigned to.
 */
public enum ExecutorKind {
    CONVERSATIONAL,
    TOOL_SELECTING,
    CODE_GENERATING;

    /**
     * Maps the planner's executor label to a kind. Anything unrecognized becomes
     * {@link #TOOL_SELECTING}: a tool is attempted before code is generated.
     */
    public static ExecutorKind fromLabel(String label) {
        if (label == null) {
            return TOOL_SELECTING;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "code", "coder", "coder_agent", "code_generating", "codegen" -> CODE_GENERATING;
            case "chat", "chatter", "conversation", "conversational" -> CONVERSATIONAL;
            default -> TOOL_SELECTING;
        };
    }
}
