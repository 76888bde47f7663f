package com.deskmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One entry of the append-only transcript.
 *
 * @param role       who produced the turn
 * @param content    text of the turn (reply, tool output, prompt)
 * @param toolCalls  tool calls requested by an ASSISTANT turn, empty otherwise
 * @param toolCallId for TOOL turns, the id of the call this turn answers
 * @param toolName   for TOOL turns, the tool that produced the output
 */
public record Turn(
    Role role,
    String content,
    List<ToolCall> toolCalls,
    String toolCallId,
    String toolName
) implements Serializable {

    public Turn {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static Turn user(String content) {
        return new Turn(Role.USER, content, List.of(), null, null);
    }

    public static Turn assistant(String content) {
        return new Turn(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static Turn assistant(String content, List<ToolCall> toolCalls) {
        return new Turn(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static Turn tool(ToolCall call, String output) {
        return new Turn(Role.TOOL, output, List.of(), call.id(), call.name());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
