package com.deskmind.core.nodes;

import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;

/**
 * Conversational executor. Replies in plain words, never calls tools, and ends
 * the task: the graph goes to END after this node.
 */
@Component
public class ConverseNode extends ExecutorNode {

    static final String GREETING = "Hello! How can I help you today?";
    static final String UNAVAILABLE = "Sorry, I can't answer right now. Please try again in a moment.";

    private static final String SYSTEM_PROMPT = """
            You are a friendly desktop assistant. Answer briefly and conversationally,
            in one short paragraph. Do not describe tool calls or code.
            """;

    public ConverseNode(CompletionService completionService) {
        super(completionService);
    }

    @Override
    protected ExecutorKind kind() {
        return ExecutorKind.CONVERSATIONAL;
    }

    @Override
    protected Attempt act(ExecutionState state) {
        if (state.currentSubtask().isEmpty() && state.latestUserText().isBlank()) {
            return Attempt.of(Turn.assistant(GREETING));
        }
        var window = new ArrayList<>(state.recentTurns(10));
        state.currentSubtask().ifPresent(subtask ->
                window.add(Turn.user("Respond to this: " + subtask.description())));
        try {
            String reply = completionService.complete(SYSTEM_PROMPT, window);
            return Attempt.of(Turn.assistant(firstParagraph(reply)));
        } catch (RuntimeException e) {
            return new Attempt(Turn.assistant(UNAVAILABLE), describe(e));
        }
    }

    @Override
    protected Map<String, Object> extraUpdates(ExecutionState state, Attempt attempt) {
        if (attempt.collaboratorFailed()) {
            return Map.of(
                    "status", TaskStatus.FAILED.name(),
                    "failureCode", FailureCode.COLLABORATOR_UNAVAILABLE.name(),
                    "finalMessage", attempt.turn().content()
            );
        }
        return Map.of(
                "status", TaskStatus.COMPLETED.name(),
                "finalMessage", attempt.turn().content()
        );
    }

    static String firstParagraph(String reply) {
        for (String paragraph : reply.strip().split("\\n\\s*\\n")) {
            if (!paragraph.isBlank()) {
                return paragraph.strip();
            }
        }
        return reply.strip();
    }
}
