package com.deskmind.core.nodes;

import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.logging.MdcContext;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared contract of the three executors: read the transcript and the current
 * subtask, append exactly one ASSISTANT turn.
 * <p>
 * On entry an executor counts the attempt and clears the per-attempt tool tracking,
 * so a retried attempt may run a tool it already ran. When the completion service
 * fails, the executor emits the built-in {@code no_op} call carrying the reason and
 * flags the attempt as a collaborator failure instead of throwing.
 */
public abstract class ExecutorNode {

    private static final Logger log = LoggerFactory.getLogger(ExecutorNode.class);

    /**
     * What one attempt produced.
     *
     * @param turn    the ASSISTANT turn to append
     * @param failure collaborator failure reason, empty when the call succeeded
     */
    protected record Attempt(Turn turn, String failure) {

        static Attempt of(Turn turn) {
            return new Attempt(turn, "");
        }

        static Attempt failed(String reason) {
            return new Attempt(Turn.assistant("", List.of(ToolCall.noOp(reason))), reason);
        }

        boolean collaboratorFailed() {
            return !failure.isEmpty();
        }
    }

    protected final CompletionService completionService;

    protected ExecutorNode(CompletionService completionService) {
        this.completionService = completionService;
    }

    protected abstract ExecutorKind kind();

    /** Produces the attempt's turn. Collaborator failures are reported, not thrown. */
    protected abstract Attempt act(ExecutionState state);

    public Map<String, Object> apply(ExecutionState state) {
        MdcContext.setSubtask(state.taskId(), state.subtaskIndex(), kind().name());
        try {
            Attempt attempt;
            try {
                attempt = act(state);
            } catch (RuntimeException e) {
                log.warn("{} attempt failed: {}", kind(), e.getMessage());
                attempt = Attempt.failed(describe(e));
            }

            var update = new HashMap<String, Object>();
            update.put("currentExecutorKind", kind().name());
            update.put("attemptCounters", ExecutionState.increment(state.attemptCounters(), kind()));
            update.put("completedToolNames", List.of());
            update.put("unavailableTools", List.of());
            update.put("attemptFailure", attempt.failure());
            if (attempt.collaboratorFailed()) {
                update.put("collaboratorFailures", state.collaboratorFailures() + 1);
            }
            update.put("transcript", state.appendTurn(attempt.turn()));
            update.put("status", TaskStatus.EXECUTING.name());
            update.putAll(extraUpdates(state, attempt));
            return update;
        } finally {
            MdcContext.clearSubtask();
        }
    }

    /** Hook for executor-specific state changes; applied after the common ones. */
    protected Map<String, Object> extraUpdates(ExecutionState state, Attempt attempt) {
        return Map.of();
    }

    /** Subtask text, or the latest user request when no subtask is planned. */
    protected static String objective(ExecutionState state) {
        return state.currentSubtask().map(Subtask::description).orElse(state.latestUserText());
    }

    /** Feedback from the human and the verifier for a retried attempt, or empty. */
    protected static String feedback(ExecutionState state) {
        var sb = new StringBuilder();
        if (!state.userContext().isBlank()) {
            sb.append("The user said: ").append(state.userContext()).append('\n');
        }
        if (!state.verifierReason().isBlank()) {
            sb.append("The previous attempt was judged: ").append(state.verifierReason()).append('\n');
        }
        return sb.toString();
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
