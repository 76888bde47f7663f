package com.deskmind.core.nodes;

import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Role;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Writes the terminal status, failure code and a readable final message, and
 * appends that message to the transcript as an ASSISTANT turn.
 * <p>
 * A suspended task passes through untouched.
 */
@Component
public class ConcludeTaskNode {

    private static final Logger log = LoggerFactory.getLogger(ConcludeTaskNode.class);

    private final DeskmindMetrics metrics;

    public ConcludeTaskNode(DeskmindMetrics metrics) {
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ExecutionState state) {
        if (state.status() == TaskStatus.AWAITING_HUMAN) {
            return Map.of();
        }

        FailureCode code = state.failureCode();
        TaskStatus status = code == FailureCode.NONE ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        String message = code == FailureCode.NONE ? successMessage(state) : failureMessage(state, code);

        log.info("Task {} {} after {} subtask(s): {}", state.taskId(), status, state.subtaskIndex(), code);
        metrics.recordSubtaskCount(state.subtaskIndex());
        return Map.of(
                "status", status.name(),
                "finalMessage", message,
                "transcript", state.appendTurn(Turn.assistant(message))
        );
    }

    /** The output of the last successful action, falling back to a plain "Done.". */
    static String successMessage(ExecutionState state) {
        List<Turn> turns = state.transcript();
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn turn = turns.get(i);
            if (turn.role() == Role.USER) {
                break;
            }
            if ((turn.role() == Role.TOOL || turn.role() == Role.ASSISTANT) && !turn.content().isBlank()) {
                return turn.content();
            }
        }
        return FailureCode.NONE.message();
    }

    private static String failureMessage(ExecutionState state, FailureCode code) {
        if (code == FailureCode.VERIFIER_FAILURE && !state.verifierReason().isBlank()) {
            return code.message() + " " + state.verifierReason();
        }
        return code.message();
    }
}
