package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Verdict;
import com.deskmind.core.policy.NextNode;
import com.deskmind.core.policy.PolicyTransition;
import com.deskmind.core.policy.RetryPolicy;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the {@link RetryPolicy} transition for the latest verdict to the state.
 * <p>
 * On SUCCESS the subtask index advances and every per-subtask field (counters,
 * tool tracking, user context) is reset. Retries bump the counter of the kind
 * being re-run; escalation switches the executor kind to CODE_GENERATING.
 */
@Component
public class ApplyPolicyNode {

    private static final Logger log = LoggerFactory.getLogger(ApplyPolicyNode.class);

    private final RetryPolicy policy;
    private final DeskmindMetrics metrics;

    public ApplyPolicyNode(EngineProperties properties, DeskmindMetrics metrics) {
        this.policy = new RetryPolicy(properties.getMaxRetries());
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ExecutionState state) {
        Verdict verdict = state.verifierDecision().orElse(Verdict.USER_VERIFIER);
        ExecutorKind kind = state.currentExecutorKind().orElse(ExecutorKind.TOOL_SELECTING);
        PolicyTransition transition = policy.decide(verdict, kind, state.retryCounters());
        log.info("{} from {} (retries {}) -> {}", verdict, kind, state.retryCounters(), transition.nextNode());

        var update = new HashMap<String, Object>();
        update.put("nextNode", transition.nextNode().graphNode());

        switch (transition.counterEffect()) {
            case RESET_AND_ADVANCE -> update.putAll(advance(state));
            case INCREMENT -> {
                update.put("retryCounters", ExecutionState.increment(state.retryCounters(), transition.executorKind()));
                metrics.incrementRetries(transition.executorKind().name());
            }
            case NONE -> { }
        }

        if (transition.executorKind() != null) {
            update.put("currentExecutorKind", transition.executorKind().name());
        }
        if (transition.nextNode() == NextNode.CODE_GENERATING && kind == ExecutorKind.TOOL_SELECTING) {
            metrics.incrementEscalations(verdict == Verdict.ESCALATE ? "verdict" : "budget");
        }
        if (transition.isTerminal()) {
            update.put("failureCode", failureCode(state, transition).name());
        }
        return update;
    }

    private static Map<String, Object> advance(ExecutionState state) {
        var completed = new ArrayList<>(state.completedSubtasks());
        state.currentSubtask().map(Subtask::description).ifPresent(completed::add);

        var update = new HashMap<String, Object>();
        update.put("subtaskIndex", state.subtaskIndex() + 1);
        update.put("completedSubtasks", List.copyOf(completed));
        update.put("retryCounters", Map.of());
        update.put("attemptCounters", Map.of());
        update.put("completedToolNames", List.of());
        update.put("unavailableTools", List.of());
        update.put("attemptFailure", "");
        update.put("collaboratorFailures", 0);
        update.put("userContext", "");
        update.put("verifierReason", "");
        update.put("status", TaskStatus.PLANNING.name());
        return update;
    }

    private static FailureCode failureCode(ExecutionState state, PolicyTransition transition) {
        FailureCode code = transition.failureCode();
        if (code == FailureCode.VERIFIER_FAILURE && state.failureCode() == FailureCode.USER_ABORT) {
            return FailureCode.USER_ABORT;
        }
        if (code == FailureCode.RETRY_BUDGET_EXHAUSTED && onlyCollaboratorFailures(state)) {
            return FailureCode.COLLABORATOR_UNAVAILABLE;
        }
        return code;
    }

    private static boolean onlyCollaboratorFailures(ExecutionState state) {
        int attempts = state.attemptCounters().values().stream().mapToInt(Integer::intValue).sum();
        return state.collaboratorFailures() > 0 && state.collaboratorFailures() >= attempts;
    }
}
