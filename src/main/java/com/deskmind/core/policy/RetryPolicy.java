package com.deskmind.core.policy;

import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Verdict;

import java.util.Map;

/**
 * The retry/escalation transition table.
 * <p>
 * A pure function of the verdict, the executor kind that produced the judged action
 * and the per-kind retry counters. It never touches graph state; {@code ApplyPolicyNode}
 * applies the returned {@link PolicyTransition}.
 *
 * <pre>
 *   SUCCESS                          -> planner, reset counters, advance subtask
 *   RETRY    TOOL_SELECTING  n < max -> tool selecting, increment
 *   RETRY    TOOL_SELECTING  n >= max-> code generating (escalation)
 *   RETRY    CODE_GENERATING n < max -> code generating, increment
 *   RETRY    CODE_GENERATING n >= max-> terminal failure
 *   ESCALATE TOOL_SELECTING          -> code generating
 *   ESCALATE CODE_GENERATING         -> handled as RETRY (escalation never moves backward)
 *   USER_VERIFIER                    -> human confirmation gate
 *   FAILURE                          -> terminal failure
 * </pre>
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 2;

    private final int maxRetries;

    public RetryPolicy() {
        this(DEFAULT_MAX_RETRIES);
    }

    public RetryPolicy(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * @param verdict       the verifier's verdict
     * @param kind          executor kind that produced the judged action
     * @param retryCounters retry counters keyed by {@link ExecutorKind#name()}
     */
    public PolicyTransition decide(Verdict verdict, ExecutorKind kind, Map<String, Integer> retryCounters) {
        return switch (verdict) {
            case SUCCESS -> PolicyTransition.advance();
            case RETRY -> retry(kind, retryCounters);
            case ESCALATE -> kind == ExecutorKind.TOOL_SELECTING
                    ? PolicyTransition.escalate()
                    : retry(kind, retryCounters);
            case USER_VERIFIER -> PolicyTransition.askHuman();
            case FAILURE -> PolicyTransition.fail(FailureCode.VERIFIER_FAILURE);
        };
    }

    private PolicyTransition retry(ExecutorKind kind, Map<String, Integer> retryCounters) {
        int count = retryCounters.getOrDefault(kind.name(), 0);
        switch (kind) {
            case TOOL_SELECTING:
                return count < maxRetries ? PolicyTransition.rerun(kind) : PolicyTransition.escalate();
            case CODE_GENERATING:
                return count < maxRetries
                        ? PolicyTransition.rerun(kind)
                        : PolicyTransition.fail(FailureCode.RETRY_BUDGET_EXHAUSTED);
            default:
                // conversational turns are never verified
                return PolicyTransition.fail(FailureCode.VERIFIER_FAILURE);
        }
    }
}
