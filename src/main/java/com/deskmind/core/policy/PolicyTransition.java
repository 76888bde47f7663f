package com.deskmind.core.policy;

import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;

/**
 * Result of {@link RetryPolicy#decide}.
 *
 * @param nextNode      target node
 * @param executorKind  kind the next executor runs as (the kind whose counter an INCREMENT applies to);
 *                      null when the target is not an executor
 * @param counterEffect effect on the retry counters
 * @param failureCode   NONE unless {@code nextNode} is {@link NextNode#TERMINAL_FAILURE}
 */
public record PolicyTransition(
    NextNode nextNode,
    ExecutorKind executorKind,
    CounterEffect counterEffect,
    FailureCode failureCode
) {

    static PolicyTransition advance() {
        return new PolicyTransition(NextNode.PLANNER, null, CounterEffect.RESET_AND_ADVANCE, FailureCode.NONE);
    }

    static PolicyTransition rerun(ExecutorKind kind) {
        NextNode target = kind == ExecutorKind.CODE_GENERATING ? NextNode.CODE_GENERATING : NextNode.TOOL_SELECTING;
        return new PolicyTransition(target, kind, CounterEffect.INCREMENT, FailureCode.NONE);
    }

    static PolicyTransition escalate() {
        return new PolicyTransition(NextNode.CODE_GENERATING, ExecutorKind.CODE_GENERATING,
                CounterEffect.NONE, FailureCode.NONE);
    }

    static PolicyTransition askHuman() {
        return new PolicyTransition(NextNode.HUMAN_GATE, null, CounterEffect.NONE, FailureCode.NONE);
    }

    static PolicyTransition fail(FailureCode code) {
        return new PolicyTransition(NextNode.TERMINAL_FAILURE, null, CounterEffect.NONE, code);
    }

    public boolean isTerminal() {
        return nextNode == NextNode.TERMINAL_FAILURE;
    }
}
