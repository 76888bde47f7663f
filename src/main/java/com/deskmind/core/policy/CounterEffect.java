package com.deskmind.core.policy;

/**
 * How a transition changes the retry counters.
 */
public enum CounterEffect {
    /** Reset every counter and advance the subtask index. */
    RESET_AND_ADVANCE,
    /** Increment the retry counter of the executor kind being re-run. */
    INCREMENT,
    NONE
}
