package com.deskmind.core.human;

/**
 * How the Human Confirmation Gate waits for an answer.
 */
public enum HumanMode {
    /** Ask the {@link HumanChannel} inline and continue. */
    BLOCKING,
    /** Stop the task with status AWAITING_HUMAN until the engine is resumed. */
    SUSPEND
}
