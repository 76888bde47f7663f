package com.deskmind.core.model;

/**
 * Lifecycle status of a Deskmind task.
 */
public enum TaskStatus {
    ROUTING,
    PLANNING,
    EXECUTING,
    VERIFYING,
    AWAITING_HUMAN,  // suspended at the human confirmation gate
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
