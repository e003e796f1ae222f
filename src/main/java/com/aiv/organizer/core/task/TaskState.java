package com.aiv.organizer.core.task;

/**
 * Lifecycle of one {@link TaskRunner}.
 */
public enum TaskState {
    IDLE,
    VALIDATING,
    /** Enumerating candidates and computing the total. */
    PLANNING,
    /** Work items dispatched to a pool. */
    RUNNING,
    COMPLETED,
    CANCELLED,
    /** An exception escaped the per-item error handling. */
    FAILED,
    /** Validation refused the descriptor; nothing was touched. */
    REJECTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED || this == REJECTED;
    }
}
