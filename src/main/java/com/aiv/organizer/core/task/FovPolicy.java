package com.aiv.organizer.core.task;

/**
 * How a task treats invalid tokens in its FOV number expression.
 */
public enum FovPolicy {
    /** Invalid tokens are logged and dropped; the task runs with the valid ones. */
    DROP,
    /** Any invalid token rejects the task before it starts. */
    REJECT
}
