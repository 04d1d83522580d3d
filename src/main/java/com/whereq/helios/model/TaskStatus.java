package com.whereq.helios.model;

/**
 * Task lifecycle states
 *
 * State transitions:
 * PENDING → QUEUED → RUNNING → {COMPLETED, FAILED, BLOCKED, CANCELLED}
 * RUNNING → QUEUED (executor failure, retry count below the ceiling)
 */
public enum TaskStatus {
    /**
     * Waiting for its dependencies
     */
    PENDING,

    /**
     * Dependencies satisfied, waiting for admission
     */
    QUEUED,

    /**
     * Admitted and executing
     */
    RUNNING,

    /**
     * Completed successfully (executed or served from cache)
     */
    COMPLETED,

    /**
     * Tried and exhausted its retries, or its deadline passed
     */
    FAILED,

    /**
     * Never attempted because a dependency failed
     */
    BLOCKED,

    /**
     * Explicitly stopped
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }
}
