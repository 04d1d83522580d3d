package com.whereq.helios.model;

/**
 * Result of an admission request
 */
public enum AllocationOutcome {
    /**
     * Admitted now, units reserved against the window
     */
    ADMITTED,

    /**
     * Not admitted yet, to be retried; the request is held rather than refused
     */
    QUEUED,

    /**
     * Refused for the current window (budget exhausted or priority too low)
     */
    REJECTED
}
