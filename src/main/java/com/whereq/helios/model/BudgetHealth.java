package com.whereq.helios.model;

/**
 * Health classification of the current usage window
 */
public enum BudgetHealth {
    /**
     * Below the throttle threshold, routing decides the tier
     */
    NORMAL,

    /**
     * Between the throttle and critical thresholds, high-capability work is downgraded or queued
     */
    THROTTLED,

    /**
     * Above the critical threshold, only high-priority work is admitted
     */
    CRITICAL;

    /**
     * Classify a utilization percentage
     *
     * @param utilizationPercent current utilization (0-100)
     * @param throttleThreshold percentage at which throttling starts
     * @param criticalThreshold percentage above which the window is critical
     * @return the health level
     */
    public static BudgetHealth classify(double utilizationPercent, double throttleThreshold, double criticalThreshold) {
        if (utilizationPercent > criticalThreshold) {
            return CRITICAL;
        }
        if (utilizationPercent >= throttleThreshold) {
            return THROTTLED;
        }
        return NORMAL;
    }
}
