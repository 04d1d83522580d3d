package com.whereq.helios.model;

/**
 * Backend capability tiers a task can be routed to
 */
public enum ModelTier {
    /**
     * Most capable backend, roughly five times the cost of the economical tier
     */
    HIGH_CAPABILITY(5.0),

    /**
     * Cheaper backend, sufficient for most routine work
     */
    ECONOMICAL(1.0);

    private final double costMultiplier;

    ModelTier(double costMultiplier) {
        this.costMultiplier = costMultiplier;
    }

    /**
     * Relative cost of one unit on this tier
     */
    public double getCostMultiplier() {
        return costMultiplier;
    }
}
