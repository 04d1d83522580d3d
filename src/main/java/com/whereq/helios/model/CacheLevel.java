package com.whereq.helios.model;

/**
 * Cache tiers, in waterfall order
 */
public enum CacheLevel {
    /**
     * Short-lived association keyed by a reusable context prefix
     */
    L1_CONTEXT("l1"),

    /**
     * Exact match on the normalized input
     */
    L2_EXACT("l2"),

    /**
     * Approximate match on the input embedding
     */
    L3_SEMANTIC("l3");

    private final String keySegment;

    CacheLevel(String keySegment) {
        this.keySegment = keySegment;
    }

    public String getKeySegment() {
        return keySegment;
    }
}
