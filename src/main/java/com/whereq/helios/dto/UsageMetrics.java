package com.whereq.helios.dto;

import com.whereq.helios.model.BudgetHealth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Usage metrics of the current window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageMetrics {
    private Instant timestamp;

    private String windowId;

    private double utilizationPercent;

    private BudgetHealth health;

    /**
     * Throughput since the window opened
     */
    private double unitsPerHour;

    private double highCapabilityPercent;

    private double economicalPercent;

    /**
     * Share of work run on the economical tier; higher is cheaper
     */
    private double costEfficiency;

    /**
     * Units weighted by tier cost multiplier
     */
    private double weightedCostUnits;

    private long admittedCount;

    private long queuedCount;

    private long rejectedCount;
}
