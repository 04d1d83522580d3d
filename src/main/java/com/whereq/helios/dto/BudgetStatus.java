package com.whereq.helios.dto;

import com.whereq.helios.model.BudgetHealth;
import com.whereq.helios.model.UsageWindow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only snapshot of the current usage window, computed on demand
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetStatus {
    private String windowId;

    private Instant windowStart;

    private Instant windowEnd;

    private long ceiling;

    private long usedUnits;

    private long highCapabilityUnits;

    private long economicalUnits;

    private long remainingUnits;

    private double utilizationPercent;

    private BudgetHealth health;

    /**
     * Whether throttling is active (threshold reached or forced manually)
     */
    private boolean throttling;

    private String throttleReason;

    private long secondsRemaining;

    /**
     * Derive a status snapshot from a window
     *
     * @param window current window
     * @param manualThrottleReason reason of a manual throttle, {@code null} if none
     * @param now current time
     * @param throttleThreshold throttle threshold percentage
     * @param criticalThreshold critical threshold percentage
     */
    public static BudgetStatus of(UsageWindow window, String manualThrottleReason, Instant now,
                                  double throttleThreshold, double criticalThreshold) {
        double utilization = window.utilizationPercent();
        BudgetHealth health = BudgetHealth.classify(utilization, throttleThreshold, criticalThreshold);

        String reason = null;
        if (health != BudgetHealth.NORMAL) {
            reason = String.format("Current window at %.1f%% capacity", utilization);
        } else if (manualThrottleReason != null) {
            reason = "Manual: " + manualThrottleReason;
        }

        return BudgetStatus.builder()
            .windowId(window.getWindowId())
            .windowStart(window.getStartTime())
            .windowEnd(window.getEndTime())
            .ceiling(window.getCeiling())
            .usedUnits(window.usedUnits())
            .highCapabilityUnits(window.getHighCapabilityUnits())
            .economicalUnits(window.getEconomicalUnits())
            .remainingUnits(window.remainingUnits())
            .utilizationPercent(utilization)
            .health(health)
            .throttling(reason != null)
            .throttleReason(reason)
            .secondsRemaining(Math.max(0, Duration.between(now, window.getEndTime()).getSeconds()))
            .build();
    }
}
