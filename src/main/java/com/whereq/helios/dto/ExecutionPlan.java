package com.whereq.helios.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wave assignment of a scheduled project
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPlan {
    private String projectId;

    /**
     * Task ids per wave, each wave ordered by dynamic priority
     */
    private List<List<String>> waves;

    /**
     * Wave index of every task
     */
    private Map<String, Integer> waveIndex;

    private int totalTasks;

    /**
     * Weighted cost estimate; optional tasks are weighted between the two tiers
     */
    private double estimatedCostUnits;

    /**
     * Sum over waves of each wave's longest task
     */
    private double estimatedDurationMinutes;

    private Instant scheduledAt;
}
