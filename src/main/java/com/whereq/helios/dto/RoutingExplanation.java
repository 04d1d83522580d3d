package com.whereq.helios.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Component scores and weights behind a routing decision
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingExplanation {
    private RoutingDecision decision;

    private String complexityLevel;

    private Factor complexity;

    private Factor budgetHeadroom;

    private Factor history;

    private Factor priority;

    private double decisionScore;

    private Map<String, Double> thresholds;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Factor {
        private double score;
        private double weight;
    }
}
