package com.whereq.helios.dto;

import com.whereq.helios.model.ModelTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tier recommendation of the economic router
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {
    private ModelTier tier;

    private double confidence;

    private double decisionScore;

    private double complexityScore;

    private String reasoning;
}
