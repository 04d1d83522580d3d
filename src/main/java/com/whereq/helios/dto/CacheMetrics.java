package com.whereq.helios.dto;

import com.whereq.helios.model.CacheLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Cache effectiveness since startup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheMetrics {
    private long totalLookups;

    private long totalHits;

    private double aggregateHitRate;

    private long entriesStored;

    private double costSaved;

    private Map<CacheLevel, TierMetrics> tiers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierMetrics {
        private boolean enabled;
        private long lookups;
        private long hits;
        private double hitRate;
        private long entriesStored;
        private double costSaved;
    }
}
