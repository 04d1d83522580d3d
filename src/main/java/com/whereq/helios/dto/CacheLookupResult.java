package com.whereq.helios.dto;

import com.whereq.helios.model.CacheLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a cache lookup; a miss is a normal result
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheLookupResult {
    private boolean hit;

    /**
     * Tier that served the hit
     */
    private CacheLevel level;

    private String response;

    /**
     * 1.0 for exact tiers, the cosine similarity for the semantic tier
     */
    private double confidence;

    /**
     * Estimated cost units avoided by the hit
     */
    private double costAvoided;

    private String entryId;

    private long lookupTimeMs;

    public static CacheLookupResult miss() {
        return CacheLookupResult.builder().hit(false).build();
    }
}
