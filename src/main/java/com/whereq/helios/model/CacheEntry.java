package com.whereq.helios.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A cached response as persisted in the shared state store
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    /**
     * Content hash identifying the entry within its tier and task type
     */
    private String entryId;

    private CacheLevel level;

    /**
     * Task type tag; entries never match across task types
     */
    private String taskType;

    /**
     * Normalized input the response was produced for
     */
    private String inputText;

    private String response;

    /**
     * Cost units avoided each time the entry is reused
     */
    private double costUnits;

    /**
     * Input embedding (semantic tier only)
     */
    private double[] embedding;

    private Instant createdAt;

    private Instant expiresAt;

    private long accessCount;

    public boolean hasExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
