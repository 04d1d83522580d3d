package com.whereq.helios.model;

import com.whereq.helios.config.HeliosProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

/**
 * Backoff between attempts of a failed task. The retry ceiling lives on each {@link Task}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 1000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    public static RetryPolicy from(HeliosProperties.SchedulerConfig config) {
        return RetryPolicy.builder()
            .initialIntervalMs(config.getInitialBackoff().toMillis())
            .backoffMultiplier(config.getBackoffMultiplier())
            .maxIntervalMs(config.getMaxBackoff().toMillis())
            .build();
    }

    /**
     * Exponential backoff before the given retry (0-based), capped at the maximum interval
     */
    public Duration backoff(int retryIndex) {
        long backoff = (long) (initialIntervalMs * Math.pow(backoffMultiplier, Math.max(0, retryIndex)));
        return Duration.ofMillis(Math.min(backoff, maxIntervalMs));
    }
}
