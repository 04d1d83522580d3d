package com.whereq.helios.dto;

import com.whereq.helios.model.AllocationOutcome;
import com.whereq.helios.model.ModelTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Admission decision of the resource governor
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceAllocation {
    private String taskId;

    /**
     * Whether the task may run now
     */
    private boolean admitted;

    private AllocationOutcome outcome;

    /**
     * Tier granted (admitted only)
     */
    private ModelTier tier;

    /**
     * Units provisionally reserved against the window
     */
    private long reservedUnits;

    /**
     * Why this decision was made
     */
    private String reason;

    /**
     * When to try again (not admitted only)
     */
    private Instant retryAfter;

    /**
     * Seconds until {@link #retryAfter}
     */
    private long retryAfterSeconds;

    private String windowId;

    private Instant decidedAt;

    /**
     * Whether the tier came from the economic router rather than a zone rule
     */
    private boolean routed;
}
