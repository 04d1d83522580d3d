package com.whereq.helios.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Admission request for a task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResourceRequest {
    /**
     * Task identifier, used to reconcile the reservation later
     */
    @NotBlank
    private String taskId;

    /**
     * Owning project
     */
    private String projectId;

    /**
     * Task/agent type, drives routing history
     */
    @NotBlank
    @Builder.Default
    private String taskType = "general";

    /**
     * Estimated cost in task-units
     */
    @Min(1)
    @Builder.Default
    private long estimatedUnits = 1;

    /**
     * Priority 0-10
     */
    @Min(0)
    @Max(10)
    @Builder.Default
    private int priority = 5;

    /**
     * Whether the task must run on the high-capability tier
     */
    private boolean requiresHighCapability;

    /**
     * Optional deadline
     */
    private Instant deadline;
}
