package com.whereq.helios.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A schedulable unit of agent work.
 * Mutated only by the scheduler pipeline that owns the task's project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    /**
     * Unique task identifier within the project
     */
    private String taskId;

    /**
     * Project this task belongs to
     */
    private String projectId;

    /**
     * Human-readable task name
     */
    private String name;

    /**
     * Type of agent/executor; also the cache isolation tag and the routing history key
     */
    private String agentType;

    /**
     * Task input handed to the executor and used as the cache key
     */
    private String input;

    /**
     * Optional reusable context prefix (system prompt, shared instructions)
     */
    private String contextPrefix;

    @Builder.Default
    private long estimatedUnits = 1;

    @Builder.Default
    private int priority = 5;

    /**
     * Whether the task must run on the high-capability tier
     */
    private boolean requiresHighCapability;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private int maxRetries = 3;

    private Instant deadline;

    private ModelTier allocatedTier;

    private String result;

    private boolean servedFromCache;

    private String errorMessage;

    private FailureReason failureReason;

    private Instant queuedAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Dynamic priority: declared priority plus a deadline urgency bonus, minus a retry penalty
     *
     * @param now current time
     * @return score, higher runs first
     */
    public double priorityScore(Instant now) {
        double score = priority;

        if (deadline != null) {
            double hoursRemaining = Duration.between(now, deadline).toMillis() / 3_600_000.0;
            if (hoursRemaining < 1) {
                score += 5.0;
            } else if (hoursRemaining < 6) {
                score += 3.0;
            } else if (hoursRemaining < 24) {
                score += 1.5;
            } else if (hoursRemaining < 48) {
                score += 0.5;
            }
        }

        score -= retryCount * 0.5;
        return Math.max(0.0, score);
    }

    public boolean isDeadlinePassed(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
