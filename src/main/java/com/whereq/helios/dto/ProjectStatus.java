package com.whereq.helios.dto;

import com.whereq.helios.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Project progress report. Failed, blocked and cancelled tasks are counted separately.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectStatus {
    private String projectId;

    private int totalTasks;

    private int pending;

    private int queued;

    private int running;

    private int completed;

    private int failed;

    private int blocked;

    private int cancelled;

    /**
     * Completed tasks served from the cache
     */
    private int cacheHits;

    /**
     * Completed / total
     */
    private double completionRate;

    /**
     * Completed / (completed + failed)
     */
    private double successRate;

    private long elapsedSeconds;

    private boolean finished;

    private boolean cancelRequested;

    private Instant startedAt;

    private Instant finishedAt;

    private Map<String, TaskStatus> taskStatuses;
}
