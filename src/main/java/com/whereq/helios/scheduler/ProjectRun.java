package com.whereq.helios.scheduler;

import com.whereq.helios.dto.ProjectStatus;
import com.whereq.helios.model.Task;
import com.whereq.helios.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Execution state of one scheduled project.
 * All task transitions go through {@link #transition} so a cancelled or finished task never moves again.
 */
public final class ProjectRun {

    private final TaskGraph graph;

    private final Instant scheduledAt;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile boolean cancelled;

    private volatile Instant startedAt;

    private volatile Instant finishedAt;

    private volatile Instant lastActivity;

    ProjectRun(TaskGraph graph, Instant scheduledAt) {
        this.graph = graph;
        this.scheduledAt = scheduledAt;
        this.lastActivity = scheduledAt;
    }

    public TaskGraph graph() {
        return graph;
    }

    public String projectId() {
        return graph.getProjectId();
    }

    /**
     * Move a task to a new status unless it already reached a terminal one
     *
     * @param task task of this project
     * @param status target status
     * @param mutation extra field updates applied under the same lock
     * @return true if the transition happened
     */
    public synchronized boolean transition(Task task, TaskStatus status, Consumer<Task> mutation) {
        if (task.getStatus().isTerminal()) {
            return false;
        }
        if (cancelled && status != TaskStatus.CANCELLED) {
            return false;
        }
        task.setStatus(status);
        mutation.accept(task);
        return true;
    }

    public synchronized TaskStatus statusOf(Task task) {
        return task.getStatus();
    }

    boolean startExecuting(Instant now) {
        if (!executing.compareAndSet(false, true)) {
            return false;
        }
        if (startedAt == null) {
            startedAt = now;
        }
        lastActivity = now;
        return true;
    }

    void stopExecuting(Instant now) {
        finishedAt = now;
        lastActivity = now;
        executing.set(false);
    }

    public boolean isExecuting() {
        return executing.get();
    }

    void markCancelled(Instant now) {
        cancelled = true;
        lastActivity = now;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Whether the run can be dropped from memory: idle, and either settled for the retention period
     * or never executed within the idle limit
     */
    synchronized boolean isEvictable(Instant now, Duration retention, Duration idleLimit) {
        if (executing.get()) {
            return false;
        }
        boolean settled = graph.tasks().stream().allMatch(t -> t.getStatus().isTerminal());
        if (settled) {
            return !now.isBefore(lastActivity.plus(retention));
        }
        return startedAt == null && !now.isBefore(lastActivity.plus(idleLimit));
    }

    /**
     * Snapshot of the run's progress
     */
    public synchronized ProjectStatus status(Instant now) {
        Map<String, TaskStatus> statuses = new LinkedHashMap<>();
        int pending = 0;
        int queued = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        int blocked = 0;
        int cancelledCount = 0;
        int cacheHits = 0;

        for (Task task : graph.tasks()) {
            statuses.put(task.getTaskId(), task.getStatus());
            switch (task.getStatus()) {
                case PENDING -> pending++;
                case QUEUED -> queued++;
                case RUNNING -> running++;
                case COMPLETED -> {
                    completed++;
                    if (task.isServedFromCache()) {
                        cacheHits++;
                    }
                }
                case FAILED -> failed++;
                case BLOCKED -> blocked++;
                case CANCELLED -> cancelledCount++;
            }
        }

        int total = graph.size();
        boolean finished = pending + queued + running == 0;
        Instant start = startedAt != null ? startedAt : scheduledAt;
        Instant end = finished && finishedAt != null ? finishedAt : now;

        return ProjectStatus.builder()
            .projectId(projectId())
            .totalTasks(total)
            .pending(pending)
            .queued(queued)
            .running(running)
            .completed(completed)
            .failed(failed)
            .blocked(blocked)
            .cancelled(cancelledCount)
            .cacheHits(cacheHits)
            .completionRate(total > 0 ? (double) completed / total : 0.0)
            .successRate(completed + failed > 0 ? (double) completed / (completed + failed) : 0.0)
            .elapsedSeconds(startedAt == null ? 0 : Math.max(0, Duration.between(start, end).getSeconds()))
            .finished(finished)
            .cancelRequested(cancelled)
            .startedAt(startedAt)
            .finishedAt(finished ? finishedAt : null)
            .taskStatuses(statuses)
            .build();
    }
}
