package com.whereq.helios.scheduler;

import com.whereq.helios.cache.CacheManager;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.dto.ExecutionPlan;
import com.whereq.helios.dto.ProjectStatus;
import com.whereq.helios.dto.ResourceAllocation;
import com.whereq.helios.dto.TaskGraphRequest;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.exception.ProjectConflictException;
import com.whereq.helios.exception.ProjectNotFoundException;
import com.whereq.helios.executor.TaskExecutionResult;
import com.whereq.helios.executor.TaskExecutor;
import com.whereq.helios.governor.ResourceGovernor;
import com.whereq.helios.model.FailureReason;
import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.RetryPolicy;
import com.whereq.helios.model.Task;
import com.whereq.helios.model.TaskStatus;
import com.whereq.helios.router.EconomicRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs project task graphs wave by wave.
 *
 * Each task goes cache first, then governor admission, then the executor. Denied tasks wait and ask
 * again; executor failures are retried with exponential backoff up to the retry ceiling; a terminal
 * failure blocks every task that depends on it. All projects share one bounded worker pool.
 */
@Slf4j
@Service
public class HybridScheduler {

    private static final Duration MIN_ADMISSION_WAIT = Duration.ofMillis(10);

    private final TaskGraphPlanner planner;

    private final CacheManager cacheManager;

    private final ResourceGovernor governor;

    private final EconomicRouter router;

    private final TaskExecutor executor;

    private final ProjectStatusTracker statusTracker;

    private final Scheduler workerScheduler;

    private final Clock clock;

    private final HeliosProperties.SchedulerConfig config;

    private final RetryPolicy retryPolicy;

    private final Map<String, ProjectRun> runs = new ConcurrentHashMap<>();

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter blockedCounter;
    private final Counter cacheHitCounter;
    private final Timer executionTimer;

    public HybridScheduler(TaskGraphPlanner planner, CacheManager cacheManager, ResourceGovernor governor,
                           EconomicRouter router, TaskExecutor executor, ProjectStatusTracker statusTracker,
                           @Qualifier("heliosWorkerScheduler") Scheduler workerScheduler, Clock clock,
                           HeliosProperties properties, MeterRegistry meterRegistry) {
        this.planner = planner;
        this.cacheManager = cacheManager;
        this.governor = governor;
        this.router = router;
        this.executor = executor;
        this.statusTracker = statusTracker;
        this.workerScheduler = workerScheduler;
        this.clock = clock;
        this.config = properties.getScheduler();
        this.retryPolicy = RetryPolicy.from(config);

        completedCounter = Counter.builder("helios.tasks.completed")
            .description("Number of tasks completed")
            .register(meterRegistry);

        failedCounter = Counter.builder("helios.tasks.failed")
            .description("Number of tasks failed terminally")
            .register(meterRegistry);

        blockedCounter = Counter.builder("helios.tasks.blocked")
            .description("Number of tasks blocked by a failed dependency")
            .register(meterRegistry);

        cacheHitCounter = Counter.builder("helios.tasks.cache_hits")
            .description("Number of tasks completed from the cache")
            .register(meterRegistry);

        executionTimer = Timer.builder("helios.tasks.execution.time")
            .description("Task execution time")
            .register(meterRegistry);
    }

    /**
     * Validate a task graph and compute its waves
     *
     * @param request project submission
     * @return Mono with the execution plan; errors with an invalid-graph exception and creates nothing on a bad graph
     */
    public Mono<ExecutionPlan> scheduleProject(TaskGraphRequest request) {
        return Mono.fromCallable(() -> {
                TaskGraph graph = planner.plan(request);
                ProjectRun run = new ProjectRun(graph, clock.instant());
                runs.compute(graph.getProjectId(), (id, current) -> {
                    if (current != null && current.isExecuting()) {
                        throw new ProjectConflictException("Project " + id + " is executing");
                    }
                    return run;
                });
                return run;
            })
            .flatMap(run -> statusTracker.save(run.status(clock.instant()))
                .onErrorResume(e -> {
                    log.warn("Could not persist status of project {}: {}", run.projectId(), e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(toPlan(run.graph())))
            .doOnNext(plan -> log.info("Project {} scheduled: {} tasks in {} waves, ~{} min, ~{} cost units",
                plan.getProjectId(), plan.getTotalTasks(), plan.getWaves().size(),
                String.format("%.1f", plan.getEstimatedDurationMinutes()),
                String.format("%.1f", plan.getEstimatedCostUnits())));
    }

    /**
     * Run a scheduled project to completion
     *
     * @param projectId project identifier
     * @return Mono with the final status once every task is terminal
     */
    public Mono<ProjectStatus> executeProject(String projectId) {
        return Mono.defer(() -> {
            ProjectRun run = runs.get(projectId);
            if (run == null) {
                return Mono.error(new ProjectNotFoundException(projectId));
            }
            if (!run.startExecuting(clock.instant())) {
                return Mono.error(new ProjectConflictException("Project " + projectId + " is already executing"));
            }
            log.info("Executing project {} ({} waves)", projectId, run.graph().getWaves().size());

            return Flux.fromIterable(run.graph().getWaves())
                .concatMap(wave -> runWave(run, wave))
                .then(Mono.fromCallable(() -> {
                    run.stopExecuting(clock.instant());
                    return run.status(clock.instant());
                }))
                .flatMap(status -> saveStatus(status).thenReturn(status))
                .doOnNext(status -> log.info("Project {} finished: {} completed, {} failed, {} blocked, {} cancelled",
                    projectId, status.getCompleted(), status.getFailed(), status.getBlocked(), status.getCancelled()))
                .doOnError(e -> run.stopExecuting(clock.instant()));
        });
    }

    public Mono<ProjectStatus> getProjectStatus(String projectId) {
        return Mono.defer(() -> {
            ProjectRun run = runs.get(projectId);
            if (run != null) {
                return Mono.just(run.status(clock.instant()));
            }
            return statusTracker.load(projectId)
                .switchIfEmpty(Mono.error(new ProjectNotFoundException(projectId)));
        });
    }

    /**
     * Tasks of a project in submission order, while its run is held in memory
     */
    public Flux<Task> getTasks(String projectId) {
        return Mono.justOrEmpty(runs.get(projectId))
            .switchIfEmpty(Mono.error(new ProjectNotFoundException(projectId)))
            .flatMapMany(run -> Flux.fromIterable(run.graph().tasks()));
    }

    /**
     * Cancel every non-terminal task of a project. In-flight executions finish and their results are discarded.
     */
    public Mono<ProjectStatus> cancelProject(String projectId) {
        return Mono.defer(() -> {
            ProjectRun run = runs.get(projectId);
            if (run == null) {
                return Mono.error(new ProjectNotFoundException(projectId));
            }
            Instant now = clock.instant();
            run.markCancelled(now);
            int cancelled = 0;
            for (Task task : run.graph().tasks()) {
                boolean moved = run.transition(task, TaskStatus.CANCELLED, t -> {
                    t.setFailureReason(FailureReason.CANCELLED);
                    t.setCompletedAt(now);
                });
                if (moved) {
                    cancelled++;
                }
            }
            log.info("Project {} cancelled: {} tasks stopped", projectId, cancelled);
            ProjectStatus status = run.status(now);
            return saveStatus(status).thenReturn(status);
        });
    }

    /**
     * Drop runs that settled longer ago than the retention period, and runs never executed within the
     * status lifetime. Their status stays readable from the store.
     *
     * @return number of runs evicted
     */
    @Scheduled(fixedDelayString = "${helios.scheduler.run-sweep-interval:PT1M}")
    public int evictSettledRuns() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, ProjectRun> entry : runs.entrySet()) {
            ProjectRun run = entry.getValue();
            if (run.isEvictable(now, config.getFinishedRunRetention(), config.getStatusTtl())
                && runs.remove(entry.getKey(), run)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} settled project runs, {} in memory", evicted, runs.size());
        }
        return evicted;
    }

    private Mono<Void> runWave(ProjectRun run, List<String> wave) {
        List<Task> ready = new ArrayList<>();
        for (String taskId : wave) {
            Task task = run.graph().task(taskId);
            if (run.statusOf(task) != TaskStatus.PENDING) {
                continue;
            }
            String unmet = firstUnmetDependency(run, task);
            if (unmet != null) {
                block(run, task, unmet);
                continue;
            }
            ready.add(task);
        }
        return Flux.fromIterable(ready)
            .flatMap(task -> dispatch(run, task), config.getMaxParallel())
            .then();
    }

    /**
     * One pass through the task pipeline: deadline check, cache, admission
     */
    private Mono<Void> dispatch(ProjectRun run, Task task) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            if (task.isDeadlinePassed(now)) {
                fail(run, task, FailureReason.DEADLINE_EXCEEDED, "Deadline " + task.getDeadline() + " passed before dispatch");
                return Mono.empty();
            }
            if (!run.transition(task, TaskStatus.QUEUED, t -> t.setQueuedAt(now))) {
                return Mono.empty();
            }
            return lookupCache(task)
                .flatMap(hit -> hit.isHit() ? completeFromCache(run, task, hit) : admit(run, task, now));
        });
    }

    private Mono<CacheLookupResult> lookupCache(Task task) {
        if (task.getInput() == null) {
            return Mono.just(CacheLookupResult.miss());
        }
        CacheLookupRequest request = CacheLookupRequest.builder()
            .inputText(task.getInput())
            .taskType(task.getAgentType())
            .contextPrefix(task.getContextPrefix())
            .build();
        return cacheManager.lookup(request)
            .timeout(config.getCacheTimeout())
            .onErrorResume(e -> {
                log.warn("Cache lookup for task {} failed, treating as miss: {}", task.getTaskId(), e.toString());
                return Mono.just(CacheLookupResult.miss());
            });
    }

    private Mono<Void> completeFromCache(ProjectRun run, Task task, CacheLookupResult hit) {
        Instant now = clock.instant();
        boolean completed = run.transition(task, TaskStatus.COMPLETED, t -> {
            t.setResult(hit.getResponse());
            t.setServedFromCache(true);
            t.setCompletedAt(now);
        });
        if (completed) {
            completedCounter.increment();
            cacheHitCounter.increment();
            log.info("Task {} served from {} cache (confidence {})", task.getTaskId(), hit.getLevel(),
                String.format("%.2f", hit.getConfidence()));
        }
        return Mono.empty();
    }

    private Mono<Void> admit(ProjectRun run, Task task, Instant queuedSince) {
        return governor.requestResources(toResourceRequest(task))
            .timeout(config.getAdmissionTimeout())
            .map(allocation -> new AdmissionAttempt(allocation, null))
            .onErrorResume(e -> Mono.just(new AdmissionAttempt(null, e)))
            .flatMap(attempt -> {
                if (attempt.error != null) {
                    log.warn("Admission of task {} failed: {}", task.getTaskId(), describe(attempt.error));
                    return retryOrFail(run, task, "Admission failed: " + describe(attempt.error));
                }
                ResourceAllocation allocation = attempt.allocation;
                if (allocation.isAdmitted()) {
                    return execute(run, task, allocation);
                }
                return awaitAdmission(run, task, allocation, queuedSince);
            });
    }

    private Mono<Void> awaitAdmission(ProjectRun run, Task task, ResourceAllocation allocation, Instant queuedSince) {
        Instant now = clock.instant();
        if (run.statusOf(task).isTerminal()) {
            return Mono.empty();
        }
        if (task.isDeadlinePassed(now)) {
            fail(run, task, FailureReason.DEADLINE_EXCEEDED,
                "Deadline " + task.getDeadline() + " passed while waiting for admission: " + allocation.getReason());
            return Mono.empty();
        }
        if (Duration.between(queuedSince, now).compareTo(config.getMaxQueueWait()) > 0) {
            fail(run, task, FailureReason.ADMISSION_DENIED,
                "Not admitted within " + config.getMaxQueueWait() + ": " + allocation.getReason());
            return Mono.empty();
        }

        Duration wait = config.getAdmissionPollInterval();
        if (allocation.getRetryAfter() != null && allocation.getRetryAfter().isAfter(now)) {
            wait = min(wait, Duration.between(now, allocation.getRetryAfter()));
        }
        if (task.getDeadline() != null) {
            wait = min(wait, Duration.between(now, task.getDeadline()).plusMillis(1));
        }
        if (wait.compareTo(MIN_ADMISSION_WAIT) < 0) {
            wait = MIN_ADMISSION_WAIT;
        }

        log.debug("Task {} {} ({}), asking again in {}", task.getTaskId(), allocation.getOutcome(),
            allocation.getReason(), wait);
        return Mono.delay(wait)
            .then(Mono.defer(() -> run.statusOf(task).isTerminal() ? Mono.<Void>empty() : admit(run, task, queuedSince)));
    }

    private Mono<Void> execute(ProjectRun run, Task task, ResourceAllocation allocation) {
        ModelTier tier = allocation.getTier();
        Instant now = clock.instant();
        boolean started = run.transition(task, TaskStatus.RUNNING, t -> {
            t.setStartedAt(now);
            t.setAllocatedTier(tier);
        });
        if (!started) {
            return releaseReservation(task, tier);
        }

        return Mono.fromCallable(() -> {
                long startTime = System.nanoTime();
                try {
                    return executor.execute(task, tier);
                } finally {
                    executionTimer.record(Duration.ofNanos(System.nanoTime() - startTime));
                }
            })
            .subscribeOn(workerScheduler)
            .timeout(config.getExecutionTimeout())
            .onErrorResume(e -> Mono.just(TaskExecutionResult.failure(describe(e), 0)))
            .flatMap(result -> result.isSuccess()
                ? onSuccess(run, task, tier, result)
                : onFailure(run, task, tier, result));
    }

    private Mono<Void> onSuccess(ProjectRun run, Task task, ModelTier tier, TaskExecutionResult result) {
        long actualUnits = result.getActualUnits() > 0 ? result.getActualUnits() : task.getEstimatedUnits();
        return recordUsage(task, tier, actualUnits)
            .then(Mono.fromRunnable(() -> router.recordOutcome(task.getAgentType(), tier, true)))
            .then(Mono.defer(() -> {
                Instant now = clock.instant();
                boolean completed = run.transition(task, TaskStatus.COMPLETED, t -> {
                    t.setResult(result.getResult());
                    t.setErrorMessage(null);
                    t.setCompletedAt(now);
                });
                if (!completed) {
                    log.info("Task {} finished after its project was cancelled, result discarded", task.getTaskId());
                    return Mono.<Void>empty();
                }
                completedCounter.increment();
                log.info("Task {} completed on {} ({} units)", task.getTaskId(), tier, actualUnits);
                return storeInCache(task, result.getResult(), actualUnits * tier.getCostMultiplier());
            }));
    }

    private Mono<Void> onFailure(ProjectRun run, Task task, ModelTier tier, TaskExecutionResult result) {
        String message = result.getErrorMessage() != null ? result.getErrorMessage() : "Executor reported failure";
        return recordUsage(task, tier, Math.max(0, result.getActualUnits()))
            .then(Mono.fromRunnable(() -> router.recordOutcome(task.getAgentType(), tier, false)))
            .then(Mono.defer(() -> retryOrFail(run, task, message)));
    }

    /**
     * Re-queue a failed attempt after its backoff, or fail the task once the retry ceiling is reached
     */
    private Mono<Void> retryOrFail(ProjectRun run, Task task, String message) {
        int retryIndex = task.getRetryCount();
        if (retryIndex >= task.getMaxRetries()) {
            fail(run, task, FailureReason.EXECUTOR_FAILURE,
                message + " (gave up after " + task.getMaxRetries() + " retries)");
            return Mono.empty();
        }

        boolean requeued = run.transition(task, TaskStatus.QUEUED, t -> {
            t.setRetryCount(retryIndex + 1);
            t.setErrorMessage(message);
        });
        if (!requeued) {
            return Mono.empty();
        }

        Duration backoff = retryPolicy.backoff(retryIndex);
        log.warn("Task {} failed (attempt {}/{}): {}; retrying in {}", task.getTaskId(), retryIndex + 1,
            task.getMaxRetries() + 1, message, backoff);
        return Mono.delay(backoff)
            .then(Mono.defer(() -> dispatch(run, task)));
    }

    private void fail(ProjectRun run, Task task, FailureReason reason, String message) {
        Instant now = clock.instant();
        boolean failed = run.transition(task, TaskStatus.FAILED, t -> {
            t.setFailureReason(reason);
            t.setErrorMessage(message);
            t.setCompletedAt(now);
        });
        if (!failed) {
            return;
        }
        failedCounter.increment();
        log.warn("Task {} failed ({}): {}", task.getTaskId(), reason, message);

        for (String dependentId : run.graph().transitiveDependents(task.getTaskId())) {
            block(run, run.graph().task(dependentId), task.getTaskId());
        }
    }

    private void block(ProjectRun run, Task task, String failedDependency) {
        Instant now = clock.instant();
        boolean blocked = run.transition(task, TaskStatus.BLOCKED, t -> {
            t.setFailureReason(FailureReason.DEPENDENCY_FAILED);
            t.setErrorMessage("Dependency " + failedDependency + " did not complete");
            t.setCompletedAt(now);
        });
        if (blocked) {
            blockedCounter.increment();
            log.info("Task {} blocked by {}", task.getTaskId(), failedDependency);
        }
    }

    private String firstUnmetDependency(ProjectRun run, Task task) {
        for (String dep : task.getDependsOn()) {
            if (run.statusOf(run.graph().task(dep)) != TaskStatus.COMPLETED) {
                return dep;
            }
        }
        return null;
    }

    private Mono<Void> recordUsage(Task task, ModelTier tier, long units) {
        return governor.recordUsage(task.getProjectId(), task.getTaskId(), tier, units)
            .onErrorResume(e -> {
                log.error("Could not record usage of task {} ({} units on {}): {}", task.getTaskId(), units,
                    tier, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> releaseReservation(Task task, ModelTier tier) {
        log.info("Task {} stopped before dispatch, releasing its reservation", task.getTaskId());
        return recordUsage(task, tier, 0);
    }

    private Mono<Void> storeInCache(Task task, String response, double costUnits) {
        if (task.getInput() == null || response == null) {
            return Mono.empty();
        }
        CacheStoreRequest request = CacheStoreRequest.builder()
            .inputText(task.getInput())
            .response(response)
            .taskType(task.getAgentType())
            .contextPrefix(task.getContextPrefix())
            .costUnits(costUnits)
            .build();
        return cacheManager.store(request)
            .timeout(config.getCacheTimeout())
            .onErrorResume(e -> {
                log.warn("Could not cache result of task {}: {}", task.getTaskId(), e.toString());
                return Mono.empty();
            })
            .then();
    }

    private Mono<Void> saveStatus(ProjectStatus status) {
        return statusTracker.save(status)
            .onErrorResume(e -> {
                log.warn("Could not persist status of project {}: {}", status.getProjectId(), e.getMessage());
                return Mono.empty();
            });
    }

    private ExecutionPlan toPlan(TaskGraph graph) {
        double estimatedCost = graph.tasks().stream()
            .mapToDouble(t -> t.getEstimatedUnits() * (t.isRequiresHighCapability()
                ? ModelTier.HIGH_CAPABILITY.getCostMultiplier()
                : config.getOptionalTaskCostWeight()))
            .sum();

        double estimatedMinutes = 0.0;
        for (List<String> wave : graph.getWaves()) {
            estimatedMinutes += wave.stream()
                .mapToDouble(id -> graph.task(id).getEstimatedUnits() * config.getPlanMinutesPerUnit())
                .max()
                .orElse(0.0);
        }

        return ExecutionPlan.builder()
            .projectId(graph.getProjectId())
            .waves(graph.getWaves())
            .waveIndex(graph.getWaveIndex())
            .totalTasks(graph.size())
            .estimatedCostUnits(estimatedCost)
            .estimatedDurationMinutes(estimatedMinutes)
            .scheduledAt(clock.instant())
            .build();
    }

    private static TaskResourceRequest toResourceRequest(Task task) {
        return TaskResourceRequest.builder()
            .taskId(task.getTaskId())
            .projectId(task.getProjectId())
            .taskType(task.getAgentType())
            .estimatedUnits(task.getEstimatedUnits())
            .priority(task.getPriority())
            .requiresHighCapability(task.isRequiresHighCapability())
            .deadline(task.getDeadline())
            .build();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "Timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class AdmissionAttempt {
        final ResourceAllocation allocation;
        final Throwable error;

        AdmissionAttempt(ResourceAllocation allocation, Throwable error) {
            this.allocation = allocation;
            this.error = error;
        }
    }
}
