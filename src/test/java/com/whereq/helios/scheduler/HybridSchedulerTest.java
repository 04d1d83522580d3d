package com.whereq.helios.scheduler;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.dto.ExecutionPlan;
import com.whereq.helios.dto.ProjectStatus;
import com.whereq.helios.dto.TaskGraphRequest;
import com.whereq.helios.exception.CyclicDependencyException;
import com.whereq.helios.exception.ProjectConflictException;
import com.whereq.helios.exception.ProjectNotFoundException;
import com.whereq.helios.executor.TaskExecutionResult;
import com.whereq.helios.executor.TaskExecutor;
import com.whereq.helios.model.FailureReason;
import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.Task;
import com.whereq.helios.model.TaskStatus;
import com.whereq.helios.support.HeliosFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static com.whereq.helios.scheduler.TaskGraphPlannerTest.request;
import static org.junit.jupiter.api.Assertions.*;

class HybridSchedulerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private HeliosFixture fixture;

    private ScriptedExecutor executor;

    private HybridScheduler scheduler;

    @BeforeEach
    void setUp() {
        setUp(p -> {
        });
    }

    private void setUp(Consumer<HeliosProperties> customizer) {
        fixture = HeliosFixture.create(p -> {
            p.getScheduler().setInitialBackoff(Duration.ofMillis(1));
            p.getScheduler().setMaxBackoff(Duration.ofMillis(10));
            p.getScheduler().setAdmissionPollInterval(Duration.ofMillis(20));
            customizer.accept(p);
        });
        executor = new ScriptedExecutor();
        scheduler = newScheduler();
    }

    private HybridScheduler newScheduler() {
        return new HybridScheduler(
            new TaskGraphPlanner(fixture.clock, fixture.properties),
            fixture.cacheManager,
            fixture.governor,
            fixture.router,
            executor,
            new ProjectStatusTracker(fixture.store, fixture.objectMapper, fixture.properties),
            Schedulers.boundedElastic(),
            fixture.clock,
            fixture.properties,
            fixture.meterRegistry);
    }

    @Test
    @DisplayName("A linear chain runs in dependency order and caches every result")
    void linearChainCompletes() {
        ExecutionPlan plan = scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"),
            spec("C", "Write integration tests", "B"))).block();

        assertEquals(List.of(List.of("A"), List.of("B"), List.of("C")), plan.getWaves());
        assertEquals(3, plan.getTotalTasks());

        ProjectStatus status = scheduler.executeProject("p1").block(TIMEOUT);

        assertTrue(status.isFinished());
        assertEquals(3, status.getCompleted());
        assertEquals(1.0, status.getCompletionRate());
        assertEquals(List.of("A", "B", "C"), executor.calls);
        assertEquals(9, fixture.governor.getBudgetStatus().block().getUsedUnits());
        assertEquals("done: Implement the storage layer", task("p1", "B").getResult());
        assertEquals(3.0, fixture.meterRegistry.counter("helios.tasks.completed").count());

        assertTrue(fixture.cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Write integration tests").taskType("general").build()).block().isHit());
    }

    @Test
    @DisplayName("The plan estimates duration by the slowest task of each wave and weights optional work")
    void planEstimatesDurationAndCost() {
        TaskGraphRequest.TaskSpec a = spec("A", "Design the schema");
        a.setEstimatedUnits(4);
        a.setRequiresHighCapability(true);
        TaskGraphRequest.TaskSpec b = spec("B", "Outline the docs");
        b.setEstimatedUnits(2);
        TaskGraphRequest.TaskSpec c = spec("C", "Implement the schema", "A");
        TaskGraphRequest.TaskSpec d = spec("D", "Write the docs", "B");
        d.setEstimatedUnits(5);

        ExecutionPlan plan = scheduler.scheduleProject(request("p1", a, b, c, d)).block();

        assertEquals(2, plan.getWaves().size());
        // waves take 4 x 2 and 5 x 2 minutes
        assertEquals(18.0, plan.getEstimatedDurationMinutes(), 1e-9);
        // 4 x 5.0 mandatory plus (2 + 3 + 5) x 1.5 optional
        assertEquals(35.0, plan.getEstimatedCostUnits(), 1e-9);
    }

    @Test
    @DisplayName("Plan estimates follow the configured minutes per unit and optional weight")
    void planEstimatesAreConfigurable() {
        setUp(p -> {
            p.getScheduler().setPlanMinutesPerUnit(0.5);
            p.getScheduler().setOptionalTaskCostWeight(1.0);
        });

        ExecutionPlan plan = scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"))).block();

        assertEquals(3.0, plan.getEstimatedDurationMinutes(), 1e-9);
        assertEquals(6.0, plan.getEstimatedCostUnits(), 1e-9);
    }

    @Test
    @DisplayName("A terminal failure blocks every transitive dependent and nothing else")
    void failureBlocksDependents() {
        setUp(p -> p.getScheduler().setMaxRetries(1));
        executor.failing.add("A");

        scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"),
            spec("C", "Write integration tests", "B"),
            spec("D", "Summarize the release notes"))).block();

        ProjectStatus status = scheduler.executeProject("p1").block(TIMEOUT);

        Task a = task("p1", "A");
        assertEquals(TaskStatus.FAILED, a.getStatus());
        assertEquals(FailureReason.EXECUTOR_FAILURE, a.getFailureReason());
        assertEquals(1, a.getRetryCount());
        assertEquals(2, executor.attempts("A"));

        for (String id : List.of("B", "C")) {
            Task blocked = task("p1", id);
            assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
            assertEquals(FailureReason.DEPENDENCY_FAILED, blocked.getFailureReason());
            assertEquals(0, executor.attempts(id));
        }
        assertEquals(TaskStatus.COMPLETED, task("p1", "D").getStatus());

        assertEquals(1, status.getFailed());
        assertEquals(2, status.getBlocked());
        assertEquals(1, status.getCompleted());
        assertEquals(0.5, status.getSuccessRate());
    }

    @Test
    @DisplayName("A failed attempt is retried after backoff")
    void flakyTaskIsRetried() {
        executor.failuresBeforeSuccess.put("A", 2);
        scheduler.scheduleProject(request("p1", spec("A", "Draft the product requirements"))).block();

        scheduler.executeProject("p1").block(TIMEOUT);

        Task a = task("p1", "A");
        assertEquals(TaskStatus.COMPLETED, a.getStatus());
        assertEquals(2, a.getRetryCount());
        assertEquals(3, executor.attempts("A"));
        // failed attempts report one unit each
        assertEquals(5, fixture.governor.getBudgetStatus().block().getUsedUnits());
    }

    @Test
    @DisplayName("A cached response completes the task without admission or execution")
    void cacheHitSkipsExecution() {
        fixture.cacheManager.store(CacheStoreRequest.builder()
            .inputText("Draft the product requirements").response("cached PRD").taskType("general").build()).block();
        scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"))).block();

        ProjectStatus status = scheduler.executeProject("p1").block(TIMEOUT);

        Task a = task("p1", "A");
        assertEquals(TaskStatus.COMPLETED, a.getStatus());
        assertTrue(a.isServedFromCache());
        assertEquals("cached PRD", a.getResult());
        assertEquals(List.of("B"), executor.calls);
        assertEquals(1, status.getCacheHits());
        assertEquals(3, fixture.governor.getBudgetStatus().block().getUsedUnits());
    }

    @Test
    @DisplayName("A result without reported usage is charged its estimate")
    void missingUsageFallsBackToEstimate() {
        executor.reportedUnits = 0;
        TaskGraphRequest.TaskSpec a = spec("A", "Draft the product requirements");
        a.setEstimatedUnits(7);
        scheduler.scheduleProject(request("p1", a)).block();

        scheduler.executeProject("p1").block(TIMEOUT);

        assertEquals(7, fixture.governor.getBudgetStatus().block().getUsedUnits());
    }

    @Test
    @DisplayName("A task past its deadline fails before dispatch and blocks its dependents")
    void deadlinePassedBeforeDispatch() {
        TaskGraphRequest.TaskSpec a = spec("A", "Draft the product requirements");
        a.setDeadline(fixture.clock.instant().minus(Duration.ofMinutes(1)));
        scheduler.scheduleProject(request("p1", a, spec("B", "Implement the storage layer", "A"))).block();

        scheduler.executeProject("p1").block(TIMEOUT);

        assertEquals(FailureReason.DEADLINE_EXCEEDED, task("p1", "A").getFailureReason());
        assertEquals(TaskStatus.BLOCKED, task("p1", "B").getStatus());
        assertTrue(executor.calls.isEmpty());
    }

    @Test
    @DisplayName("A queued task fails once its deadline passes while waiting for admission")
    void deadlinePassesWhileQueued() {
        fixture.governor.forceThrottle("maintenance").block();
        TaskGraphRequest.TaskSpec a = spec("A", "Draft the product requirements");
        a.setRequiresHighCapability(true);
        a.setDeadline(fixture.clock.instant().plus(Duration.ofHours(1)));
        scheduler.scheduleProject(request("p1", a)).block();

        fixture.clock.tickOnRead(Duration.ofMinutes(5));
        scheduler.executeProject("p1").block(TIMEOUT);

        Task task = task("p1", "A");
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals(FailureReason.DEADLINE_EXCEEDED, task.getFailureReason());
        assertTrue(executor.calls.isEmpty());
    }

    @Test
    @DisplayName("A queued task gives up after the longest admission wait")
    void admissionWaitIsBounded() {
        setUp(p -> p.getScheduler().setMaxQueueWait(Duration.ofMinutes(30)));
        fixture.governor.forceThrottle("maintenance").block();
        TaskGraphRequest.TaskSpec a = spec("A", "Draft the product requirements");
        a.setRequiresHighCapability(true);
        scheduler.scheduleProject(request("p1", a)).block();

        fixture.clock.tickOnRead(Duration.ofMinutes(5));
        scheduler.executeProject("p1").block(TIMEOUT);

        assertEquals(FailureReason.ADMISSION_DENIED, task("p1", "A").getFailureReason());
        assertTrue(executor.calls.isEmpty());
    }

    @Test
    @DisplayName("Cancellation stops pending work and discards in-flight results")
    void cancellation() throws Exception {
        executor.gate = new CountDownLatch(1);
        scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"))).block();

        CompletableFuture<ProjectStatus> run = scheduler.executeProject("p1").toFuture();
        assertTrue(executor.started.await(10, TimeUnit.SECONDS));

        StepVerifier.create(scheduler.executeProject("p1")).expectError(ProjectConflictException.class).verify(TIMEOUT);
        StepVerifier.create(scheduler.scheduleProject(request("p1", spec("X", "Anything"))))
            .expectError(ProjectConflictException.class)
            .verify(TIMEOUT);

        ProjectStatus cancelled = scheduler.cancelProject("p1").block(TIMEOUT);
        assertTrue(cancelled.isCancelRequested());
        assertEquals(2, cancelled.getCancelled());

        executor.gate.countDown();
        ProjectStatus finalStatus = run.get(10, TimeUnit.SECONDS);

        assertEquals(2, finalStatus.getCancelled());
        assertEquals(0, finalStatus.getCompleted());
        assertEquals(FailureReason.CANCELLED, task("p1", "A").getFailureReason());
        assertEquals(List.of("A"), executor.calls);
        assertFalse(fixture.cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Draft the product requirements").taskType("general").build()).block().isHit());
    }

    @Test
    @DisplayName("Concurrent projects reusing task ids are charged exactly what they used")
    void concurrentProjectsShareTaskIds() throws Exception {
        executor.reportedUnits = 1;
        executor.started = new CountDownLatch(2);
        executor.gate = new CountDownLatch(1);
        for (String projectId : List.of("p1", "p2")) {
            scheduler.scheduleProject(request(projectId,
                spec("A", "Draft the requirements of " + projectId),
                spec("B", "Implement the design of " + projectId, "A"))).block();
        }

        CompletableFuture<ProjectStatus> first = scheduler.executeProject("p1").toFuture();
        CompletableFuture<ProjectStatus> second = scheduler.executeProject("p2").toFuture();
        assertTrue(executor.started.await(10, TimeUnit.SECONDS));
        // both A tasks hold a reservation at this point
        assertEquals(6, fixture.governor.getBudgetStatus().block().getUsedUnits());
        executor.gate.countDown();

        assertEquals(2, first.get(10, TimeUnit.SECONDS).getCompleted());
        assertEquals(2, second.get(10, TimeUnit.SECONDS).getCompleted());
        assertEquals(4, fixture.governor.getBudgetStatus().block().getUsedUnits());
        assertEquals(List.of(), fixture.store.keys("governor:reservation:").collectList().block());
    }

    @Test
    @DisplayName("A settled project leaves memory after the retention period but keeps its status")
    void settledRunsAreEvicted() {
        scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"))).block();
        scheduler.executeProject("p1").block(TIMEOUT);

        assertEquals(0, scheduler.evictSettledRuns());
        assertEquals(TaskStatus.COMPLETED, task("p1", "B").getStatus());

        fixture.clock.advance(Duration.ofHours(1));
        assertEquals(1, scheduler.evictSettledRuns());

        StepVerifier.create(scheduler.getTasks("p1")).expectError(ProjectNotFoundException.class).verify(TIMEOUT);
        ProjectStatus restored = scheduler.getProjectStatus("p1").block(TIMEOUT);
        assertEquals(2, restored.getCompleted());
        assertTrue(restored.isFinished());

        scheduler.scheduleProject(request("p1", spec("C", "Write integration tests"))).block();
        assertEquals(1, scheduler.getProjectStatus("p1").block(TIMEOUT).getPending());
    }

    @Test
    @DisplayName("A scheduled project is kept until it has been idle for the status lifetime")
    void idleRunsAreEvictedAfterStatusLifetime() {
        scheduler.scheduleProject(request("p1", spec("A", "Draft the product requirements"))).block();
        scheduler.scheduleProject(request("p2", spec("A", "Draft the product requirements"))).block();
        scheduler.cancelProject("p2").block(TIMEOUT);

        fixture.clock.advance(Duration.ofHours(1));
        assertEquals(1, scheduler.evictSettledRuns());
        assertEquals(TaskStatus.PENDING, task("p1", "A").getStatus());

        fixture.clock.advance(Duration.ofDays(7));
        assertEquals(1, scheduler.evictSettledRuns());
        StepVerifier.create(scheduler.executeProject("p1")).expectError(ProjectNotFoundException.class).verify(TIMEOUT);
    }

    @Test
    @DisplayName("An invalid graph creates no project")
    void invalidGraphCreatesNothing() {
        StepVerifier.create(scheduler.scheduleProject(request("p1",
                spec("A", "one", "C"),
                spec("B", "two", "A"),
                spec("C", "three", "B"))))
            .expectError(CyclicDependencyException.class)
            .verify(TIMEOUT);

        StepVerifier.create(scheduler.getProjectStatus("p1")).expectError(ProjectNotFoundException.class).verify(TIMEOUT);
        StepVerifier.create(scheduler.executeProject("p1")).expectError(ProjectNotFoundException.class).verify(TIMEOUT);
        StepVerifier.create(scheduler.cancelProject("p1")).expectError(ProjectNotFoundException.class).verify(TIMEOUT);
    }

    @Test
    @DisplayName("Final status survives in the shared store")
    void statusIsPersisted() {
        scheduler.scheduleProject(request("p1",
            spec("A", "Draft the product requirements"),
            spec("B", "Implement the storage layer", "A"))).block();
        scheduler.executeProject("p1").block(TIMEOUT);

        ProjectStatus restored = newScheduler().getProjectStatus("p1").block(TIMEOUT);

        assertEquals("p1", restored.getProjectId());
        assertEquals(2, restored.getCompleted());
        assertTrue(restored.isFinished());
        assertEquals(TaskStatus.COMPLETED, restored.getTaskStatuses().get("B"));
    }

    @Test
    @DisplayName("A wave never runs more tasks at once than the parallelism limit")
    void parallelismIsBounded() {
        setUp(p -> p.getScheduler().setMaxParallel(3));
        executor.delayMillis = 30;
        List<TaskGraphRequest.TaskSpec> specs = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            specs.add(spec("T" + i, "Task number " + i + " about topic " + i));
        }
        scheduler.scheduleProject(request("p1", specs.toArray(new TaskGraphRequest.TaskSpec[0]))).block();

        ProjectStatus status = scheduler.executeProject("p1").block(TIMEOUT);

        assertEquals(12, status.getCompleted());
        assertTrue(executor.maxConcurrent.get() <= 3, "observed " + executor.maxConcurrent.get());
    }

    private Task task(String projectId, String taskId) {
        return scheduler.getTasks(projectId)
            .filter(t -> t.getTaskId().equals(taskId))
            .blockFirst(TIMEOUT);
    }

    private static TaskGraphRequest.TaskSpec spec(String taskId, String input, String... dependsOn) {
        return TaskGraphRequest.TaskSpec.builder()
            .taskId(taskId)
            .agentType("general")
            .input(input)
            .estimatedUnits(3)
            .dependsOn(new ArrayList<>(List.of(dependsOn)))
            .build();
    }

    /**
     * Executor whose behavior per task is set by each test
     */
    private static final class ScriptedExecutor implements TaskExecutor {

        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        final List<String> failing = Collections.synchronizedList(new ArrayList<>());

        final Map<String, Integer> failuresBeforeSuccess = new ConcurrentHashMap<>();

        final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

        volatile CountDownLatch started = new CountDownLatch(1);

        final AtomicInteger running = new AtomicInteger();

        final AtomicInteger maxConcurrent = new AtomicInteger();

        volatile CountDownLatch gate;

        volatile long reportedUnits = 3;

        volatile long delayMillis;

        @Override
        public TaskExecutionResult execute(Task task, ModelTier tier) throws Exception {
            int attempt = attempts.computeIfAbsent(task.getTaskId(), k -> new AtomicInteger()).incrementAndGet();
            calls.add(task.getTaskId());
            maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
            started.countDown();
            try {
                if (gate != null) {
                    gate.await(10, TimeUnit.SECONDS);
                }
                if (delayMillis > 0) {
                    Thread.sleep(delayMillis);
                }
                if (failing.contains(task.getTaskId())) {
                    throw new IllegalStateException("backend error for " + task.getTaskId());
                }
                if (attempt <= failuresBeforeSuccess.getOrDefault(task.getTaskId(), 0)) {
                    return TaskExecutionResult.failure("transient failure", 1);
                }
                return TaskExecutionResult.success("done: " + task.getInput(), reportedUnits);
            } finally {
                running.decrementAndGet();
            }
        }

        int attempts(String taskId) {
            AtomicInteger count = attempts.get(taskId);
            return count == null ? 0 : count.get();
        }
    }
}
