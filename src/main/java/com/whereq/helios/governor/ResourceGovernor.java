package com.whereq.helios.governor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.BudgetStatus;
import com.whereq.helios.dto.ResourceAllocation;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.dto.UsageMetrics;
import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.UsageWindow;
import com.whereq.helios.store.SharedStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks and enforces the rolling-window budget.
 *
 * Admission and the reservation it implies are one compare-and-swap on the window record, so
 * concurrent callers can never commit the same remaining units twice. Denials are ordinary results.
 */
@Slf4j
@Service
public class ResourceGovernor {

    static final String THROTTLE_KEY = "governor:throttle";
    static final String RESERVATION_KEY_PREFIX = "governor:reservation:";

    private final UsageWindowStore windowStore;

    private final AdmissionPolicy admissionPolicy;

    private final SharedStateStore store;

    private final ObjectMapper objectMapper;

    private final Clock clock;

    private final HeliosProperties.BudgetConfig config;

    private final Counter admittedCounter;
    private final Counter queuedCounter;
    private final Counter rejectedCounter;

    private volatile BudgetStatus lastStatus;

    public ResourceGovernor(UsageWindowStore windowStore, AdmissionPolicy admissionPolicy, SharedStateStore store,
                            ObjectMapper objectMapper, Clock clock, HeliosProperties properties,
                            MeterRegistry meterRegistry) {
        this.windowStore = windowStore;
        this.admissionPolicy = admissionPolicy;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getBudget();

        admittedCounter = Counter.builder("helios.governor.admitted")
            .description("Number of tasks admitted against the budget")
            .register(meterRegistry);

        queuedCounter = Counter.builder("helios.governor.queued")
            .description("Number of admission requests told to wait for the next window")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("helios.governor.rejected")
            .description("Number of admission requests rejected")
            .register(meterRegistry);

        Gauge.builder("helios.governor.utilization", this,
                g -> g.lastStatus == null ? 0.0 : g.lastStatus.getUtilizationPercent())
            .description("Utilization percentage of the current window at the last observation")
            .register(meterRegistry);

        Gauge.builder("helios.governor.remaining", this,
                g -> g.lastStatus == null ? config.getCeiling() : g.lastStatus.getRemainingUnits())
            .description("Units left in the current window at the last observation")
            .register(meterRegistry);
    }

    /**
     * Decide whether a task may run now and on which tier, reserving its estimated cost when admitted
     *
     * @param request admission request
     * @return Mono with the allocation; denial is a normal outcome
     */
    public Mono<ResourceAllocation> requestResources(TaskResourceRequest request) {
        return manualThrottleReason()
            .flatMap(manual -> windowStore.update(window -> {
                Instant now = clock.instant();
                BudgetStatus status = snapshot(window, manual.orElse(null), now);
                ResourceAllocation allocation = admissionPolicy.decide(request, window, status, now);
                if (!allocation.isAdmitted()) {
                    return WindowUpdate.unchanged(allocation);
                }
                return WindowUpdate.replace(window.adjust(allocation.getTier(), allocation.getReservedUnits()), allocation);
            }))
            .flatMap(allocation -> {
                if (!allocation.isAdmitted()) {
                    return Mono.just(allocation);
                }
                Reservation reservation = Reservation.builder()
                    .projectId(request.getProjectId())
                    .taskId(request.getTaskId())
                    .windowId(allocation.getWindowId())
                    .tier(allocation.getTier())
                    .units(allocation.getReservedUnits())
                    .build();
                return store.set(reservationKey(request.getProjectId(), request.getTaskId()), write(reservation),
                        config.getReservationTtl())
                    .thenReturn(allocation);
            })
            .doOnNext(allocation -> {
                admissionPolicy.committed(allocation);
                countAndLog(allocation);
            });
    }

    /**
     * Reconcile the reservation of a task admitted without a project
     */
    public Mono<Void> recordUsage(String taskId, ModelTier tier, long actualUnits) {
        return recordUsage(null, taskId, tier, actualUnits);
    }

    /**
     * Reconcile a task's reservation with what it actually consumed
     *
     * @param projectId owning project, {@code null} for a standalone task
     * @param taskId task identifier, unique within its project
     * @param tier tier the task actually ran on
     * @param actualUnits units actually consumed
     * @return Mono that completes when the window reflects the actual usage
     */
    public Mono<Void> recordUsage(String projectId, String taskId, ModelTier tier, long actualUnits) {
        long actual = Math.max(0, actualUnits);
        String reservationKey = reservationKey(projectId, taskId);

        return store.get(reservationKey)
            .map(raw -> Optional.of(readReservation(raw)))
            .defaultIfEmpty(Optional.empty())
            .flatMap(reservation -> windowStore.update(window -> {
                UsageWindow updated;
                if (reservation.isPresent() && reservation.get().getWindowId().equals(window.getWindowId())) {
                    Reservation r = reservation.get();
                    updated = window.adjust(r.getTier(), -r.getUnits()).adjust(tier, actual);
                } else if (reservation.isPresent()) {
                    updated = window.adjust(tier, actual - reservation.get().getUnits());
                } else {
                    updated = window.adjust(tier, actual);
                }
                updated = clampToCeiling(updated, tier);
                return WindowUpdate.replace(updated, updated);
            })
                .doOnNext(window -> {
                    long reserved = reservation.map(Reservation::getUnits).orElse(0L);
                    if (reservation.isPresent() && reserved != actual) {
                        log.debug("Task {} reconciled: reserved {} on {}, used {} on {}", taskId,
                            reserved, reservation.get().getTier(), actual, tier);
                    }
                    lastStatus = snapshot(window, null, clock.instant());
                })
                .then(reservation.isPresent() ? store.delete(reservationKey).then() : Mono.<Void>empty()));
    }

    public Mono<BudgetStatus> getBudgetStatus() {
        return manualThrottleReason()
            .flatMap(manual -> windowStore.current()
                .map(window -> snapshot(window, manual.orElse(null), clock.instant())))
            .doOnNext(status -> lastStatus = status);
    }

    /**
     * Throughput, tier mix and cost efficiency of the current window
     */
    public Mono<UsageMetrics> getUsageMetrics() {
        return getBudgetStatus().map(status -> {
            Instant now = clock.instant();
            double elapsedHours = Math.max(Duration.between(status.getWindowStart(), now).toMillis(), 60_000L) / 3_600_000.0;
            long used = status.getUsedUnits();

            double highPercent = used > 0 ? status.getHighCapabilityUnits() * 100.0 / used : 0.0;
            double economicalPercent = used > 0 ? status.getEconomicalUnits() * 100.0 / used : 0.0;

            return UsageMetrics.builder()
                .timestamp(now)
                .windowId(status.getWindowId())
                .utilizationPercent(status.getUtilizationPercent())
                .health(status.getHealth())
                .unitsPerHour(used / elapsedHours)
                .highCapabilityPercent(highPercent)
                .economicalPercent(economicalPercent)
                .costEfficiency(economicalPercent)
                .weightedCostUnits(status.getHighCapabilityUnits() * ModelTier.HIGH_CAPABILITY.getCostMultiplier()
                    + status.getEconomicalUnits() * ModelTier.ECONOMICAL.getCostMultiplier())
                .admittedCount((long) admittedCounter.count())
                .queuedCount((long) queuedCounter.count())
                .rejectedCount((long) rejectedCounter.count())
                .build();
        });
    }

    /**
     * Closed windows, newest first
     */
    public Flux<UsageWindow> getWindowHistory(int limit) {
        return windowStore.history(Math.min(limit, config.getHistorySize()));
    }

    /**
     * Force throttling regardless of utilization until {@link #clearThrottle()} is called
     */
    public Mono<BudgetStatus> forceThrottle(String reason) {
        String effective = reason == null || reason.isBlank() ? "Manual override" : reason;
        return store.set(THROTTLE_KEY, effective, null)
            .doOnSuccess(ok -> log.warn("Throttling forced: {}", effective))
            .then(getBudgetStatus());
    }

    public Mono<BudgetStatus> clearThrottle() {
        return store.delete(THROTTLE_KEY)
            .doOnSuccess(removed -> log.info("Manual throttle cleared"))
            .then(getBudgetStatus());
    }

    /**
     * Store connectivity plus a sanity check of the current window
     */
    public Mono<Map<String, Object>> healthCheck() {
        return store.ping()
            .zipWith(getBudgetStatus())
            .map(tuple -> {
                boolean storeHealthy = tuple.getT1();
                BudgetStatus status = tuple.getT2();
                boolean windowValid = status.getCeiling() > 0 && status.getUsedUnits() <= status.getCeiling();

                Map<String, Object> health = new LinkedHashMap<>();
                health.put("healthy", storeHealthy && windowValid);
                health.put("storeConnected", storeHealthy);
                health.put("windowValid", windowValid);
                health.put("windowId", status.getWindowId());
                health.put("budgetHealth", status.getHealth());
                health.put("utilizationPercent", status.getUtilizationPercent());
                return health;
            })
            .onErrorResume(e -> {
                log.error("Governor health check failed", e);
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("healthy", false);
                health.put("error", e.getMessage());
                return Mono.just(health);
            });
    }

    /**
     * Task ids are only unique within a project, so reservations are scoped by project
     */
    static String reservationKey(String projectId, String taskId) {
        String scope = projectId == null || projectId.isBlank() ? "_" : projectId;
        return RESERVATION_KEY_PREFIX + scope + ":" + taskId;
    }

    private Mono<Optional<String>> manualThrottleReason() {
        return store.get(THROTTLE_KEY)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    private BudgetStatus snapshot(UsageWindow window, String manualReason, Instant now) {
        return BudgetStatus.of(window, manualReason, now,
            config.getThrottleThresholdPercent(), config.getCriticalThresholdPercent());
    }

    private static UsageWindow clampToCeiling(UsageWindow window, ModelTier tier) {
        long excess = window.usedUnits() - window.getCeiling();
        return excess > 0 ? window.adjust(tier, -excess) : window;
    }

    private void countAndLog(ResourceAllocation allocation) {
        switch (allocation.getOutcome()) {
            case ADMITTED -> {
                admittedCounter.increment();
                log.info("Task {} admitted on {} ({} units): {}", allocation.getTaskId(), allocation.getTier(),
                    allocation.getReservedUnits(), allocation.getReason());
            }
            case QUEUED -> {
                queuedCounter.increment();
                log.info("Task {} queued, retry after {}: {}", allocation.getTaskId(),
                    allocation.getRetryAfter(), allocation.getReason());
            }
            case REJECTED -> {
                rejectedCounter.increment();
                log.warn("Task {} rejected, retry after {}: {}", allocation.getTaskId(),
                    allocation.getRetryAfter(), allocation.getReason());
            }
        }
    }

    private Reservation readReservation(String raw) {
        try {
            return objectMapper.readValue(raw, Reservation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable reservation record", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
