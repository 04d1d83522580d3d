package com.whereq.helios.cache;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheMetrics;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.dto.CacheStoreResult;
import com.whereq.helios.model.CacheLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Three-tier cache in front of the budget.
 *
 * Lookups waterfall from the cheapest and most certain tier to the approximate one and stop at the
 * first hit. Stores go to every eligible tier concurrently. A failing tier is a miss, never an error.
 */
@Slf4j
@Service
public class CacheManager {

    private final List<CacheTier> tiers;

    private final Duration lookupTimeout;

    private final Map<CacheLevel, TierStats> stats = new EnumMap<>(CacheLevel.class);

    private final AtomicLong totalLookups = new AtomicLong();

    private final AtomicLong totalHits = new AtomicLong();

    private final Counter missCounter;

    private final Map<CacheLevel, Counter> hitCounters = new EnumMap<>(CacheLevel.class);

    public CacheManager(List<CacheTier> tiers, HeliosProperties properties, MeterRegistry meterRegistry) {
        List<CacheTier> ordered = new ArrayList<>(tiers);
        ordered.sort(Comparator.comparing(CacheTier::level));
        this.tiers = List.copyOf(ordered);
        this.lookupTimeout = properties.getCache().getLookupTimeout();

        for (CacheLevel level : CacheLevel.values()) {
            stats.put(level, new TierStats());
            hitCounters.put(level, Counter.builder("helios.cache.hits")
                .description("Cache hits per tier")
                .tag("level", level.getKeySegment())
                .register(meterRegistry));
        }
        missCounter = Counter.builder("helios.cache.misses")
            .description("Lookups that missed every tier")
            .register(meterRegistry);

        log.info("Cache tiers: {}", this.tiers.stream()
            .map(t -> t.level() + (t.isEnabled() ? "" : " (disabled)"))
            .toList());
    }

    /**
     * Waterfall lookup
     *
     * @param request lookup request
     * @return Mono with the first tier's hit, or a miss
     */
    public Mono<CacheLookupResult> lookup(CacheLookupRequest request) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            totalLookups.incrementAndGet();

            Mono<CacheLookupResult> waterfall = Mono.empty();
            for (CacheTier tier : tiers) {
                if (tier.isEnabled() && requested(tier.level(), request) && tier.eligibleForLookup(request)) {
                    waterfall = waterfall.switchIfEmpty(Mono.defer(() -> guardedLookup(tier, request)));
                }
            }

            return waterfall
                .map(hit -> {
                    TierStats tierStats = stats.get(hit.getLevel());
                    tierStats.hits.incrementAndGet();
                    tierStats.costSaved.add(hit.getCostAvoided());
                    totalHits.incrementAndGet();
                    hitCounters.get(hit.getLevel()).increment();
                    log.debug("Cache hit on {} for {} (confidence {})", hit.getLevel(), request.getTaskType(),
                        String.format("%.3f", hit.getConfidence()));
                    return hit.toBuilder().lookupTimeMs(elapsedMs(started)).build();
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    missCounter.increment();
                    return CacheLookupResult.miss().toBuilder().lookupTimeMs(elapsedMs(started)).build();
                }));
        });
    }

    /**
     * Write a response to every eligible tier concurrently
     *
     * @param request store request
     * @return Mono with the per-tier confirmation
     */
    public Mono<CacheStoreResult> store(CacheStoreRequest request) {
        return Flux.fromIterable(tiers)
            .filter(tier -> tier.isEnabled() && requested(tier.level(), request) && tier.eligibleForStore(request))
            .flatMap(tier -> tier.store(request)
                .timeout(lookupTimeout)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Cache tier {} unavailable for store: {}", tier.level(), e.toString());
                    return Mono.just(false);
                })
                .map(ok -> Tuples.of(tier.level(), ok)))
            .collectList()
            .map(results -> {
                Map<CacheLevel, Boolean> confirmations = new EnumMap<>(CacheLevel.class);
                for (CacheLevel level : CacheLevel.values()) {
                    confirmations.put(level, false);
                }
                results.forEach(t -> {
                    confirmations.put(t.getT1(), t.getT2());
                    if (t.getT2()) {
                        stats.get(t.getT1()).entriesStored.incrementAndGet();
                    }
                });
                boolean stored = confirmations.containsValue(true);
                log.debug("Stored {} response in {}", request.getTaskType(), confirmations);
                return CacheStoreResult.builder().stored(stored).tiers(confirmations).build();
            });
    }

    /**
     * Remove entries of a task type from every tier
     *
     * @param taskType task type, {@code null} to flush everything
     * @return Mono with the number of entries removed
     */
    public Mono<Long> invalidate(String taskType) {
        return Flux.fromIterable(tiers)
            .flatMap(tier -> tier.invalidate(taskType))
            .reduce(0L, Long::sum)
            .doOnNext(removed -> log.info("Cache invalidation ({}) removed {} entries",
                taskType == null ? "all" : taskType, removed));
    }

    public CacheMetrics metrics() {
        Map<CacheLevel, CacheMetrics.TierMetrics> perTier = new EnumMap<>(CacheLevel.class);
        long entriesStored = 0;
        double costSaved = 0.0;

        for (CacheTier tier : tiers) {
            TierStats s = stats.get(tier.level());
            long lookups = s.lookups.get();
            long hits = s.hits.get();
            perTier.put(tier.level(), CacheMetrics.TierMetrics.builder()
                .enabled(tier.isEnabled())
                .lookups(lookups)
                .hits(hits)
                .hitRate(lookups > 0 ? (double) hits / lookups : 0.0)
                .entriesStored(s.entriesStored.get())
                .costSaved(s.costSaved.sum())
                .build());
            entriesStored += s.entriesStored.get();
            costSaved += s.costSaved.sum();
        }

        long lookups = totalLookups.get();
        long hits = totalHits.get();
        return CacheMetrics.builder()
            .totalLookups(lookups)
            .totalHits(hits)
            .aggregateHitRate(lookups > 0 ? (double) hits / lookups : 0.0)
            .entriesStored(entriesStored)
            .costSaved(costSaved)
            .tiers(perTier)
            .build();
    }

    public Mono<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        tiers.forEach(tier -> health.put(tier.level().name().toLowerCase(Locale.ROOT),
            tier.isEnabled() ? "enabled" : "disabled"));
        health.put("hitRate", metrics().getAggregateHitRate());
        return Mono.just(health);
    }

    private Mono<CacheLookupResult> guardedLookup(CacheTier tier, CacheLookupRequest request) {
        stats.get(tier.level()).lookups.incrementAndGet();
        return tier.lookup(request)
            .timeout(lookupTimeout)
            .onErrorResume(e -> {
                log.warn("Cache tier {} unavailable, treating as miss: {}", tier.level(), e.toString());
                return Mono.empty();
            });
    }

    private static boolean requested(CacheLevel level, CacheLookupRequest request) {
        return switch (level) {
            case L1_CONTEXT -> request.isUseL1();
            case L2_EXACT -> request.isUseL2();
            case L3_SEMANTIC -> request.isUseL3();
        };
    }

    private static boolean requested(CacheLevel level, CacheStoreRequest request) {
        return switch (level) {
            case L1_CONTEXT -> request.isStoreInL1();
            case L2_EXACT -> request.isStoreInL2();
            case L3_SEMANTIC -> request.isStoreInL3();
        };
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static final class TierStats {
        final AtomicLong lookups = new AtomicLong();
        final AtomicLong hits = new AtomicLong();
        final AtomicLong entriesStored = new AtomicLong();
        final DoubleAdder costSaved = new DoubleAdder();
    }
}
