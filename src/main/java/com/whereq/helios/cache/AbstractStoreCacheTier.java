package com.whereq.helios.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.model.CacheEntry;
import com.whereq.helios.model.CacheLevel;
import com.whereq.helios.store.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Base for tiers persisting {@link CacheEntry} records as JSON in the shared state store
 */
@Slf4j
public abstract class AbstractStoreCacheTier implements CacheTier {

    protected final SharedStateStore store;

    protected final ObjectMapper objectMapper;

    protected final Clock clock;

    protected AbstractStoreCacheTier(SharedStateStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Entry lifetime for this tier
     */
    protected abstract Duration ttl();

    @Override
    public Mono<Long> invalidate(String taskType) {
        String prefix = taskType == null
            ? CacheKeys.tierPrefix(level())
            : CacheKeys.taskTypePrefix(level(), taskType);

        return store.keys(prefix)
            .collectList()
            .flatMap(store::delete)
            .doOnNext(removed -> {
                if (removed > 0) {
                    log.info("Invalidated {} {} entries{}", removed, level(),
                        taskType == null ? "" : " for task type " + taskType);
                }
            });
    }

    /**
     * Read a live entry by exact key
     */
    protected Mono<CacheEntry> read(String key) {
        return store.get(key)
            .flatMap(raw -> decode(key, raw))
            .filter(entry -> !entry.hasExpired(clock.instant()));
    }

    /**
     * Read every live entry of a task type
     */
    protected Flux<KeyedEntry> readAll(String taskType) {
        return store.keys(CacheKeys.taskTypePrefix(level(), taskType))
            .flatMap(key -> store.get(key)
                .flatMap(raw -> decode(key, raw))
                .map(entry -> new KeyedEntry(key, entry)))
            .filter(keyed -> !keyed.entry.hasExpired(clock.instant()));
    }

    protected Mono<Boolean> write(String taskType, String hash, CacheEntry.CacheEntryBuilder builder) {
        Instant now = clock.instant();
        CacheEntry entry = builder
            .entryId(hash)
            .level(level())
            .taskType(taskType)
            .createdAt(now)
            .expiresAt(now.plus(ttl()))
            .accessCount(0)
            .build();
        return store.set(CacheKeys.key(level(), taskType, hash), encode(entry), ttl());
    }

    /**
     * Count a hit on the entry and turn it into a lookup result
     */
    protected Mono<CacheLookupResult> hit(String key, CacheEntry entry, double confidence) {
        CacheLookupResult result = CacheLookupResult.builder()
            .hit(true)
            .level(level())
            .response(entry.getResponse())
            .confidence(confidence)
            .costAvoided(entry.getCostUnits())
            .entryId(entry.getEntryId())
            .build();
        return touch(key, entry).thenReturn(result);
    }

    private Mono<Boolean> touch(String key, CacheEntry entry) {
        Duration remaining = Duration.between(clock.instant(), entry.getExpiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return Mono.just(false);
        }
        CacheEntry touched = entry.toBuilder().accessCount(entry.getAccessCount() + 1).build();
        return store.set(key, encode(touched), remaining)
            .onErrorResume(e -> {
                log.debug("Could not update access count of {}: {}", key, e.getMessage());
                return Mono.just(false);
            });
    }

    private Mono<CacheEntry> decode(String key, String raw) {
        try {
            return Mono.just(objectMapper.readValue(raw, CacheEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return store.delete(key).then(Mono.empty());
        }
    }

    private String encode(CacheEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache entry " + entry.getEntryId(), e);
        }
    }

    protected static final class KeyedEntry {
        final String key;
        final CacheEntry entry;

        KeyedEntry(String key, CacheEntry entry) {
            this.key = key;
            this.entry = entry;
        }
    }
}
