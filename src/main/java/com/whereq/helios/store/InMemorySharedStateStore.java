package com.whereq.helios.store;

import com.whereq.helios.config.HeliosProperties;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local shared state store backed by a ConcurrentHashMap.
 * Expired entries are dropped on access and by a periodic sweep, which writes also trigger when it is overdue.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "helios.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySharedStateStore implements SharedStateStore {

    private final ConcurrentHashMap<String, StoredValue> values = new ConcurrentHashMap<>();

    private final Clock clock;

    private final Duration sweepInterval;

    private volatile Instant lastSweep;

    @Autowired
    public InMemorySharedStateStore(Clock clock, HeliosProperties properties) {
        this(clock, properties.getStore().getSweepInterval());
        log.info("Using in-memory shared state store (prefix={}); state will not survive a restart",
            properties.getStore().getKeyPrefix());
    }

    public InMemorySharedStateStore(Clock clock) {
        this(clock, Duration.ofMinutes(1));
    }

    public InMemorySharedStateStore(Clock clock, Duration sweepInterval) {
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.lastSweep = clock.instant();
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            StoredValue stored = values.get(key);
            if (stored == null) {
                return null;
            }
            if (stored.isExpired(clock.instant())) {
                values.remove(key, stored);
                return null;
            }
            return stored.value;
        });
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return Mono.fromSupplier(() -> {
            sweepIfDue();
            values.put(key, new StoredValue(value, expiry(ttl)));
            return true;
        });
    }

    @Override
    public Mono<Boolean> compareAndSet(String key, String expected, String newValue, Duration ttl) {
        return Mono.fromSupplier(() -> {
            sweepIfDue();
            AtomicBoolean swapped = new AtomicBoolean(false);
            Instant now = clock.instant();
            values.compute(key, (k, current) -> {
                boolean live = current != null && !current.isExpired(now);
                String currentValue = live ? current.value : null;
                if (Objects.equals(currentValue, expected)) {
                    swapped.set(true);
                    return new StoredValue(newValue, expiry(ttl));
                }
                return live ? current : null;
            });
            return swapped.get();
        });
    }

    @Override
    public Mono<Long> delete(Collection<String> keys) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            long removed = 0;
            for (String key : keys) {
                StoredValue stored = values.remove(key);
                if (stored != null && !stored.isExpired(now)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Flux<String> keys(String prefix) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            return Flux.fromIterable(values.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .filter(e -> !e.getValue().isExpired(now))
                .map(Map.Entry::getKey)
                .toList());
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    /**
     * Remove every expired entry
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${helios.store.sweep-interval:PT1M}")
    public int purgeExpired() {
        Instant now = clock.instant();
        lastSweep = now;
        int removed = 0;
        for (Map.Entry<String, StoredValue> entry : values.entrySet()) {
            if (entry.getValue().isExpired(now) && values.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired entries, {} left", removed, values.size());
        }
        return removed;
    }

    int size() {
        return values.size();
    }

    private void sweepIfDue() {
        if (!clock.instant().isBefore(lastSweep.plus(sweepInterval))) {
            purgeExpired();
        }
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    @AllArgsConstructor
    private static final class StoredValue {
        private final String value;
        private final Instant expiresAt;

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
