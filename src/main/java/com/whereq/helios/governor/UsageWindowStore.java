package com.whereq.helios.governor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.model.UsageWindow;
import com.whereq.helios.store.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persists the current usage window and the bounded history of closed windows.
 *
 * Every change to the current window is a compare-and-swap against the raw record that was read,
 * retried on conflict. Rollover happens inside the same loop, so a request arriving after the window
 * elapsed always sees a fresh window.
 */
@Slf4j
@Component
public class UsageWindowStore {

    static final String WINDOW_KEY = "governor:window";
    static final String HISTORY_KEY = "governor:history";

    private static final int MAX_ATTEMPTS = 100;

    private static final TypeReference<List<UsageWindow>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final SharedStateStore store;

    private final ObjectMapper objectMapper;

    private final Clock clock;

    private final HeliosProperties.BudgetConfig config;

    public UsageWindowStore(SharedStateStore store, ObjectMapper objectMapper, Clock clock,
                            HeliosProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getBudget();
    }

    /**
     * Current window, rolled over first if it has elapsed
     */
    public Mono<UsageWindow> current() {
        return update(WindowUpdate::unchanged);
    }

    /**
     * Apply a mutation to the current window atomically
     *
     * @param mutation computes the replacement window and a result from the current window;
     *                 may be invoked several times under contention and must not have side effects
     * @return Mono with the mutation's result once its replacement was written
     */
    public <T> Mono<T> update(Function<UsageWindow, WindowUpdate<T>> mutation) {
        return Mono.defer(() -> attempt(mutation))
            .retryWhen(Retry.max(MAX_ATTEMPTS)
                .filter(WriteConflict.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) ->
                    new IllegalStateException("Usage window update kept conflicting after " + MAX_ATTEMPTS + " attempts")));
    }

    /**
     * Closed windows, newest first
     */
    public Flux<UsageWindow> history(int limit) {
        return store.get(HISTORY_KEY)
            .map(this::readHistory)
            .flatMapMany(Flux::fromIterable)
            .take(Math.max(0, limit));
    }

    private <T> Mono<T> attempt(Function<UsageWindow, WindowUpdate<T>> mutation) {
        return store.get(WINDOW_KEY)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(raw -> {
                Instant now = clock.instant();
                String expected = raw.orElse(null);
                UsageWindow window = expected == null ? null : readWindow(expected);

                if (window == null || window.hasElapsed(now)) {
                    return rollover(expected, window, now).then(Mono.<T>error(new WriteConflict()));
                }

                WindowUpdate<T> update = mutation.apply(window);
                if (!update.isChanged()) {
                    return Mono.justOrEmpty(update.getValue());
                }
                return store.compareAndSet(WINDOW_KEY, expected, write(update.getWindow()), null)
                    .flatMap(swapped -> swapped
                        ? Mono.justOrEmpty(update.getValue())
                        : Mono.<T>error(new WriteConflict()));
            });
    }

    private Mono<Void> rollover(String expected, UsageWindow elapsed, Instant now) {
        UsageWindow fresh = UsageWindow.open(now, config.getWindowDuration(), config.getCeiling());
        return store.compareAndSet(WINDOW_KEY, expected, write(fresh), null)
            .flatMap(swapped -> {
                if (!swapped) {
                    return Mono.<Void>empty();
                }
                if (elapsed == null) {
                    log.info("Opened usage window {} (ceiling={}, ends {})",
                        fresh.getWindowId(), fresh.getCeiling(), fresh.getEndTime());
                    return Mono.<Void>empty();
                }
                log.info("Closed usage window {} at {}/{} units, opened {}",
                    elapsed.getWindowId(), elapsed.usedUnits(), elapsed.getCeiling(), fresh.getWindowId());
                return appendHistory(elapsed.close());
            });
    }

    private Mono<Void> appendHistory(UsageWindow closed) {
        return Mono.defer(() -> store.get(HISTORY_KEY)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(raw -> {
                    List<UsageWindow> history = new ArrayList<>(raw.map(this::readHistory).orElse(List.of()));
                    history.add(0, closed);
                    while (history.size() > config.getHistorySize()) {
                        history.remove(history.size() - 1);
                    }
                    return store.compareAndSet(HISTORY_KEY, raw.orElse(null), write(history), null);
                })
                .flatMap(swapped -> swapped ? Mono.<Void>empty() : Mono.<Void>error(new WriteConflict())))
            .retryWhen(Retry.max(MAX_ATTEMPTS).filter(WriteConflict.class::isInstance));
    }

    private UsageWindow readWindow(String raw) {
        try {
            return objectMapper.readValue(raw, UsageWindow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable usage window record", e);
        }
    }

    private List<UsageWindow> readHistory(String raw) {
        try {
            return objectMapper.readValue(raw, HISTORY_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable usage window history", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Another writer changed the record between read and swap
     */
    static final class WriteConflict extends RuntimeException {
        WriteConflict() {
            super(null, null, false, false);
        }
    }
}
