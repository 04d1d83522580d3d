package com.whereq.helios.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;

/**
 * Durable key-value store shared by every Helios process.
 * Window counters, reservations, cache entries and project snapshots live here.
 */
public interface SharedStateStore {

    /**
     * Read a value
     *
     * @param key the key, without the configured prefix
     * @return Mono with the value, empty if absent or expired
     */
    Mono<String> get(String key);

    /**
     * Write a value unconditionally
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, {@code null} for no expiry
     * @return Mono with true when written
     */
    Mono<Boolean> set(String key, String value, Duration ttl);

    /**
     * Atomically replace a value if it still equals the expected one
     *
     * @param key the key
     * @param expected value previously read, {@code null} to require the key to be absent
     * @param newValue replacement value
     * @param ttl time to live of the replacement, {@code null} for no expiry
     * @return Mono with true if the swap happened
     */
    Mono<Boolean> compareAndSet(String key, String expected, String newValue, Duration ttl);

    /**
     * Delete keys
     *
     * @param keys keys to delete
     * @return Mono with the number of keys removed
     */
    Mono<Long> delete(Collection<String> keys);

    /**
     * List live keys starting with a prefix
     *
     * @param prefix key prefix
     * @return Flux of matching keys, without the configured prefix
     */
    Flux<String> keys(String prefix);

    /**
     * Check connectivity
     */
    Mono<Boolean> ping();

    default Mono<Long> delete(String key) {
        return delete(java.util.List.of(key));
    }
}
