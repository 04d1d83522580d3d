package com.whereq.helios.store;

import com.whereq.helios.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySharedStateStoreTest {

    private MutableClock clock;

    private InMemorySharedStateStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T08:00:00Z");
        store = new InMemorySharedStateStore(clock);
    }

    @Test
    @DisplayName("Values expire once their TTL has elapsed")
    void valuesExpireAfterTtl() {
        store.set("k", "v", Duration.ofMinutes(5)).block();

        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();

        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(store.get("k")).verifyComplete();
        StepVerifier.create(store.keys("k")).verifyComplete();
    }

    @Test
    @DisplayName("Values without TTL never expire")
    void valuesWithoutTtlPersist() {
        store.set("k", "v", null).block();
        clock.advance(Duration.ofDays(365));

        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();
    }

    @Test
    @DisplayName("Compare-and-set creates an absent key only when null is expected")
    void compareAndSetOnAbsentKey() {
        StepVerifier.create(store.compareAndSet("k", "other", "v1", null)).expectNext(false).verifyComplete();
        StepVerifier.create(store.compareAndSet("k", null, "v1", null)).expectNext(true).verifyComplete();
        StepVerifier.create(store.compareAndSet("k", null, "v2", null)).expectNext(false).verifyComplete();
        StepVerifier.create(store.get("k")).expectNext("v1").verifyComplete();
    }

    @Test
    @DisplayName("Compare-and-set swaps only when the current value matches")
    void compareAndSetSwapsOnMatch() {
        store.set("k", "v1", null).block();

        StepVerifier.create(store.compareAndSet("k", "stale", "v2", null)).expectNext(false).verifyComplete();
        StepVerifier.create(store.compareAndSet("k", "v1", "v2", null)).expectNext(true).verifyComplete();
        StepVerifier.create(store.get("k")).expectNext("v2").verifyComplete();
    }

    @Test
    @DisplayName("An expired value counts as absent for compare-and-set")
    void expiredValueIsAbsentForCompareAndSet() {
        store.set("k", "old", Duration.ofSeconds(1)).block();
        clock.advance(Duration.ofSeconds(2));

        StepVerifier.create(store.compareAndSet("k", "old", "new", null)).expectNext(false).verifyComplete();
        StepVerifier.create(store.compareAndSet("k", null, "new", null)).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("Keys are listed by prefix and delete reports live keys removed")
    void keysAndDelete() {
        store.set("cache:l2:a", "1", null).block();
        store.set("cache:l2:b", "2", null).block();
        store.set("cache:l3:a", "3", null).block();

        List<String> keys = store.keys("cache:l2:").collectList().block();
        assertEquals(2, keys.size());
        assertTrue(keys.containsAll(List.of("cache:l2:a", "cache:l2:b")));

        assertEquals(Long.valueOf(2), store.delete(List.of("cache:l2:a", "cache:l2:b", "missing")).block());
        assertEquals(Long.valueOf(1), store.delete("cache:l3:a").block());
        StepVerifier.create(store.keys("cache:")).verifyComplete();
    }

    @Test
    @DisplayName("Entries that are never read again are purged once the sweep is due")
    void writesPurgeExpiredEntries() {
        for (int i = 0; i < 1000; i++) {
            store.set("cache:l2:general:" + i, "response " + i, Duration.ofMinutes(1)).block();
        }
        assertEquals(1000, store.size());

        clock.advance(Duration.ofDays(2));
        store.set("cache:l2:general:fresh", "response", Duration.ofMinutes(1)).block();

        assertEquals(1, store.size());
        StepVerifier.create(store.get("cache:l2:general:fresh")).expectNext("response").verifyComplete();
    }

    @Test
    @DisplayName("The periodic sweep removes only expired entries")
    void purgeExpiredKeepsLiveEntries() {
        store.set("short", "1", Duration.ofMinutes(1)).block();
        store.set("long", "2", Duration.ofHours(1)).block();
        store.set("forever", "3", null).block();

        clock.advance(Duration.ofMinutes(10));

        assertEquals(1, store.purgeExpired());
        assertEquals(2, store.size());
        assertEquals(0, store.purgeExpired());
    }

    @Test
    @DisplayName("Writes before the sweep interval leave expired entries for the next sweep")
    void sweepIsNotRunOnEveryWrite() {
        InMemorySharedStateStore slow = new InMemorySharedStateStore(clock, Duration.ofHours(1));
        slow.set("a", "1", Duration.ofSeconds(1)).block();

        clock.advance(Duration.ofMinutes(5));
        slow.set("b", "2", null).block();
        assertEquals(2, slow.size());

        clock.advance(Duration.ofHours(1));
        slow.set("c", "3", null).block();
        assertEquals(2, slow.size());
    }
}
