package com.whereq.helios.cache;

import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheMetrics;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.dto.CacheStoreResult;
import com.whereq.helios.model.CacheEntry;
import com.whereq.helios.model.CacheLevel;
import com.whereq.helios.store.SharedStateStore;
import com.whereq.helios.support.HeliosFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CacheManagerTest {

    private static final String LONG_PREFIX = "You are a meticulous reviewer. ".repeat(140);

    private HeliosFixture fixture;

    private CacheManager cacheManager;

    @BeforeEach
    void setUp() {
        fixture = HeliosFixture.create();
        cacheManager = fixture.cacheManager;
    }

    @Test
    @DisplayName("Storing the same pair twice still yields one exact hit")
    void exactHitAfterRepeatedStore() {
        cacheManager.store(store("What is X?", "X is a thing", "qa")).block();
        cacheManager.store(store("What is X?", "X is a thing", "qa")).block();

        StepVerifier.create(cacheManager.lookup(lookup("What is X?", "qa")))
            .assertNext(result -> {
                assertTrue(result.isHit());
                assertEquals(CacheLevel.L2_EXACT, result.getLevel());
                assertEquals("X is a thing", result.getResponse());
                assertEquals(1.0, result.getConfidence());
            })
            .verifyComplete();
        assertEquals(2, fixture.store.keys("cache:").collectList().block().size());
    }

    @Test
    @DisplayName("Exact matching ignores surrounding and repeated whitespace")
    void exactMatchNormalizesWhitespace() {
        cacheManager.store(store("What is   X?", "X is a thing", "qa")).block();

        CacheLookupResult result = cacheManager.lookup(lookup("  What is X?\n", "qa")).block();

        assertTrue(result.isHit());
        assertEquals(CacheLevel.L2_EXACT, result.getLevel());
    }

    @Test
    @DisplayName("Entries are isolated by task type")
    void taskTypesAreIsolated() {
        cacheManager.store(store("What is X?", "X is a thing", "qa")).block();

        CacheLookupResult result = cacheManager.lookup(lookup("What is X?", "code_review")).block();

        assertFalse(result.isHit());
        assertNull(result.getLevel());
    }

    @Test
    @DisplayName("Semantic tier hits at or above the similarity threshold only")
    void semanticThreshold() {
        cacheManager.store(CacheStoreRequest.builder()
            .inputText("What is X?").response("X is a thing").taskType("qa")
            .embedding(new double[]{1.0, 0.0}).costUnits(5.0).build()).block();

        CacheLookupResult close = cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Please explain X").taskType("qa")
            .embedding(new double[]{0.9, Math.sqrt(1 - 0.81)}).build()).block();
        assertTrue(close.isHit());
        assertEquals(CacheLevel.L3_SEMANTIC, close.getLevel());
        assertEquals(0.90, close.getConfidence(), 1e-9);
        assertEquals(5.0, close.getCostAvoided());

        CacheLookupResult far = cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Please explain X").taskType("qa")
            .embedding(new double[]{0.8, 0.6}).build()).block();
        assertFalse(far.isHit());

        CacheLookupResult lowered = cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Please explain X").taskType("qa").similarityThreshold(0.75)
            .embedding(new double[]{0.8, 0.6}).build()).block();
        assertTrue(lowered.isHit());
        assertEquals(0.80, lowered.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("The semantic tier serves entries whose exact copy has expired")
    void waterfallFallsThroughToSemantic() {
        cacheManager.store(store("Summarize the release notes", "Summary", "documentation")).block();

        fixture.clock.advance(Duration.ofHours(2));

        CacheLookupResult result = cacheManager.lookup(lookup("Summarize the release notes", "documentation")).block();
        assertTrue(result.isHit());
        assertEquals(CacheLevel.L3_SEMANTIC, result.getLevel());
        assertEquals(1.0, result.getConfidence(), 1e-9);

        fixture.clock.advance(Duration.ofDays(1));
        assertFalse(cacheManager.lookup(lookup("Summarize the release notes", "documentation")).block().isHit());
    }

    @Test
    @DisplayName("Context tier is used only for prefixes above the size threshold")
    void contextTierEligibility() {
        CacheStoreResult shortPrefix = cacheManager.store(CacheStoreRequest.builder()
            .inputText("Review this diff").response("LGTM").taskType("code_review")
            .contextPrefix("Be brief.").build()).block();
        assertTrue(shortPrefix.isStored());
        assertFalse(shortPrefix.storedIn(CacheLevel.L1_CONTEXT));
        assertTrue(shortPrefix.storedIn(CacheLevel.L2_EXACT));

        CacheStoreResult longPrefix = cacheManager.store(CacheStoreRequest.builder()
            .inputText("Review this diff").response("Needs tests").taskType("code_review")
            .contextPrefix(LONG_PREFIX).build()).block();
        assertTrue(longPrefix.storedIn(CacheLevel.L1_CONTEXT));

        CacheLookupResult hit = cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Review this diff").taskType("code_review").contextPrefix(LONG_PREFIX)
            .useL2(false).useL3(false).build()).block();
        assertTrue(hit.isHit());
        assertEquals(CacheLevel.L1_CONTEXT, hit.getLevel());
        assertEquals("Needs tests", hit.getResponse());

        CacheLookupResult otherPrefix = cacheManager.lookup(CacheLookupRequest.builder()
            .inputText("Review this diff").taskType("code_review").contextPrefix(LONG_PREFIX + "Also check style.")
            .useL2(false).useL3(false).build()).block();
        assertFalse(otherPrefix.isHit());
    }

    @Test
    @DisplayName("Invalidation removes exactly the entries of one task type")
    void invalidationIsScoped() {
        cacheManager.store(store("q1", "a1", "qa")).block();
        cacheManager.store(store("q2", "a2", "qa")).block();
        cacheManager.store(store("review me", "ok", "code_review")).block();

        assertEquals(Long.valueOf(4), cacheManager.invalidate("qa").block());

        assertFalse(cacheManager.lookup(lookup("q1", "qa")).block().isHit());
        assertTrue(cacheManager.lookup(lookup("review me", "code_review")).block().isHit());

        assertEquals(Long.valueOf(2), cacheManager.invalidate(null).block());
        assertFalse(cacheManager.lookup(lookup("review me", "code_review")).block().isHit());
    }

    @Test
    @DisplayName("A hit increments the entry's access count")
    void hitTouchesEntry() throws Exception {
        cacheManager.store(CacheStoreRequest.builder()
            .inputText("q").response("a").taskType("qa").storeInL3(false).build()).block();
        cacheManager.lookup(lookup("q", "qa")).block();

        String key = fixture.store.keys("cache:l2:").blockFirst();
        CacheEntry entry = fixture.objectMapper.readValue(fixture.store.get(key).block(), CacheEntry.class);
        assertEquals(1, entry.getAccessCount());
        assertEquals(CacheLevel.L2_EXACT, entry.getLevel());
    }

    @Test
    @DisplayName("Metrics count lookups, hits and avoided cost per tier")
    void metrics() {
        cacheManager.store(CacheStoreRequest.builder()
            .inputText("q").response("a").taskType("qa").costUnits(2.5).build()).block();
        cacheManager.lookup(lookup("q", "qa")).block();
        cacheManager.lookup(lookup("completely unrelated question about databases", "other")).block();

        CacheMetrics metrics = cacheManager.metrics();
        assertEquals(2, metrics.getTotalLookups());
        assertEquals(1, metrics.getTotalHits());
        assertEquals(0.5, metrics.getAggregateHitRate());
        assertEquals(2.5, metrics.getCostSaved());
        assertEquals(2, metrics.getEntriesStored());
        assertEquals(2, metrics.getTiers().get(CacheLevel.L2_EXACT).getLookups());
        assertEquals(1, metrics.getTiers().get(CacheLevel.L3_SEMANTIC).getLookups());
        assertEquals(0, metrics.getTiers().get(CacheLevel.L1_CONTEXT).getLookups());
        assertEquals(1.0, fixture.meterRegistry.counter("helios.cache.misses").count());
    }

    @Test
    @DisplayName("An unavailable store degrades to misses and unconfirmed stores")
    void unavailableStoreDegrades() {
        SharedStateStore broken = mock(SharedStateStore.class);
        when(broken.get(anyString())).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        when(broken.keys(anyString())).thenReturn(Flux.error(new IllegalStateException("connection refused")));
        when(broken.set(anyString(), anyString(), any())).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        CacheManager degraded = HeliosFixture.withStore(broken).cacheManager;

        StepVerifier.create(degraded.lookup(lookup("q", "qa")))
            .assertNext(result -> assertFalse(result.isHit()))
            .verifyComplete();

        StepVerifier.create(degraded.store(store("q", "a", "qa")))
            .assertNext(result -> {
                assertFalse(result.isStored());
                assertFalse(result.storedIn(CacheLevel.L2_EXACT));
                assertFalse(result.storedIn(CacheLevel.L3_SEMANTIC));
            })
            .verifyComplete();
    }

    private static CacheStoreRequest store(String input, String response, String taskType) {
        return CacheStoreRequest.builder().inputText(input).response(response).taskType(taskType).build();
    }

    private static CacheLookupRequest lookup(String input, String taskType) {
        return CacheLookupRequest.builder().inputText(input).taskType(taskType).build();
    }
}
