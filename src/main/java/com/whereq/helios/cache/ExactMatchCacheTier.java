package com.whereq.helios.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.model.CacheEntry;
import com.whereq.helios.model.CacheLevel;
import com.whereq.helios.store.SharedStateStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * L2: responses keyed by the content hash of the normalized input, scoped to the task type
 */
@Component
public class ExactMatchCacheTier extends AbstractStoreCacheTier {

    private final HeliosProperties.ExactTierConfig config;

    public ExactMatchCacheTier(SharedStateStore store, ObjectMapper objectMapper, Clock clock,
                               HeliosProperties properties) {
        super(store, objectMapper, clock);
        this.config = properties.getCache().getL2();
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.L2_EXACT;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    protected Duration ttl() {
        return config.getTtl();
    }

    @Override
    public boolean eligibleForLookup(CacheLookupRequest request) {
        return true;
    }

    @Override
    public boolean eligibleForStore(CacheStoreRequest request) {
        return true;
    }

    @Override
    public Mono<CacheLookupResult> lookup(CacheLookupRequest request) {
        String hash = CacheKeys.sha256(CacheKeys.normalize(request.getInputText()));
        String key = CacheKeys.key(level(), request.getTaskType(), hash);
        return read(key).flatMap(entry -> hit(key, entry, 1.0));
    }

    @Override
    public Mono<Boolean> store(CacheStoreRequest request) {
        String normalized = CacheKeys.normalize(request.getInputText());
        return write(request.getTaskType(), CacheKeys.sha256(normalized), CacheEntry.builder()
            .inputText(normalized)
            .response(request.getResponse())
            .costUnits(request.getCostUnits()));
    }
}
