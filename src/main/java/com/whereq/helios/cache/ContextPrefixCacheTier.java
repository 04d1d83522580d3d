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
 * L1: short-lived responses keyed by a large reusable context prefix together with the input
 */
@Component
public class ContextPrefixCacheTier extends AbstractStoreCacheTier {

    private static final String SEPARATOR = "\u0000";

    private final HeliosProperties.ContextTierConfig config;

    public ContextPrefixCacheTier(SharedStateStore store, ObjectMapper objectMapper, Clock clock,
                                  HeliosProperties properties) {
        super(store, objectMapper, clock);
        this.config = properties.getCache().getL1();
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.L1_CONTEXT;
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
        return qualifies(request.getContextPrefix());
    }

    @Override
    public boolean eligibleForStore(CacheStoreRequest request) {
        return qualifies(request.getContextPrefix());
    }

    @Override
    public Mono<CacheLookupResult> lookup(CacheLookupRequest request) {
        String key = CacheKeys.key(level(), request.getTaskType(), hash(request.getContextPrefix(), request.getInputText()));
        return read(key).flatMap(entry -> hit(key, entry, 1.0));
    }

    @Override
    public Mono<Boolean> store(CacheStoreRequest request) {
        String normalized = CacheKeys.normalize(request.getInputText());
        return write(request.getTaskType(), hash(request.getContextPrefix(), request.getInputText()), CacheEntry.builder()
            .inputText(normalized)
            .response(request.getResponse())
            .costUnits(request.getCostUnits()));
    }

    /**
     * Whether a context prefix is large enough to be worth caching, estimating tokens from characters
     */
    boolean qualifies(String contextPrefix) {
        if (contextPrefix == null || contextPrefix.isBlank()) {
            return false;
        }
        long estimatedTokens = contextPrefix.length() / Math.max(1, config.getCharsPerToken());
        return estimatedTokens >= config.getMinPrefixTokens();
    }

    private static String hash(String contextPrefix, String inputText) {
        return CacheKeys.sha256(contextPrefix + SEPARATOR + CacheKeys.normalize(inputText));
    }
}
