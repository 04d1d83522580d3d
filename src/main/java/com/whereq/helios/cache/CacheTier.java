package com.whereq.helios.cache;

import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.model.CacheLevel;
import reactor.core.publisher.Mono;

/**
 * One level of the cache waterfall.
 * The cache manager only relies on this hit/miss contract, never on how a tier matches.
 */
public interface CacheTier {

    CacheLevel level();

    boolean isEnabled();

    /**
     * Whether this tier can answer the request at all
     */
    boolean eligibleForLookup(CacheLookupRequest request);

    /**
     * Whether this tier should keep the entry
     */
    boolean eligibleForStore(CacheStoreRequest request);

    /**
     * Look up a response
     *
     * @param request lookup request
     * @return Mono with the hit, empty on miss
     */
    Mono<CacheLookupResult> lookup(CacheLookupRequest request);

    /**
     * Store a response
     *
     * @param request store request
     * @return Mono with true when written
     */
    Mono<Boolean> store(CacheStoreRequest request);

    /**
     * Remove entries
     *
     * @param taskType task type to remove, {@code null} for every entry of this tier
     * @return Mono with the number of entries removed
     */
    Mono<Long> invalidate(String taskType);
}
