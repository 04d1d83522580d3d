package com.whereq.helios.controller;

import com.whereq.helios.cache.CacheManager;
import com.whereq.helios.dto.CacheInvalidationResponse;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheMetrics;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.dto.CacheStoreResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Three-tier response cache
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/helios/cache")
@Tag(name = "Cache", description = "Context, exact and semantic response cache")
public class CacheController {

    @Autowired
    private CacheManager cacheManager;

    @PostMapping("/lookup")
    @Operation(summary = "Cache lookup", description = "Waterfall lookup; a miss is returned as hit=false")
    public Mono<CacheLookupResult> lookup(@Valid @RequestBody CacheLookupRequest request) {
        return cacheManager.lookup(request);
    }

    @PostMapping("/store")
    @Operation(summary = "Cache store", description = "Write a response to every eligible tier")
    public Mono<CacheStoreResult> store(@Valid @RequestBody CacheStoreRequest request) {
        return cacheManager.store(request);
    }

    @DeleteMapping
    @Operation(summary = "Cache invalidate", description = "Remove entries of a task type, or every entry when none is given")
    public Mono<CacheInvalidationResponse> invalidate(@RequestParam(required = false) String taskType) {
        log.info("Cache invalidation requested for {}", taskType == null ? "all task types" : taskType);
        return cacheManager.invalidate(taskType)
            .map(removed -> CacheInvalidationResponse.builder().taskType(taskType).removed(removed).build());
    }

    @GetMapping("/metrics")
    @Operation(summary = "Cache metrics", description = "Hit rates, entries stored and cost saved")
    public Mono<CacheMetrics> metrics() {
        return Mono.fromSupplier(cacheManager::metrics);
    }

    @GetMapping("/health")
    @Operation(summary = "Cache health")
    public Mono<Map<String, Object>> health() {
        return cacheManager.healthCheck();
    }
}
