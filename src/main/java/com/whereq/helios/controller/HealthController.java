package com.whereq.helios.controller;

import com.whereq.helios.cache.CacheManager;
import com.whereq.helios.governor.ResourceGovernor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service, store and cache status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private ResourceGovernor governor;

    @Autowired
    private CacheManager cacheManager;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service, the shared state store and the cache are available")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return governor.healthCheck()
                .zipWith(cacheManager.healthCheck())
                .map(tuple -> {
                    Map<String, Object> health = new HashMap<>();
                    boolean governorHealthy = Boolean.TRUE.equals(tuple.getT1().get("healthy"));
                    health.put("status", governorHealthy ? "UP" : "DEGRADED");
                    health.put("service", "whereq-helios");
                    health.put("governor", tuple.getT1());
                    health.put("cache", tuple.getT2());
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "DEGRADED");
                    health.put("service", "whereq-helios");
                    health.put("error", e.getMessage());
                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
