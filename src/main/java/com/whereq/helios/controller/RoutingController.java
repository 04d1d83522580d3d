package com.whereq.helios.controller;

import com.whereq.helios.dto.RoutingExplanation;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.governor.ResourceGovernor;
import com.whereq.helios.router.EconomicRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/helios/routing")
@Tag(name = "Routing", description = "Tier recommendations")
public class RoutingController {

    @Autowired
    private EconomicRouter router;

    @Autowired
    private ResourceGovernor governor;

    @PostMapping("/explain")
    @Operation(summary = "Explain routing", description = "Component scores behind the tier a task would be routed to now")
    public Mono<RoutingExplanation> explain(@Valid @RequestBody TaskResourceRequest request) {
        return governor.getBudgetStatus()
            .map(status -> router.explainDecision(request, status));
    }

    @GetMapping("/stats")
    @Operation(summary = "Routing statistics", description = "Learned success rates, thresholds and weights")
    public Mono<Map<String, Object>> stats() {
        return Mono.fromSupplier(router::getRoutingStats);
    }
}
