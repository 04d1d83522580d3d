package com.whereq.helios.controller;

import com.whereq.helios.dto.BudgetStatus;
import com.whereq.helios.dto.ResourceAllocation;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.dto.ThrottleRequest;
import com.whereq.helios.dto.UsageMetrics;
import com.whereq.helios.dto.UsageRecordRequest;
import com.whereq.helios.governor.ResourceGovernor;
import com.whereq.helios.model.UsageWindow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Budget status, admission and usage reporting
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/helios/budget")
@Tag(name = "Budget", description = "Rolling-window budget and admission control")
public class BudgetController {

    @Autowired
    private ResourceGovernor governor;

    @GetMapping("/status")
    @Operation(summary = "Budget status", description = "Snapshot of the current usage window")
    public Mono<BudgetStatus> status() {
        return governor.getBudgetStatus();
    }

    /**
     * Request admission for a task. A denial is a normal 200 response with {@code admitted=false}.
     *
     * @param request admission request
     * @return Mono with the allocation
     */
    @PostMapping("/request")
    @Operation(summary = "Request allocation", description = "Admit, queue or reject a task against the current window")
    public Mono<ResourceAllocation> requestResources(@Valid @RequestBody TaskResourceRequest request) {
        log.debug("Admission request for task {} ({} units, priority {})", request.getTaskId(),
            request.getEstimatedUnits(), request.getPriority());
        return governor.requestResources(request);
    }

    @PostMapping("/usage")
    @Operation(summary = "Record usage", description = "Reconcile a task's reservation with its actual consumption")
    public Mono<Map<String, Object>> recordUsage(@Valid @RequestBody UsageRecordRequest request) {
        return governor.recordUsage(request.getProjectId(), request.getTaskId(), request.getTier(), request.getActualUnits())
            .thenReturn(Map.<String, Object>of(
                "taskId", request.getTaskId(),
                "tier", request.getTier(),
                "actualUnits", request.getActualUnits(),
                "recorded", true));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Usage metrics", description = "Throughput, tier mix and cost efficiency of the current window")
    public Mono<UsageMetrics> metrics() {
        return governor.getUsageMetrics();
    }

    @GetMapping("/history")
    @Operation(summary = "Window history", description = "Closed usage windows, newest first")
    public Mono<List<UsageWindow>> history(@RequestParam(defaultValue = "24") int limit) {
        return governor.getWindowHistory(limit).collectList();
    }

    @PostMapping("/throttle")
    @Operation(summary = "Manual throttle", description = "Force or clear throttling regardless of utilization")
    public Mono<ResponseEntity<BudgetStatus>> throttle(@Valid @RequestBody ThrottleRequest request) {
        log.info("Manual throttle {}: {}", request.getAction(), request.getReason());
        Mono<BudgetStatus> result = request.getAction() == ThrottleRequest.Action.ACTIVATE
            ? governor.forceThrottle(request.getReason())
            : governor.clearThrottle();
        return result.map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    @Operation(summary = "Governor health", description = "Store connectivity and current window sanity")
    public Mono<Map<String, Object>> health() {
        return governor.healthCheck();
    }
}
