package com.whereq.helios.governor;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.BudgetStatus;
import com.whereq.helios.dto.ResourceAllocation;
import com.whereq.helios.dto.RoutingDecision;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.model.AllocationOutcome;
import com.whereq.helios.model.BudgetHealth;
import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.UsageWindow;
import com.whereq.helios.router.EconomicRouter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Three-zone admission policy.
 * Decides whether to admit, queue, or reject a task against the current window.
 */
@Component
public class AdmissionPolicy {

    private final EconomicRouter router;

    private final HeliosProperties.BudgetConfig config;

    public AdmissionPolicy(EconomicRouter router, HeliosProperties properties) {
        this.router = router;
        this.config = properties.getBudget();
    }

    /**
     * Decide on a request. Pure, so it can run inside a window compare-and-swap; the routing
     * decision is counted by {@link #committed} once the reservation is written.
     *
     * @param request admission request
     * @param window current window
     * @param status snapshot of {@code window}
     * @param now decision time
     * @return allocation; when admitted, {@code reservedUnits} is what the window must be charged
     */
    public ResourceAllocation decide(TaskResourceRequest request, UsageWindow window, BudgetStatus status, Instant now) {
        long remaining = window.remainingUnits();
        if (remaining <= 0) {
            return deny(request, window, now, AllocationOutcome.REJECTED,
                "Budget exhausted for window " + window.getWindowId());
        }

        BudgetHealth health = effectiveHealth(status);
        if (health == BudgetHealth.NORMAL) {
            RoutingDecision decision = router.decide(request, status);
            return admit(request, window, now, decision.getTier(), remaining,
                "Normal zone: " + decision.getReasoning(), true);
        }

        if (health == BudgetHealth.CRITICAL && request.getPriority() < config.getCriticalMinPriority()) {
            return deny(request, window, now, AllocationOutcome.REJECTED,
                "Critical zone: priority " + request.getPriority() + " below "
                    + config.getCriticalMinPriority() + " (" + describe(status) + ")");
        }

        // mandatory high-capability work waits for the next window rather than being downgraded
        if (request.isRequiresHighCapability()) {
            return deny(request, window, now, AllocationOutcome.QUEUED,
                (health == BudgetHealth.CRITICAL ? "Critical" : "Throttle")
                    + " zone: high capability required, queued until the window resets (" + describe(status) + ")");
        }

        return admit(request, window, now, ModelTier.ECONOMICAL, remaining,
            (health == BudgetHealth.CRITICAL ? "Critical zone: high-priority task" : "Throttle zone: task")
                + " allocated on economical tier (" + describe(status) + ")", false);
    }

    /**
     * Record a decision whose window update was written
     */
    public void committed(ResourceAllocation allocation) {
        if (allocation.isAdmitted() && allocation.isRouted()) {
            router.countDecision(allocation.getTier());
        }
    }

    /**
     * Manual throttling acts as at least the throttled zone
     */
    static BudgetHealth effectiveHealth(BudgetStatus status) {
        if (status.getHealth() == BudgetHealth.NORMAL && status.isThrottling()) {
            return BudgetHealth.THROTTLED;
        }
        return status.getHealth();
    }

    private ResourceAllocation admit(TaskResourceRequest request, UsageWindow window, Instant now,
                                     ModelTier tier, long remaining, String reason, boolean routed) {
        long reserved = Math.min(request.getEstimatedUnits(), remaining);
        if (reserved < request.getEstimatedUnits()) {
            reason += "; reservation clamped to the " + remaining + " units left";
        }
        return ResourceAllocation.builder()
            .taskId(request.getTaskId())
            .admitted(true)
            .outcome(AllocationOutcome.ADMITTED)
            .tier(tier)
            .reservedUnits(reserved)
            .reason(reason)
            .routed(routed)
            .windowId(window.getWindowId())
            .decidedAt(now)
            .build();
    }

    private ResourceAllocation deny(TaskResourceRequest request, UsageWindow window, Instant now,
                                    AllocationOutcome outcome, String reason) {
        return ResourceAllocation.builder()
            .taskId(request.getTaskId())
            .admitted(false)
            .outcome(outcome)
            .reason(reason)
            .retryAfter(window.getEndTime())
            .retryAfterSeconds(Math.max(0, Duration.between(now, window.getEndTime()).getSeconds()))
            .windowId(window.getWindowId())
            .decidedAt(now)
            .build();
    }

    private static String describe(BudgetStatus status) {
        return String.format("%.1f%% of window used", status.getUtilizationPercent());
    }
}
