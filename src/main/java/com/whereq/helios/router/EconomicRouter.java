package com.whereq.helios.router;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.BudgetStatus;
import com.whereq.helios.dto.RoutingDecision;
import com.whereq.helios.dto.RoutingExplanation;
import com.whereq.helios.dto.TaskResourceRequest;
import com.whereq.helios.model.ModelTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recommends a backend tier for a task.
 *
 * The decision score weighs task complexity, budget headroom, the historical success rate of
 * the task type on each tier and the caller's priority. Success rates are kept as per task type
 * exponential moving averages fed by {@link #recordOutcome}.
 */
@Slf4j
@Service
public class EconomicRouter {

    private static final double NEUTRAL_SUCCESS_RATE = 0.5;

    private final HeliosProperties.RoutingConfig config;

    private final Map<String, Map<ModelTier, Double>> performanceHistory = new ConcurrentHashMap<>();

    private final Map<ModelTier, Counter> decisionCounters = new EnumMap<>(ModelTier.class);

    public EconomicRouter(HeliosProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getRouting();
        for (ModelTier tier : ModelTier.values()) {
            decisionCounters.put(tier, Counter.builder("helios.routing.decisions")
                .description("Routing recommendations per tier")
                .tag("tier", tier.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
    }

    /**
     * Recommend a tier for a task
     *
     * @param request admission request being routed
     * @param status current budget snapshot
     * @return the recommendation with its confidence and reasoning
     */
    public RoutingDecision routeTask(TaskResourceRequest request, BudgetStatus status) {
        RoutingDecision decision = decide(request, status);
        countDecision(decision.getTier());
        log.debug("Task {} ({}) routed to {}: {}", request.getTaskId(), request.getTaskType(),
            decision.getTier(), decision.getReasoning());
        return decision;
    }

    /**
     * Component scores and weights behind a recommendation. Does not count as a routing decision.
     */
    public RoutingExplanation explainDecision(TaskResourceRequest request, BudgetStatus status) {
        double complexity = complexityScore(request);
        double budget = budgetFactor(status);
        double history = historyFactor(request.getTaskType());

        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("highCapability", config.getHighCapabilityThreshold());
        thresholds.put("economical", config.getEconomicalThreshold());
        thresholds.put("ampleHeadroomFactor", config.getAmpleHeadroomFactor());

        return RoutingExplanation.builder()
            .decision(decide(request, status))
            .complexityLevel(ComplexityLevel.of(complexity).name())
            .complexity(factor(complexity, config.getComplexityWeight()))
            .budgetHeadroom(factor(budget, config.getBudgetWeight()))
            .history(factor(history, config.getHistoryWeight()))
            .priority(factor(request.getPriority(), config.getPriorityWeight()))
            .decisionScore(decisionScore(complexity, budget, history, request.getPriority()))
            .thresholds(thresholds)
            .build();
    }

    /**
     * Feed a task outcome into the success rate average of its type and tier
     */
    public void recordOutcome(String taskType, ModelTier tier, boolean success) {
        String key = normalize(taskType);
        double alpha = config.getSmoothingFactor();
        performanceHistory.compute(key, (k, rates) -> {
            Map<ModelTier, Double> updated = rates == null ? initialRates() : new EnumMap<>(rates);
            double current = updated.get(tier);
            double next = current * (1 - alpha) + (success ? 1.0 : 0.0) * alpha;
            updated.put(tier, next);
            log.debug("Success rate of {} on {}: {} -> {}", k, tier,
                String.format("%.3f", current), String.format("%.3f", next));
            return updated;
        });
    }

    /**
     * Learned success rates and the active thresholds and weights
     */
    public Map<String, Object> getRoutingStats() {
        Map<String, Object> history = new LinkedHashMap<>();
        performanceHistory.forEach((type, rates) -> history.put(type, Map.copyOf(rates)));

        Map<String, Object> thresholds = new LinkedHashMap<>();
        thresholds.put("highCapability", config.getHighCapabilityThreshold());
        thresholds.put("economical", config.getEconomicalThreshold());
        thresholds.put("ampleHeadroomFactor", config.getAmpleHeadroomFactor());

        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("complexity", config.getComplexityWeight());
        weights.put("budget", config.getBudgetWeight());
        weights.put("history", config.getHistoryWeight());
        weights.put("priority", config.getPriorityWeight());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("performanceHistory", history);
        stats.put("thresholds", thresholds);
        stats.put("weights", weights);
        stats.put("taskTypeComplexity", config.getTaskTypeComplexity());
        return stats;
    }

    /**
     * Count a decision made earlier with {@link #decide}
     */
    public void countDecision(ModelTier tier) {
        decisionCounters.get(tier).increment();
    }

    /**
     * Recommendation without counting it, for callers that may discard the result
     */
    public RoutingDecision decide(TaskResourceRequest request, BudgetStatus status) {
        double complexity = complexityScore(request);
        ComplexityLevel level = ComplexityLevel.of(complexity);

        if (request.isRequiresHighCapability()) {
            return RoutingDecision.builder()
                .tier(ModelTier.HIGH_CAPABILITY)
                .confidence(1.0)
                .complexityScore(complexity)
                .reasoning("High capability explicitly required (" + level + ")")
                .build();
        }

        double budget = budgetFactor(status);
        double score = decisionScore(complexity, budget, historyFactor(request.getTaskType()), request.getPriority());
        RoutingDecision.RoutingDecisionBuilder decision = RoutingDecision.builder()
            .decisionScore(score)
            .complexityScore(complexity);

        if (score >= config.getHighCapabilityThreshold()) {
            if (status.isThrottling()) {
                return decision.tier(ModelTier.ECONOMICAL)
                    .confidence(0.7)
                    .reasoning(String.format("High capability indicated (score=%.2f) but budget is throttling", score))
                    .build();
            }
            return decision.tier(ModelTier.HIGH_CAPABILITY)
                .confidence(Math.min(1.0, (score - config.getHighCapabilityThreshold()) / 3.5 + 0.6))
                .reasoning(String.format("High capability recommended: %s task (score=%.2f)", level, score))
                .build();
        }

        if (score <= config.getEconomicalThreshold()) {
            return decision.tier(ModelTier.ECONOMICAL)
                .confidence(Math.min(1.0, (config.getEconomicalThreshold() - score) / 3.5 + 0.6))
                .reasoning(String.format("Economical sufficient: %s task (score=%.2f)", level, score))
                .build();
        }

        if (budget >= config.getAmpleHeadroomFactor() && !status.isThrottling()) {
            return decision.tier(ModelTier.HIGH_CAPABILITY)
                .confidence(0.6)
                .reasoning(String.format("Middle band with ample headroom: %s task (score=%.2f)", level, score))
                .build();
        }
        return decision.tier(ModelTier.ECONOMICAL)
            .confidence(0.7)
            .reasoning(String.format("Middle band, economical for cost efficiency (score=%.2f)", score))
            .build();
    }

    double complexityScore(TaskResourceRequest request) {
        double score = 5.0;

        String type = normalize(request.getTaskType());
        for (Map.Entry<String, Integer> entry : config.getTaskTypeComplexity().entrySet()) {
            if (type.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                score += (entry.getValue() - 5) * 0.4;
                break;
            }
        }

        long units = request.getEstimatedUnits();
        if (units <= 5) {
            score -= 0.9;
        } else if (units <= 20) {
            score -= 0.3;
        } else if (units <= 50) {
            score += 0.3;
        } else {
            score += 0.9;
        }

        if (request.getPriority() >= 8) {
            score += 0.1;
        } else if (request.getPriority() <= 3) {
            score -= 0.1;
        }

        return Math.max(1.0, Math.min(10.0, score));
    }

    double budgetFactor(BudgetStatus status) {
        double usage = status.getUtilizationPercent();
        if (usage < 40) {
            return 9.0;
        }
        if (usage < 60) {
            return 7.0;
        }
        if (usage < 80) {
            return 5.0;
        }
        if (usage < 95) {
            return 2.0;
        }
        return 0.0;
    }

    double historyFactor(String taskType) {
        Map<ModelTier, Double> rates = performanceHistory.get(normalize(taskType));
        if (rates == null) {
            return 5.0;
        }
        double diff = rates.get(ModelTier.HIGH_CAPABILITY) - rates.get(ModelTier.ECONOMICAL);
        if (diff > 0.2) {
            return 8.0;
        }
        if (diff > 0.1) {
            return 6.5;
        }
        if (diff > -0.1) {
            return 5.0;
        }
        if (diff > -0.2) {
            return 3.5;
        }
        return 2.0;
    }

    private double decisionScore(double complexity, double budget, double history, int priority) {
        return complexity * config.getComplexityWeight()
            + budget * config.getBudgetWeight()
            + history * config.getHistoryWeight()
            + priority * config.getPriorityWeight();
    }

    private static RoutingExplanation.Factor factor(double score, double weight) {
        return RoutingExplanation.Factor.builder().score(score).weight(weight).build();
    }

    private static Map<ModelTier, Double> initialRates() {
        Map<ModelTier, Double> rates = new EnumMap<>(ModelTier.class);
        rates.put(ModelTier.HIGH_CAPABILITY, NEUTRAL_SUCCESS_RATE);
        rates.put(ModelTier.ECONOMICAL, NEUTRAL_SUCCESS_RATE);
        return rates;
    }

    private static String normalize(String taskType) {
        return taskType == null ? "" : taskType.toLowerCase(Locale.ROOT);
    }
}
