package com.whereq.helios.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Helios.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "helios")
@Data
public class HeliosProperties {

    private StoreConfig store = new StoreConfig();

    private BudgetConfig budget = new BudgetConfig();

    private RoutingConfig routing = new RoutingConfig();

    private CacheConfig cache = new CacheConfig();

    private SchedulerConfig scheduler = new SchedulerConfig();

    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class StoreConfig {
        /**
         * Shared state backend.
         * MEMORY: process-local store, state is lost on restart (default)
         * REDIS: Redis-backed store, shared across worker processes
         */
        private StoreType type = StoreType.MEMORY;

        /**
         * Prefix applied to every key written to the store.
         */
        private String keyPrefix = "helios:";

        /**
         * How often the in-memory store purges expired entries.
         */
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class BudgetConfig {
        /**
         * Length of a usage window.
         */
        private Duration windowDuration = Duration.ofHours(5);

        /**
         * Hard ceiling on admitted task-units per window.
         */
        private long ceiling = 900;

        /**
         * Number of closed windows retained for trend reporting.
         */
        private int historySize = 24;

        /**
         * Utilization percentage at which throttling starts.
         */
        private double throttleThresholdPercent = 80.0;

        /**
         * Utilization percentage above which only high-priority work is admitted.
         */
        private double criticalThresholdPercent = 95.0;

        /**
         * Minimum priority admitted in the critical zone.
         */
        private int criticalMinPriority = 8;

        /**
         * How long an unreconciled reservation is remembered.
         */
        private Duration reservationTtl = Duration.ofHours(12);
    }

    @Data
    public static class RoutingConfig {
        /**
         * Decision score at or above which the high-capability tier is recommended.
         */
        private double highCapabilityThreshold = 6.5;

        /**
         * Decision score at or below which the economical tier is recommended.
         */
        private double economicalThreshold = 4.5;

        /**
         * Budget headroom factor at which the middle band resolves to the high-capability tier.
         */
        private double ampleHeadroomFactor = 9.0;

        /**
         * Smoothing factor of the per-task-type success rate moving average.
         */
        private double smoothingFactor = 0.2;

        private double complexityWeight = 0.4;

        private double budgetWeight = 0.3;

        private double historyWeight = 0.2;

        private double priorityWeight = 0.1;

        /**
         * Intrinsic complexity (1-10) per task type pattern, matched as a substring in declaration order.
         */
        private Map<String, Integer> taskTypeComplexity = defaultTaskTypeComplexity();

        private static Map<String, Integer> defaultTaskTypeComplexity() {
            Map<String, Integer> weights = new LinkedHashMap<>();
            weights.put("prd_generation", 7);
            weights.put("code_generation", 8);
            weights.put("code_review", 6);
            weights.put("documentation", 4);
            weights.put("testing", 5);
            weights.put("refactoring", 7);
            return weights;
        }
    }

    @Data
    public static class CacheConfig {
        /**
         * Upper bound for a single tier lookup before it is treated as a miss.
         */
        private Duration lookupTimeout = Duration.ofSeconds(2);

        private ContextTierConfig l1 = new ContextTierConfig();

        private ExactTierConfig l2 = new ExactTierConfig();

        private SemanticTierConfig l3 = new SemanticTierConfig();
    }

    @Data
    public static class ContextTierConfig {
        private boolean enabled = true;

        private Duration ttl = Duration.ofMinutes(5);

        /**
         * Minimum estimated size of a context prefix worth caching.
         */
        private int minPrefixTokens = 1024;

        /**
         * Characters per token used for size estimation.
         */
        private int charsPerToken = 4;
    }

    @Data
    public static class ExactTierConfig {
        private boolean enabled = true;

        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class SemanticTierConfig {
        private boolean enabled = true;

        private Duration ttl = Duration.ofHours(24);

        /**
         * Minimum cosine similarity for a semantic hit.
         */
        private double similarityThreshold = 0.85;

        /**
         * Dimension of vectors produced by the built-in hashing embedding provider.
         */
        private int embeddingDimension = 256;
    }

    @Data
    public static class SchedulerConfig {
        /**
         * Maximum tasks dispatched in parallel within one wave.
         */
        private int maxParallel = 10;

        /**
         * Worker threads shared by all projects for executor calls.
         */
        private int globalConcurrency = 32;

        private int maxRetries = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private int backoffMultiplier = 2;

        private Duration maxBackoff = Duration.ofSeconds(60);

        /**
         * Longest wait between two admission attempts of a queued task.
         */
        private Duration admissionPollInterval = Duration.ofSeconds(30);

        /**
         * Longest a task may wait for admission before failing.
         */
        private Duration maxQueueWait = Duration.ofHours(5);

        private Duration cacheTimeout = Duration.ofSeconds(5);

        private Duration admissionTimeout = Duration.ofSeconds(10);

        private Duration executionTimeout = Duration.ofMinutes(10);

        /**
         * Retention of persisted project status snapshots.
         */
        private Duration statusTtl = Duration.ofDays(7);

        /**
         * How long a settled project's tasks stay in memory; its status snapshot outlives it in the store.
         */
        private Duration finishedRunRetention = Duration.ofHours(1);

        /**
         * How often settled and abandoned project runs are evicted.
         */
        private Duration runSweepInterval = Duration.ofMinutes(1);

        /**
         * Minutes one task-unit is expected to take, for plan duration estimates.
         */
        private double planMinutesPerUnit = 2.0;

        /**
         * Cost weight of a task that does not require the high-capability tier, for plan cost estimates.
         */
        private double optionalTaskCostWeight = 1.5;
    }

    @Data
    public static class ExecutorConfig {
        /**
         * Agent gateway endpoint receiving task executions.
         */
        private String endpoint = "http://localhost:8090/api/v1/agents/execute";

        private Duration timeout = Duration.ofMinutes(5);
    }

    public enum StoreType {
        /**
         * Process-local map with lazy expiry.
         */
        MEMORY,

        /**
         * Redis, shared by every Helios process pointing at the same instance.
         */
        REDIS
    }
}
