package com.whereq.helios.model;

import com.whereq.helios.config.HeliosProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

    @Test
    @DisplayName("Deadline urgency raises the priority score")
    void deadlineUrgency() {
        assertEquals(5.0, task(null, 0).priorityScore(NOW));
        assertEquals(10.0, task(Duration.ofMinutes(30), 0).priorityScore(NOW));
        assertEquals(8.0, task(Duration.ofHours(3), 0).priorityScore(NOW));
        assertEquals(6.5, task(Duration.ofHours(12), 0).priorityScore(NOW));
        assertEquals(5.5, task(Duration.ofHours(30), 0).priorityScore(NOW));
        assertEquals(5.0, task(Duration.ofDays(3), 0).priorityScore(NOW));
    }

    @Test
    @DisplayName("Each retry lowers the score, never below zero")
    void retryPenalty() {
        assertEquals(4.0, task(null, 2).priorityScore(NOW));
        assertEquals(0.0, task(null, 20).priorityScore(NOW));
    }

    @Test
    @DisplayName("A deadline has passed only strictly after it")
    void deadlinePassed() {
        Task task = task(Duration.ZERO, 0);
        assertFalse(task.isDeadlinePassed(NOW));
        assertTrue(task.isDeadlinePassed(NOW.plusMillis(1)));
        assertFalse(task(null, 0).isDeadlinePassed(NOW));
    }

    @Test
    @DisplayName("Budget health boundaries")
    void budgetHealth() {
        assertEquals(BudgetHealth.NORMAL, BudgetHealth.classify(79.9, 80, 95));
        assertEquals(BudgetHealth.THROTTLED, BudgetHealth.classify(80, 80, 95));
        assertEquals(BudgetHealth.THROTTLED, BudgetHealth.classify(95, 80, 95));
        assertEquals(BudgetHealth.CRITICAL, BudgetHealth.classify(95.1, 80, 95));
    }

    @Test
    @DisplayName("Retry backoff doubles up to its cap")
    void retryBackoff() {
        RetryPolicy policy = RetryPolicy.from(new HeliosProperties().getScheduler());

        assertEquals(Duration.ofSeconds(1), policy.backoff(0));
        assertEquals(Duration.ofSeconds(2), policy.backoff(1));
        assertEquals(Duration.ofSeconds(8), policy.backoff(3));
        assertEquals(Duration.ofSeconds(60), policy.backoff(10));
    }

    @Test
    @DisplayName("Window adjustments never drive a counter negative")
    void windowAdjustments() {
        UsageWindow window = UsageWindow.open(NOW, Duration.ofHours(5), 100)
            .adjust(ModelTier.HIGH_CAPABILITY, 30)
            .adjust(ModelTier.ECONOMICAL, 10)
            .adjust(ModelTier.ECONOMICAL, -25);

        assertEquals(30, window.getHighCapabilityUnits());
        assertEquals(0, window.getEconomicalUnits());
        assertEquals(70, window.remainingUnits());
        assertEquals(30.0, window.utilizationPercent());
        assertFalse(window.hasElapsed(NOW.plus(Duration.ofHours(5)).minusMillis(1)));
        assertTrue(window.hasElapsed(NOW.plus(Duration.ofHours(5))));
    }

    private static Task task(Duration deadlineIn, int retryCount) {
        return Task.builder()
            .taskId("t")
            .priority(5)
            .retryCount(retryCount)
            .deadline(deadlineIn == null ? null : NOW.plus(deadlineIn))
            .build();
    }
}
