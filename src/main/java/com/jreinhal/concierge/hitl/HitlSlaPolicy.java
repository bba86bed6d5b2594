package com.jreinhal.concierge.hitl;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Priority to response-time budget.
 */
@Component
public class HitlSlaPolicy {
    private final Map<HitlPriority, Duration> budgets = new EnumMap<>(HitlPriority.class);

    public HitlSlaPolicy(@Value("${concierge.hitl.sla.critical:10m}") Duration critical,
                         @Value("${concierge.hitl.sla.high:30m}") Duration high,
                         @Value("${concierge.hitl.sla.medium:2h}") Duration medium,
                         @Value("${concierge.hitl.sla.low:24h}") Duration low) {
        put(HitlPriority.CRITICAL, critical);
        put(HitlPriority.HIGH, high);
        put(HitlPriority.MEDIUM, medium);
        put(HitlPriority.LOW, low);
    }

    public static HitlSlaPolicy defaults() {
        return new HitlSlaPolicy(Duration.ofMinutes(10), Duration.ofMinutes(30), Duration.ofHours(2), Duration.ofHours(24));
    }

    public Duration budgetFor(HitlPriority priority) {
        return this.budgets.get(priority);
    }

    public Instant deadlineFor(HitlPriority priority, Instant createdAt) {
        return createdAt.plus(budgetFor(priority));
    }

    public Map<HitlPriority, Duration> budgets() {
        return Map.copyOf(this.budgets);
    }

    private void put(HitlPriority priority, Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            throw new IllegalArgumentException("SLA budget for " + priority + " must be positive");
        }
        this.budgets.put(priority, budget);
    }
}
