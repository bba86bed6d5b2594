package com.jreinhal.concierge.hitl.escalation;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Rotates through the tenant's reviewers, skipping anyone at capacity. The cursor is per tenant.
 */
@Component
public class RoundRobinReviewerStrategy implements ReviewerSelectionStrategy {
    public static final String NAME = "round-robin";
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> select(String tenantId, List<ReviewerLoad> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        AtomicInteger cursor = this.cursors.computeIfAbsent(tenantId, id -> new AtomicInteger());
        int start = Math.floorMod(cursor.getAndIncrement(), candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            ReviewerLoad candidate = candidates.get((start + i) % candidates.size());
            if (candidate.hasCapacity()) {
                return Optional.of(candidate.reviewerId());
            }
        }
        return Optional.empty();
    }
}
