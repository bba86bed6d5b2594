package com.jreinhal.concierge.hitl.escalation;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReviewerDirectory implements ReviewerDirectory {
    private final Map<String, Reviewer> reviewers = new ConcurrentHashMap<>();

    @Override
    public Reviewer register(Reviewer reviewer) {
        return this.reviewers.merge(reviewer.id(), reviewer, (existing, incoming) -> new Reviewer(incoming.id(),
                incoming.tenantId(), incoming.reviewerId(), incoming.name(), incoming.skills(), incoming.maxWorkload(),
                incoming.available(), existing.registeredAt(), incoming.updatedAt()));
    }

    @Override
    public Optional<Reviewer> find(String tenantId, String reviewerId) {
        return Optional.ofNullable(this.reviewers.get(Reviewer.storageId(tenantId, reviewerId)));
    }

    @Override
    public Optional<Reviewer> setAvailability(String tenantId, String reviewerId, boolean available, Instant at) {
        return Optional.ofNullable(this.reviewers.computeIfPresent(Reviewer.storageId(tenantId, reviewerId),
                (id, current) -> current.withAvailability(available, at)));
    }

    @Override
    public List<Reviewer> findAvailable(String tenantId) {
        return list(tenantId).stream().filter(Reviewer::available).toList();
    }

    @Override
    public List<Reviewer> list(String tenantId) {
        return this.reviewers.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Reviewer::reviewerId))
                .toList();
    }
}
