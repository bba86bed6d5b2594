package com.jreinhal.concierge.hitl.escalation;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class LeastLoadedReviewerStrategy implements ReviewerSelectionStrategy {
    public static final String NAME = "least-loaded";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> select(String tenantId, List<ReviewerLoad> candidates) {
        return candidates.stream()
                .filter(ReviewerLoad::hasCapacity)
                .min(Comparator.comparingInt(ReviewerLoad::openAssignments).thenComparing(ReviewerLoad::reviewerId))
                .map(ReviewerLoad::reviewerId);
    }
}
