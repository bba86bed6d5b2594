package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlRequestStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Picks a reviewer for a request using the configured {@link ReviewerSelectionStrategy}. Loads are
 * the reviewers' current open assignments; the cap falls back to the configured max workload.
 */
@Component
public class ReviewerSelector {
    private final ReviewerDirectory directory;
    private final HitlRequestStore requestStore;
    private final EscalationProperties properties;
    private final Map<String, ReviewerSelectionStrategy> strategies = new HashMap<>();

    public ReviewerSelector(ReviewerDirectory directory, HitlRequestStore requestStore, EscalationProperties properties,
                            List<ReviewerSelectionStrategy> strategies) {
        this.directory = directory;
        this.requestStore = requestStore;
        this.properties = properties;
        for (ReviewerSelectionStrategy strategy : strategies) {
            this.strategies.put(strategy.name(), strategy);
        }
        if (!this.strategies.containsKey(strategyName())) {
            throw new IllegalStateException("Unknown reassign strategy: " + properties.getReassignStrategy());
        }
    }

    /**
     * @param excludedReviewerId the current assignee, never picked again; may be null
     */
    public Optional<String> select(String tenantId, String excludedReviewerId) {
        List<ReviewerLoad> candidates = new ArrayList<>();
        for (Reviewer reviewer : this.directory.findAvailable(tenantId)) {
            if (reviewer.reviewerId().equals(excludedReviewerId)) {
                continue;
            }
            int cap = reviewer.maxWorkload() > 0 ? reviewer.maxWorkload() : this.properties.getMaxWorkload();
            candidates.add(new ReviewerLoad(reviewer, this.requestStore.findOpenByAssignee(tenantId, reviewer.reviewerId()).size(), cap));
        }
        return this.strategies.get(strategyName()).select(tenantId, candidates);
    }

    private String strategyName() {
        String configured = this.properties.getReassignStrategy();
        return configured != null ? configured.trim().toLowerCase(Locale.ROOT) : LeastLoadedReviewerStrategy.NAME;
    }
}
