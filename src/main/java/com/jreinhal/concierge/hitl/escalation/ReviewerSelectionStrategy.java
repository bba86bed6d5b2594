package com.jreinhal.concierge.hitl.escalation;

import java.util.List;
import java.util.Optional;

/**
 * Picks the reviewer an escalated request moves to. Candidates arrive ordered by reviewer id,
 * already filtered to available reviewers other than the current assignee.
 */
public interface ReviewerSelectionStrategy {

    String name();

    Optional<String> select(String tenantId, List<ReviewerLoad> candidates);
}
