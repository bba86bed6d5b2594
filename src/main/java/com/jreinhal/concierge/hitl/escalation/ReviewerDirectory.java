package com.jreinhal.concierge.hitl.escalation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReviewerDirectory {

    /**
     * Inserts or replaces the reviewer. Registration time is kept from the first registration.
     */
    Reviewer register(Reviewer reviewer);

    Optional<Reviewer> find(String tenantId, String reviewerId);

    Optional<Reviewer> setAvailability(String tenantId, String reviewerId, boolean available, Instant at);

    /** Available reviewers of the tenant ordered by reviewer id. */
    List<Reviewer> findAvailable(String tenantId);

    List<Reviewer> list(String tenantId);
}
