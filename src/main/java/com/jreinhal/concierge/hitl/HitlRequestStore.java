package com.jreinhal.concierge.hitl;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for HITL requests. Every state transition is a single compare-and-swap: it returns
 * the new state when the guard held and {@link Optional#empty()} when it did not, leaving the
 * stored request untouched.
 */
public interface HitlRequestStore {

    /**
     * Stores the request unless the tenant already has one with the same non-null dedup key.
     *
     * @return the stored request, which is the existing one on a dedup hit
     */
    HitlRequest insertIfAbsent(HitlRequest request);

    /**
     * Unscoped lookup; callers check the owning tenant themselves.
     */
    Optional<HitlRequest> findById(String requestId);

    Optional<HitlRequest> findByDedupKey(String tenantId, String dedupKey);

    /** {@code pending} with deadline after {@code now} → {@code assigned} to the reviewer. */
    Optional<HitlRequest> claim(String tenantId, String requestId, String reviewerId, Instant now);

    /** {@code assigned} to the reviewer with deadline after {@code now} → {@code completed}. */
    Optional<HitlRequest> complete(String tenantId, String requestId, String reviewerId, ReviewDecision decision,
                                   String notes, Map<String, Object> modifiedOutput, Instant now);

    /** {@code assigned} to {@code expectedAssignee} → {@code pending}. */
    Optional<HitlRequest> release(String tenantId, String requestId, String expectedAssignee);

    /** {@code pending}/{@code assigned} with deadline at or before {@code now} → {@code expired}. */
    Optional<HitlRequest> expire(String tenantId, String requestId, Instant now);

    /**
     * Marks an escalation rule as applied to an open request, optionally changing its priority.
     * Fails when the rule was already applied or the request is terminal.
     */
    Optional<HitlRequest> recordEscalation(String tenantId, String requestId, String ruleName, HitlPriority newPriority);

    /** Open requests of any tenant whose deadline is at or before {@code now}, earliest first. */
    List<HitlRequest> findOverdue(Instant now, int limit);

    /**
     * Open requests of any tenant ordered by creation time, then request id, starting strictly
     * after the given position. A null {@code afterCreatedAt} starts from the oldest request.
     */
    List<HitlRequest> findOpen(Instant afterCreatedAt, String afterRequestId, int limit);

    /**
     * Tenant listing ordered by priority, then creation time, then request id.
     * Null filters match everything.
     */
    List<HitlRequest> list(String tenantId, HitlStatus status, HitlPriority priority, int limit);

    List<HitlRequest> findOpenByAssignee(String tenantId, String reviewerId);

    long count(String tenantId, HitlStatus status, HitlPriority priority);

    /** Most recently completed requests, newest first. */
    List<HitlRequest> recentCompleted(String tenantId, int limit);
}
