package com.jreinhal.concierge.activity;

import java.util.List;

/**
 * Storage for per-tenant event logs. Implementations own one monotonic counter per tenant.
 */
public interface ActivityStore {

    /**
     * Atomically hands out the next sequence number for the tenant.
     */
    long allocateSequence(String tenantId);

    /**
     * Moves the tenant counter forward to at least {@code floor}; never moves it back.
     */
    void advanceSequenceTo(String tenantId, long floor);

    long highestSequence(String tenantId);

    void insert(ActivityEvent event);

    /**
     * Events with {@code sequenceNo > afterSequence}, ascending.
     */
    List<ActivityEvent> readAfter(String tenantId, long afterSequence, int limit);

    /**
     * The newest {@code limit} events, ascending.
     */
    List<ActivityEvent> latest(String tenantId, int limit);

    long count(String tenantId);

    long deleteBySubject(String tenantId, String subjectId);

    /**
     * False for process-local stores whose contents vanish on restart.
     */
    boolean isDurable();
}
