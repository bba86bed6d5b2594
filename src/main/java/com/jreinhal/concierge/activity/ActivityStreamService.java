package com.jreinhal.concierge.activity;

import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.LogSanitizer;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Append-only, per-tenant ordered event log.
 *
 * <p>Appends for one tenant are serialized by a tenant-local lock so sequence allocation and the
 * write happen as one step; tenants never contend with each other. When the durable store is
 * unreachable, appends continue into the in-process ring buffer with sequence numbers that pick up
 * from the highest number this process has issued, and the durable counter is pushed past them
 * before the next durable append. Reads merge both stores by sequence number
 * and drop a second copy of an event id, which happens when a timed-out durable write commits late.</p>
 *
 * <p>Known limit: if the durable store is down before this process has issued any number for a
 * tenant, degraded numbering starts from the ring buffer's own counter.</p>
 */
@Service
public class ActivityStreamService {
    private static final Logger log = LoggerFactory.getLogger(ActivityStreamService.class);
    private static final int MAX_READ_LIMIT = 1000;

    private final ActivityStore primary;
    private final RingBufferActivityStore fallback;
    private final GuardedCall guard;
    private final Clock clock;
    private final ExecutorService subscriptionExecutor;
    private final PipelineFailureLog failureLog;
    private final Duration pollInterval;
    private final int batchSize;
    private final Map<String, TenantStreamState> states = new ConcurrentHashMap<>();
    private final List<ActivityAppendListener> appendListeners = new CopyOnWriteArrayList<>();

    public ActivityStreamService(ActivityStore primary,
                                 @Qualifier("activityRingBuffer") RingBufferActivityStore fallback,
                                 @Qualifier("activityStoreGuard") GuardedCall guard,
                                 Clock clock,
                                 @Qualifier("activityExecutor") ExecutorService subscriptionExecutor,
                                 PipelineFailureLog failureLog,
                                 @Value("${concierge.activity.poll-interval-ms:500}") long pollIntervalMs,
                                 @Value("${concierge.activity.batch-size:200}") int batchSize) {
        this.primary = primary;
        this.fallback = fallback;
        this.guard = guard;
        this.clock = clock;
        this.subscriptionExecutor = subscriptionExecutor;
        this.failureLog = failureLog;
        this.pollInterval = Duration.ofMillis(Math.max(10L, pollIntervalMs));
        this.batchSize = Math.max(1, batchSize);
        if (!primary.isDurable()) {
            log.warn("Activity stream running on the in-process ring buffer: events are lost on restart");
        }
    }

    public ActivityEvent append(TenantContext ctx, ActivityEventDraft draft) {
        validate(draft);
        ActivityEventDraft resolved = resolve(draft);
        TenantStreamState state = state(ctx.tenantId());
        ActivityEvent event;
        state.appendLock.lock();
        try {
            event = this.primary.isDurable() ? appendDurable(ctx, resolved, state) : appendLocal(this.primary, ctx, resolved);
            state.highestIssued = Math.max(state.highestIssued, event.sequenceNo());
        } finally {
            state.appendLock.unlock();
        }
        wake(ctx.tenantId());
        for (ActivityAppendListener listener : this.appendListeners) {
            try {
                listener.onAppended(ctx.tenantId(), event.sequenceNo());
            }
            catch (RuntimeException e) {
                log.warn("Append listener failed for tenant {}: {}", ctx.tenantId(), e.getMessage());
            }
        }
        return event;
    }

    /**
     * Append used by pipeline stages that must not fail their caller. Failures are recorded in
     * the pipeline failure log.
     */
    public Optional<ActivityEvent> appendQuietly(TenantContext ctx, ActivityEventDraft draft) {
        try {
            return Optional.of(append(ctx, draft));
        }
        catch (RuntimeException e) {
            this.failureLog.record(ctx.tenantId(), "activity.append", draft != null ? draft.eventType() : null, e);
            return Optional.empty();
        }
    }

    public List<ActivityEvent> read(TenantContext ctx, long afterSequence, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_READ_LIMIT));
        if (!this.primary.isDurable()) {
            return this.primary.readAfter(ctx.tenantId(), afterSequence, bounded);
        }
        List<ActivityEvent> local = this.fallback.readAfter(ctx.tenantId(), afterSequence, bounded);
        List<ActivityEvent> durable;
        try {
            durable = this.guard.call(() -> this.primary.readAfter(ctx.tenantId(), afterSequence, bounded));
        }
        catch (BackingStoreUnavailableException e) {
            return contiguousFrom(local, afterSequence);
        }
        return merge(durable, local, bounded);
    }

    public List<ActivityEvent> latest(TenantContext ctx, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_READ_LIMIT));
        if (!this.primary.isDurable()) {
            return this.primary.latest(ctx.tenantId(), bounded);
        }
        List<ActivityEvent> local = this.fallback.latest(ctx.tenantId(), bounded);
        List<ActivityEvent> durable;
        try {
            durable = this.guard.call(() -> this.primary.latest(ctx.tenantId(), bounded));
        }
        catch (BackingStoreUnavailableException e) {
            durable = List.of();
        }
        List<ActivityEvent> merged = merge(durable, local, Integer.MAX_VALUE);
        return List.copyOf(merged.subList(Math.max(0, merged.size() - bounded), merged.size()));
    }

    public long length(TenantContext ctx) {
        return stats(ctx).length();
    }

    public ActivityStreamStats stats(TenantContext ctx) {
        String tenantId = ctx.tenantId();
        if (!this.primary.isDurable()) {
            return new ActivityStreamStats(this.primary.count(tenantId), this.primary.highestSequence(tenantId), 0L, false, false);
        }
        long buffered = this.fallback.count(tenantId);
        try {
            long durable = this.guard.call(() -> this.primary.count(tenantId));
            long highest = this.guard.call(() -> this.primary.highestSequence(tenantId));
            return new ActivityStreamStats(durable + buffered, Math.max(highest, state(tenantId).highestIssued), buffered, true, this.guard.isDegraded());
        }
        catch (BackingStoreUnavailableException e) {
            return new ActivityStreamStats(buffered, state(tenantId).highestIssued, buffered, true, true);
        }
    }

    /**
     * Opens a cursor that yields events with {@code sequenceNo > fromSequence}.
     */
    public ActivityCursor subscribe(TenantContext ctx, long fromSequence) {
        return new ActivityCursor(this, ctx, fromSequence, this.batchSize, this.pollInterval);
    }

    /**
     * Delivers events after {@code fromSequence} to {@code listener} on the stream executor.
     * A listener failure redelivers the same event after one poll interval.
     */
    public ActivitySubscription subscribe(TenantContext ctx, long fromSequence, Consumer<ActivityEvent> listener) {
        ActivityCursor cursor = subscribe(ctx, fromSequence);
        ActivitySubscription subscription = new ActivitySubscription(cursor);
        subscription.attach(this.subscriptionExecutor.submit(() -> deliver(ctx, cursor, listener)));
        return subscription;
    }

    public void addAppendListener(ActivityAppendListener listener) {
        this.appendListeners.add(listener);
    }

    /**
     * Compliance-only delete path. Both stores are purged; the durable store must be reachable.
     */
    public long purgeSubject(TenantContext ctx, String subjectId) {
        long removed = this.fallback.deleteBySubject(ctx.tenantId(), subjectId);
        if (this.primary != this.fallback) {
            if (this.primary.isDurable()) {
                removed += this.guard.call(() -> this.primary.deleteBySubject(ctx.tenantId(), subjectId));
            } else {
                removed += this.primary.deleteBySubject(ctx.tenantId(), subjectId);
            }
        }
        return removed;
    }

    public boolean isDurable() {
        return this.primary.isDurable();
    }

    public boolean isDegraded() {
        return !this.primary.isDurable() || this.guard.isDegraded();
    }

    long appendVersion(String tenantId) {
        return state(tenantId).version.get();
    }

    void awaitAppend(String tenantId, long observedVersion, long maxWaitMs) throws InterruptedException {
        TenantStreamState state = state(tenantId);
        synchronized (state.signal) {
            if (state.version.get() == observedVersion && maxWaitMs > 0) {
                state.signal.wait(maxWaitMs);
            }
        }
    }

    void wake(String tenantId) {
        TenantStreamState state = state(tenantId);
        synchronized (state.signal) {
            state.version.incrementAndGet();
            state.signal.notifyAll();
        }
    }

    private ActivityEvent appendDurable(TenantContext ctx, ActivityEventDraft draft, TenantStreamState state) {
        try {
            ActivityEvent event = this.guard.call(() -> {
                if (state.resyncNeeded) {
                    this.primary.advanceSequenceTo(ctx.tenantId(), state.highestIssued);
                }
                return appendLocal(this.primary, ctx, draft);
            });
            if (state.resyncNeeded) {
                log.info("Durable stream resumed for tenant {} at sequence {}", ctx.tenantId(), event.sequenceNo());
                state.resyncNeeded = false;
            }
            return event;
        }
        catch (BackingStoreUnavailableException e) {
            long next = Math.max(state.highestIssued, this.fallback.highestSequence(ctx.tenantId())) + 1;
            ActivityEvent event = build(ctx, draft, next);
            this.fallback.insert(event);
            state.resyncNeeded = true;
            return event;
        }
    }

    private ActivityEvent appendLocal(ActivityStore store, TenantContext ctx, ActivityEventDraft draft) {
        long sequence = store.allocateSequence(ctx.tenantId());
        ActivityEvent event = build(ctx, draft, sequence);
        store.insert(event);
        return event;
    }

    /**
     * Fixes the event id and timestamp before any store is tried, so an append that times out on
     * the durable store and lands in the ring buffer keeps one identity even if the durable insert
     * commits late.
     */
    private ActivityEventDraft resolve(ActivityEventDraft draft) {
        String eventId = draft.eventId() != null && !draft.eventId().isBlank() ? draft.eventId() : UUID.randomUUID().toString();
        Instant timestamp = draft.timestamp() != null ? draft.timestamp() : this.clock.instant();
        String source = draft.source() != null && !draft.source().isBlank() ? draft.source() : "unknown";
        return new ActivityEventDraft(eventId, draft.eventType().trim(), source, draft.payload(), timestamp);
    }

    private ActivityEvent build(TenantContext ctx, ActivityEventDraft draft, long sequence) {
        Map<String, Object> payload = draft.payload() != null ? new LinkedHashMap<>(draft.payload()) : new LinkedHashMap<>();
        return new ActivityEvent(ActivityEvent.storageId(ctx.tenantId(), sequence), draft.eventId(), ctx.tenantId(),
                draft.eventType(), draft.source(), payload, draft.timestamp(), sequence);
    }

    private void deliver(TenantContext ctx, ActivityCursor cursor, Consumer<ActivityEvent> listener) {
        try {
            while (!cursor.isClosed() && !Thread.currentThread().isInterrupted()) {
                Optional<ActivityEvent> next = cursor.poll(this.pollInterval);
                if (next.isEmpty()) {
                    continue;
                }
                ActivityEvent event = next.get();
                try {
                    listener.accept(event);
                }
                catch (RuntimeException e) {
                    log.warn("Subscriber failed on {} seq {} for tenant {}, redelivering: {}", event.eventType(),
                            event.sequenceNo(), ctx.tenantId(), LogSanitizer.sanitize(e.getMessage()));
                    cursor.rewindTo(event.sequenceNo() - 1);
                    Thread.sleep(this.pollInterval.toMillis());
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Subscription for tenant {} stopped at sequence {}", ctx.tenantId(), cursor.position());
    }

    private static List<ActivityEvent> merge(List<ActivityEvent> durable, List<ActivityEvent> local, int limit) {
        Map<Long, ActivityEvent> bySequence = new LinkedHashMap<>();
        Set<String> eventIds = new HashSet<>();
        List<ActivityEvent> all = new ArrayList<>(durable.size() + local.size());
        all.addAll(durable);
        all.addAll(local);
        all.sort(Comparator.comparingLong(ActivityEvent::sequenceNo));
        for (ActivityEvent event : all) {
            // a late durable commit of an event that also went to the ring buffer
            if (bySequence.containsKey(event.sequenceNo()) || !eventIds.add(event.eventId())) {
                continue;
            }
            bySequence.put(event.sequenceNo(), event);
            if (bySequence.size() >= limit) {
                break;
            }
        }
        return new ArrayList<>(bySequence.values());
    }

    /**
     * With the durable store unreadable, only ring-buffer events that directly follow the reader's
     * position are safe to hand out; anything past a hole may sit behind unread durable events.
     */
    private static List<ActivityEvent> contiguousFrom(List<ActivityEvent> local, long afterSequence) {
        List<ActivityEvent> result = new ArrayList<>();
        long expected = afterSequence + 1;
        for (ActivityEvent event : local) {
            if (event.sequenceNo() != expected) {
                break;
            }
            result.add(event);
            expected++;
        }
        return result;
    }

    private static void validate(ActivityEventDraft draft) {
        if (draft == null || draft.eventType() == null || draft.eventType().isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
    }

    private TenantStreamState state(String tenantId) {
        return this.states.computeIfAbsent(tenantId, id -> new TenantStreamState());
    }

    private static final class TenantStreamState {
        private final ReentrantLock appendLock = new ReentrantLock();
        private final Object signal = new Object();
        private final AtomicLong version = new AtomicLong();
        private volatile long highestIssued;
        private volatile boolean resyncNeeded;
    }
}
