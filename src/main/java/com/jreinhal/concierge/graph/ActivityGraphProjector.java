package com.jreinhal.concierge.graph;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.PipelineFailureLog;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Materializes the activity stream into the graph, one tenant at a time and strictly in
 * {@code sequenceNo} order from the tenant's checkpoint.
 *
 * <p>Each append schedules a catch-up for its tenant; appends arriving while one runs coalesce
 * into a single follow-up pass. A graph store failure stops the pass at the failing event, which is
 * retried on the next pass. An event whose payload cannot be projected is recorded and skipped.</p>
 */
@Component
public class ActivityGraphProjector {
    private static final Logger log = LoggerFactory.getLogger(ActivityGraphProjector.class);
    private final ActivityStreamService activityStream;
    private final GraphStore graphStore;
    private final GuardedCall guard;
    private final Executor executor;
    private final TenantService tenantService;
    private final PipelineFailureLog failureLog;
    private final int batchSize;
    private final Cache<String, Boolean> appliedEventIds;
    private final Map<String, TenantProjection> projections = new ConcurrentHashMap<>();

    public ActivityGraphProjector(ActivityStreamService activityStream,
                                  GraphStore graphStore,
                                  @Qualifier("graphStoreGuard") GuardedCall guard,
                                  @Qualifier("projectionExecutor") Executor executor,
                                  TenantService tenantService,
                                  PipelineFailureLog failureLog,
                                  @Value("${concierge.graph.batch-size:200}") int batchSize,
                                  @Value("${concierge.graph.dedupe-cache-size:10000}") long dedupeCacheSize) {
        this.activityStream = activityStream;
        this.graphStore = graphStore;
        this.guard = guard;
        this.executor = executor;
        this.tenantService = tenantService;
        this.failureLog = failureLog;
        this.batchSize = Math.max(1, batchSize);
        this.appliedEventIds = Caffeine.newBuilder()
                .maximumSize(Math.max(100L, dedupeCacheSize))
                .expireAfterWrite(Duration.ofHours(1))
                .build();
    }

    @PostConstruct
    public void start() {
        this.activityStream.addAppendListener((tenantId, sequenceNo) -> schedule(tenantId));
        log.info("Activity graph projection attached ({} store)", this.graphStore.isDurable() ? "durable" : "in-memory");
    }

    public void schedule(String tenantId) {
        TenantProjection projection = this.projections.computeIfAbsent(tenantId, id -> new TenantProjection());
        projection.dirty.set(true);
        if (!projection.scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            this.executor.execute(() -> drain(tenantId, projection));
        }
        catch (RejectedExecutionException e) {
            projection.scheduled.set(false);
            this.failureLog.record(tenantId, "graph.schedule", null, e);
        }
    }

    /**
     * Applies every event after the tenant's checkpoint.
     *
     * @return events applied (skipped duplicates and unprojectable events not counted)
     */
    public int catchUp(TenantContext ctx) {
        TenantProjection projection = this.projections.computeIfAbsent(ctx.tenantId(), id -> new TenantProjection());
        projection.lock.lock();
        try {
            return applyPending(ctx);
        }
        finally {
            projection.lock.unlock();
        }
    }

    /**
     * Drops the tenant's graph and replays the stream from the beginning.
     */
    public int rebuild(TenantContext ctx) {
        TenantProjection projection = this.projections.computeIfAbsent(ctx.tenantId(), id -> new TenantProjection());
        projection.lock.lock();
        try {
            this.guard.run(() -> this.graphStore.clear(ctx.tenantId()));
            String prefix = ctx.tenantId() + "|";
            this.appliedEventIds.asMap().keySet().removeIf(key -> key.startsWith(prefix));
            int applied = applyPending(ctx);
            log.info("Rebuilt activity graph for tenant {} from {} events", ctx.tenantId(), applied);
            return applied;
        }
        finally {
            projection.lock.unlock();
        }
    }

    public long checkpoint(TenantContext ctx) {
        return this.guard.call(() -> this.graphStore.checkpoint(ctx.tenantId()));
    }

    private void drain(String tenantId, TenantProjection projection) {
        do {
            try {
                while (projection.dirty.getAndSet(false)) {
                    catchUp(this.tenantService.systemContext(tenantId));
                }
            }
            catch (RuntimeException e) {
                this.failureLog.record(tenantId, "graph.project", null, e);
            }
            finally {
                projection.scheduled.set(false);
            }
        } while (projection.dirty.get() && projection.scheduled.compareAndSet(false, true));
    }

    private int applyPending(TenantContext ctx) {
        String tenantId = ctx.tenantId();
        int applied = 0;
        try {
            long position = this.guard.call(() -> this.graphStore.checkpoint(tenantId));
            while (true) {
                List<ActivityEvent> batch = this.activityStream.read(ctx, position, this.batchSize);
                if (batch.isEmpty()) {
                    break;
                }
                for (ActivityEvent event : batch) {
                    if (apply(event)) {
                        applied++;
                    }
                    long sequenceNo = event.sequenceNo();
                    this.guard.run(() -> this.graphStore.advanceCheckpoint(tenantId, sequenceNo));
                    position = sequenceNo;
                }
                if (batch.size() < this.batchSize) {
                    break;
                }
            }
        }
        catch (BackingStoreUnavailableException e) {
            log.debug("Graph projection for tenant {} paused: {}", tenantId, e.getMessage());
            this.failureLog.record(tenantId, "graph.project", null, e);
        }
        return applied;
    }

    /**
     * @return true when the event produced graph changes
     * @throws BackingStoreUnavailableException when the graph store rejects a write
     */
    private boolean apply(ActivityEvent event) {
        String dedupeKey = event.eventId() != null ? event.tenantId() + "|" + event.eventId() : null;
        if (dedupeKey != null && this.appliedEventIds.getIfPresent(dedupeKey) != null) {
            log.debug("Skipping redelivered event {} at sequence {}", event.eventId(), event.sequenceNo());
            return false;
        }
        GraphMutation mutation;
        try {
            mutation = GraphRecipes.plan(event);
        }
        catch (RuntimeException e) {
            log.warn("Event {} ({}) could not be projected: {}", event.sequenceNo(), event.eventType(), e.getMessage());
            this.failureLog.record(event.tenantId(), "graph.recipe", event.eventId(), e);
            return false;
        }
        if (!mutation.isEmpty()) {
            this.guard.run(() -> {
                mutation.nodes().forEach(this.graphStore::upsertNode);
                mutation.edges().forEach(this.graphStore::upsertEdge);
            });
        }
        if (dedupeKey != null) {
            this.appliedEventIds.put(dedupeKey, Boolean.TRUE);
        }
        return !mutation.isEmpty();
    }

    private static final class TenantProjection {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean dirty = new AtomicBoolean();
        private final AtomicBoolean scheduled = new AtomicBoolean();
    }
}
