package com.jreinhal.concierge.feedback;

import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.hitl.HitlOutcomeListener;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlRequestStore;
import com.jreinhal.concierge.hitl.HitlStatus;
import com.jreinhal.concierge.hitl.InvalidRequestStateException;
import com.jreinhal.concierge.tenant.QuotaExceededException;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantQuotaService;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.PipelineFailureLog;
import com.jreinhal.concierge.vector.HashingEmbeddingModel;
import com.jreinhal.concierge.vector.VectorMath;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Turns decided HITL requests into golden paths and serves semantic lookups over them.
 *
 * <p>Capture is best-effort. When the semantic store is unavailable new records wait in a bounded
 * buffer (oldest evicted) and {@link #search} answers with an empty list instead of failing.</p>
 */
@Service
public class FeedbackLoopService implements HitlOutcomeListener {
    private static final Logger log = LoggerFactory.getLogger(FeedbackLoopService.class);
    private static final String SOURCE = "feedback-loop";
    private static final String DEFAULT_CATEGORY = "general";
    private static final double CORRECTED_CONFIDENCE = 0.95;
    private static final int MAX_QUERY_LENGTH = 4000;

    private final GoldenPathStore store;
    private final GuardedCall guard;
    private final EmbeddingModel embeddingModel;
    private final HitlRequestStore requestStore;
    private final TenantQuotaService quotaService;
    private final ActivityStreamService activityStream;
    private final PipelineFailureLog failureLog;
    private final FeedbackProperties properties;
    private final Clock clock;
    private final LinkedHashMap<String, BufferedPath> buffer = new LinkedHashMap<>();
    private final AtomicLong evicted = new AtomicLong();

    @Autowired
    public FeedbackLoopService(GoldenPathStore store,
                               @Qualifier("semanticStoreGuard") GuardedCall guard,
                               ObjectProvider<EmbeddingModel> embeddingModels,
                               HitlRequestStore requestStore,
                               TenantQuotaService quotaService,
                               ActivityStreamService activityStream,
                               PipelineFailureLog failureLog,
                               FeedbackProperties properties,
                               Clock clock) {
        this(store, guard, embeddingModels.getIfAvailable(HashingEmbeddingModel::new), requestStore, quotaService,
                activityStream, failureLog, properties, clock);
    }

    public FeedbackLoopService(GoldenPathStore store,
                               GuardedCall guard,
                               EmbeddingModel embeddingModel,
                               HitlRequestStore requestStore,
                               TenantQuotaService quotaService,
                               ActivityStreamService activityStream,
                               PipelineFailureLog failureLog,
                               FeedbackProperties properties,
                               Clock clock) {
        this.store = store;
        this.guard = guard;
        this.embeddingModel = embeddingModel;
        this.requestStore = requestStore;
        this.quotaService = quotaService;
        this.activityStream = activityStream;
        this.failureLog = failureLog;
        this.properties = properties;
        this.clock = clock;
        log.info("Feedback loop using embedding model {}", embeddingModel.getClass().getSimpleName());
    }

    @Override
    public void onCompleted(TenantContext ctx, HitlRequest request) {
        ingest(ctx, request);
    }

    /**
     * Records a golden path for an approved or corrected request. Rejections and requests that
     * never reached a decision produce nothing.
     *
     * @return the record, stored or buffered, or empty when nothing was recorded
     */
    public Optional<GoldenPathRecord> ingest(TenantContext ctx, HitlRequest request) {
        ctx.requireSameTenant(request.tenantId());
        if (request.status() != HitlStatus.COMPLETED || request.decision() == null) {
            return Optional.empty();
        }
        switch (request.decision()) {
            case APPROVE:
                return record(ctx, build(request, GoldenPathOutcome.APPROVED, approvalConfidence(request),
                        request.contextString(HitlRequest.CTX_PROPOSED_RESOLUTION)));
            case MODIFY:
                return record(ctx, build(request, GoldenPathOutcome.CORRECTED, CORRECTED_CONFIDENCE,
                        correctedResolution(request.modifiedOutput())));
            default:
                log.debug("No golden path for rejected request {}", request.requestId());
                return Optional.empty();
        }
    }

    /**
     * External satisfaction signal on a completed request, 1 to 5. Scores at or above the
     * configured threshold ingest the request as a golden path; every score is logged to the
     * activity stream.
     */
    public FeedbackReceipt recordFeedback(TenantContext ctx, String requestId, int score) {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException("Score must be between 1 and 5");
        }
        HitlRequest request = this.requestStore.findById(requestId).orElseThrow(() -> new NotFoundException("request", requestId));
        ctx.requireSameTenant(request.tenantId());
        if (request.status() != HitlStatus.COMPLETED) {
            throw new InvalidRequestStateException(requestId, "Feedback can only be recorded for completed requests");
        }
        Optional<GoldenPathRecord> recorded = Optional.empty();
        if (score >= this.properties.getScoreThreshold()) {
            recorded = record(ctx, build(request, GoldenPathOutcome.POSITIVE_SCORE, score / 5.0,
                    resolutionOf(request)));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("score", score);
        payload.put("goldenPathRecorded", recorded.isPresent());
        putSubject(payload, request.contextString(HitlRequest.CTX_CUSTOMER_ID));
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(ActivityEventTypes.FEEDBACK_RECORDED, SOURCE, payload));
        return new FeedbackReceipt(requestId, score, recorded.isPresent(), recorded.map(GoldenPathRecord::pathId).orElse(null));
    }

    /**
     * Nearest golden paths for the tenant. Advisory only: returns an empty list when the semantic
     * store is degraded.
     */
    public List<GoldenPathMatch> search(TenantContext ctx, String query, Integer topK, String category) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        String text = query.length() > MAX_QUERY_LENGTH ? query.substring(0, MAX_QUERY_LENGTH) : query;
        int k = topK == null || topK <= 0 ? this.properties.getDefaultTopK() : Math.min(topK, this.properties.getMaxTopK());
        String normalizedCategory = GoldenPathRecord.normalizeCategory(category);
        try {
            return this.guard.call(() -> {
                float[] embedding = this.embeddingModel.embed(text);
                return this.store.search(ctx.tenantId(), embedding, normalizedCategory, k, this.properties.getMinSimilarity());
            }).stream()
                    .filter(scored -> ctx.owns(scored.record().tenantId()))
                    .map(scored -> GoldenPathMatch.of(scored.record(), scored.similarity()))
                    .toList();
        }
        catch (BackingStoreUnavailableException e) {
            log.debug("Golden path search degraded for tenant {}: {}", ctx.tenantId(), e.getMessage());
            return List.of();
        }
    }

    public List<GoldenPathRecord> recent(TenantContext ctx, int limit) {
        try {
            return this.guard.call(() -> this.store.recent(ctx.tenantId(), Math.max(1, Math.min(limit, 200))));
        }
        catch (BackingStoreUnavailableException e) {
            return List.of();
        }
    }

    /**
     * Retries buffered records, oldest first, and stops at the first failure.
     *
     * @return records written by this call
     */
    @Scheduled(fixedDelayString = "${concierge.feedback.flush-interval-ms:15000}")
    public int flushBuffer() {
        int flushed = 0;
        while (true) {
            BufferedPath next = oldestBuffered();
            if (next == null) {
                break;
            }
            boolean inserted;
            try {
                inserted = persist(next.record());
            }
            catch (BackingStoreUnavailableException e) {
                log.debug("Semantic store still unavailable, {} golden paths remain buffered", bufferedCount());
                break;
            }
            removeBuffered(next.record().pathId());
            if (inserted) {
                flushed++;
                emitRecorded(next.ctx(), next.record());
            }
            else {
                releaseQuota(next.ctx(), next.record());
            }
        }
        if (flushed > 0) {
            log.info("Flushed {} buffered golden paths to the semantic store", flushed);
        }
        return flushed;
    }

    public FeedbackStats stats(TenantContext ctx) {
        long count;
        try {
            count = this.guard.call(() -> this.store.count(ctx.tenantId()));
        }
        catch (BackingStoreUnavailableException e) {
            count = -1L;
        }
        return new FeedbackStats(count, bufferedCount(ctx.tenantId()), this.evicted.get(), this.guard.isDegraded());
    }

    /**
     * Deletes every golden path, stored or buffered, whose trace names the subject.
     *
     * @throws BackingStoreUnavailableException when the store cannot be reached; a purge must not
     *                                          silently skip durable records
     */
    public long purgeSubject(TenantContext ctx, String subjectId) {
        long removed = 0;
        synchronized (this.buffer) {
            Iterator<BufferedPath> it = this.buffer.values().iterator();
            while (it.hasNext()) {
                GoldenPathRecord record = it.next().record();
                if (ctx.owns(record.tenantId()) && Objects.equals(subjectId, record.subjectId())) {
                    it.remove();
                    removed++;
                }
            }
        }
        long deleted = this.guard.call(() -> this.store.deleteBySubject(ctx.tenantId(), subjectId));
        removed += deleted;
        if (removed > 0) {
            this.quotaService.release(ctx, QuotaResource.GOLDEN_PATHS, removed);
        }
        return removed;
    }

    public boolean isDegraded() {
        return this.guard.isDegraded();
    }

    private Optional<GoldenPathRecord> record(TenantContext ctx, GoldenPathRecord candidate) {
        try {
            this.quotaService.checkAndReserve(ctx, QuotaResource.GOLDEN_PATHS, 1);
        }
        catch (QuotaExceededException e) {
            log.warn("Golden path for request {} dropped: tenant {} is at its golden path quota", candidate.sourceRequestId(), ctx.tenantId());
            this.failureLog.record(ctx.tenantId(), "feedback.quota", candidate.sourceRequestId(), e);
            return Optional.empty();
        }
        try {
            if (!persist(candidate)) {
                releaseQuota(ctx, candidate);
                return Optional.empty();
            }
        }
        catch (BackingStoreUnavailableException e) {
            return buffer(ctx, candidate);
        }
        log.info("Golden path {} recorded ({}, category {})", candidate.pathId(), candidate.outcome(), candidate.category());
        emitRecorded(ctx, candidate);
        return Optional.of(candidate);
    }

    private boolean persist(GoldenPathRecord record) {
        return this.guard.call(() -> this.store.insertIfAbsent(embedded(record)));
    }

    private GoldenPathRecord embedded(GoldenPathRecord record) {
        if (record.isEmbedded()) {
            return record;
        }
        float[] embedding = this.embeddingModel.embed(record.query());
        return record.withEmbedding(VectorMath.toList(embedding), VectorMath.squaredNorm(embedding));
    }

    private Optional<GoldenPathRecord> buffer(TenantContext ctx, GoldenPathRecord candidate) {
        BufferedPath dropped = null;
        synchronized (this.buffer) {
            if (this.buffer.containsKey(candidate.pathId())) {
                releaseQuota(ctx, candidate);
                return Optional.of(candidate);
            }
            if (this.buffer.size() >= Math.max(1, this.properties.getBufferCapacity())) {
                Iterator<BufferedPath> oldest = this.buffer.values().iterator();
                dropped = oldest.next();
                oldest.remove();
            }
            this.buffer.put(candidate.pathId(), new BufferedPath(ctx, candidate));
        }
        if (dropped != null) {
            this.evicted.incrementAndGet();
            releaseQuota(dropped.ctx(), dropped.record());
            log.warn("Golden path buffer full, evicted {} for tenant {}", dropped.record().pathId(), dropped.ctx().tenantId());
        }
        return Optional.of(candidate);
    }

    private BufferedPath oldestBuffered() {
        synchronized (this.buffer) {
            return this.buffer.isEmpty() ? null : this.buffer.values().iterator().next();
        }
    }

    private void removeBuffered(String pathId) {
        synchronized (this.buffer) {
            this.buffer.remove(pathId);
        }
    }

    private int bufferedCount() {
        synchronized (this.buffer) {
            return this.buffer.size();
        }
    }

    private int bufferedCount(String tenantId) {
        synchronized (this.buffer) {
            return (int) this.buffer.values().stream().filter(b -> b.ctx().owns(tenantId)).count();
        }
    }

    private void releaseQuota(TenantContext ctx, GoldenPathRecord record) {
        try {
            this.quotaService.release(ctx, QuotaResource.GOLDEN_PATHS, 1);
        }
        catch (RuntimeException e) {
            this.failureLog.record(ctx.tenantId(), "quota.release", record.sourceRequestId(), e);
        }
    }

    private void emitRecorded(TenantContext ctx, GoldenPathRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pathId", record.pathId());
        payload.put("requestId", record.sourceRequestId());
        payload.put("category", record.category());
        payload.put("outcome", record.outcome().name());
        payload.put("confidence", record.confidence());
        putSubject(payload, record.subjectId());
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(ActivityEventTypes.GOLDEN_PATH_RECORDED, SOURCE, payload));
    }

    private GoldenPathRecord build(HitlRequest request, GoldenPathOutcome outcome, double confidence, String resolution) {
        String category = GoldenPathRecord.normalizeCategory(request.contextString(HitlRequest.CTX_CATEGORY));
        String query = request.contextString(HitlRequest.CTX_QUERY);
        return new GoldenPathRecord(GoldenPathRecord.pathIdFor(request.requestId()), request.tenantId(), request.requestId(),
                category != null ? category : DEFAULT_CATEGORY,
                query != null && !query.isBlank() ? query : request.question(),
                resolution != null ? resolution : "",
                request.contextList(HitlRequest.CTX_STEPS), request.contextList(HitlRequest.CTX_ARTICLES),
                confidence, outcome, request.assignedTo(), request.contextString(HitlRequest.CTX_CUSTOMER_ID),
                null, null, this.clock.instant());
    }

    private static double approvalConfidence(HitlRequest request) {
        Object value = request.context() != null ? request.context().get("confidence") : null;
        if (value instanceof Number number) {
            return Math.max(0.0, Math.min(1.0, number.doubleValue()));
        }
        return 1.0;
    }

    private static String resolutionOf(HitlRequest request) {
        if (request.modifiedOutput() != null) {
            return correctedResolution(request.modifiedOutput());
        }
        return request.contextString(HitlRequest.CTX_PROPOSED_RESOLUTION);
    }

    private static String correctedResolution(Map<String, Object> output) {
        if (output == null) {
            return null;
        }
        for (String key : List.of("response", "resolution")) {
            Object value = output.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return String.valueOf(output);
    }

    private static void putSubject(Map<String, Object> payload, String subjectId) {
        if (subjectId != null) {
            payload.put(HitlRequest.CTX_CUSTOMER_ID, subjectId);
        }
    }

    private record BufferedPath(TenantContext ctx, GoldenPathRecord record) {
    }
}
