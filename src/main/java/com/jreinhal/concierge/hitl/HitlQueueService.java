package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantQuotaService;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.LogSanitizer;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Claim/respond state machine over the request store.
 *
 * <p>{@code pending -> assigned -> completed}, or {@code pending/assigned -> expired} once the SLA
 * deadline passes. Each transition is one compare-and-swap in the store; when it fails the current
 * state is read back to tell the caller exactly why. Work that follows a committed transition
 * (events, quota release, feedback ingestion) is best-effort and never rolls the transition back.
 * Outcome listeners run on their own executor, off the caller's thread.</p>
 */
@Service
public class HitlQueueService {
    private static final Logger log = LoggerFactory.getLogger(HitlQueueService.class);
    private static final String SOURCE = "hitl-queue";
    private static final int MAX_OPTIONS = 20;
    private static final int MAX_QUESTION_LENGTH = 10_000;
    private static final int MAX_LIST_LIMIT = 500;
    private static final int CLAIM_ATTEMPTS = 3;
    private static final int RESPONSE_TIME_SAMPLE = 200;

    private final HitlRequestStore store;
    private final HitlSlaPolicy slaPolicy;
    private final TenantQuotaService quotaService;
    private final TenantService tenantService;
    private final ActivityStreamService activityStream;
    private final HitlIntakePolicy intakePolicy;
    private final List<HitlOutcomeListener> outcomeListeners;
    private final Executor outcomeExecutor;
    private final PipelineFailureLog failureLog;
    private final Clock clock;
    private final List<String> defaultOptions;
    private final int sweepBatchSize;

    public HitlQueueService(HitlRequestStore store,
                            HitlSlaPolicy slaPolicy,
                            TenantQuotaService quotaService,
                            TenantService tenantService,
                            ActivityStreamService activityStream,
                            HitlIntakePolicy intakePolicy,
                            List<HitlOutcomeListener> outcomeListeners,
                            @Qualifier("outcomeExecutor") Executor outcomeExecutor,
                            PipelineFailureLog failureLog,
                            Clock clock,
                            @Value("${concierge.hitl.default-options:approve,reject,modify}") List<String> defaultOptions,
                            @Value("${concierge.hitl.sweep-batch-size:200}") int sweepBatchSize) {
        this.store = store;
        this.slaPolicy = slaPolicy;
        this.quotaService = quotaService;
        this.tenantService = tenantService;
        this.activityStream = activityStream;
        this.intakePolicy = intakePolicy;
        this.outcomeListeners = List.copyOf(outcomeListeners);
        this.outcomeExecutor = outcomeExecutor;
        this.failureLog = failureLog;
        this.clock = clock;
        this.defaultOptions = List.copyOf(defaultOptions);
        this.sweepBatchSize = Math.max(1, sweepBatchSize);
    }

    /**
     * Admits a request as {@code pending}. A repeated call with the same dedup key returns the
     * request created by the first call and reserves nothing.
     *
     * <p>The intake policy may raise the priority before the SLA deadline is computed, and may hand
     * the new request straight to a reviewer, in which case it is returned {@code assigned}.</p>
     */
    public HitlRequest submit(TenantContext ctx, SubmitCommand command) {
        validate(command);
        String dedupKey = blankToNull(command.dedupKey());
        if (dedupKey != null) {
            Optional<HitlRequest> existing = this.store.findByDedupKey(ctx.tenantId(), dedupKey);
            if (existing.isPresent()) {
                log.debug("Duplicate submit for dedup key {} resolved to {}", LogSanitizer.sanitize(dedupKey), existing.get().requestId());
                return existing.get();
            }
        }
        List<String> options = normalizeOptions(command.options());
        Map<String, Object> context = command.context() != null ? new LinkedHashMap<>(command.context()) : new LinkedHashMap<>();
        Optional<HitlIntakePolicy.Escalation> escalation = this.intakePolicy.classify(ctx, command.priority(), context);
        HitlPriority priority = command.priority();
        if (escalation.isPresent()) {
            context.putAll(escalation.get().annotations());
            if (escalation.get().priority().rank() < priority.rank()) {
                priority = escalation.get().priority();
            }
        }
        this.quotaService.checkAndReserve(ctx, QuotaResource.HITL_QUEUE, 1);
        Instant now = this.clock.instant();
        HitlRequest request = new HitlRequest(UUID.randomUUID().toString(), ctx.tenantId(), command.agentId().trim(),
                command.requestType() != null ? command.requestType() : HitlRequestType.APPROVAL,
                priority, HitlStatus.PENDING, command.question().trim(), context, options, dedupKey, now, null, null,
                this.slaPolicy.deadlineFor(priority, now), null, null, null, null, null,
                escalation.map(e -> List.of(e.ruleName())).orElse(List.of()));
        HitlRequest stored;
        try {
            stored = this.store.insertIfAbsent(request);
        }
        catch (RuntimeException e) {
            this.quotaService.release(ctx, QuotaResource.HITL_QUEUE, 1);
            throw e;
        }
        if (!stored.requestId().equals(request.requestId())) {
            this.quotaService.release(ctx, QuotaResource.HITL_QUEUE, 1);
            return stored;
        }
        log.info("HITL request {} submitted by agent {} ({}, due {})", stored.requestId(),
                LogSanitizer.sanitize(stored.agentId()), stored.priority(), stored.slaDeadline());
        emit(ctx, ActivityEventTypes.HITL_CREATED, stored,
                escalation.map(HitlIntakePolicy.Escalation::annotations).orElse(Map.of()));
        return autoAssign(ctx, stored);
    }

    /**
     * The request is already admitted, so a failure here leaves it pending for a manual claim.
     */
    private HitlRequest autoAssign(TenantContext ctx, HitlRequest request) {
        try {
            Optional<String> reviewer = this.intakePolicy.autoAssignee(ctx, request);
            if (reviewer.isEmpty()) {
                return request;
            }
            Optional<HitlRequest> claimed = this.store.claim(ctx.tenantId(), request.requestId(), reviewer.get(), this.clock.instant());
            if (claimed.isEmpty()) {
                return request;
            }
            log.info("HITL request {} auto-assigned to {}", request.requestId(), LogSanitizer.sanitize(reviewer.get()));
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("reviewerId", reviewer.get());
            extra.put("autoAssigned", true);
            emit(ctx, ActivityEventTypes.HITL_CLAIMED, claimed.get(), extra);
            return claimed.get();
        }
        catch (RuntimeException e) {
            log.warn("Auto-assignment of HITL request {} failed: {}", request.requestId(), e.getMessage());
            this.failureLog.record(ctx.tenantId(), "hitl.auto_assign", request.requestId(), e);
            return request;
        }
    }

    /**
     * Atomically takes a pending request. Exactly one of any number of concurrent claimants wins;
     * the rest get {@link AlreadyClaimedException}.
     */
    public HitlRequest claim(TenantContext ctx, String requestId, String reviewerId) {
        requireText(reviewerId, "Reviewer id");
        for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
            Instant now = this.clock.instant();
            Optional<HitlRequest> claimed = this.store.claim(ctx.tenantId(), requestId, reviewerId, now);
            if (claimed.isPresent()) {
                log.debug("HITL request {} claimed by {}", requestId, LogSanitizer.sanitize(reviewerId));
                emit(ctx, ActivityEventTypes.HITL_CLAIMED, claimed.get(), Map.of("reviewerId", reviewerId));
                return claimed.get();
            }
            HitlRequest current = load(ctx, requestId);
            if (current.status() == HitlStatus.EXPIRED || current.isPastDeadline(now)) {
                throw new RequestExpiredException(requestId, "Request expired before it was claimed");
            }
            if (current.status() == HitlStatus.ASSIGNED) {
                log.debug("Claim on {} by {} lost the race", requestId, LogSanitizer.sanitize(reviewerId));
                throw new AlreadyClaimedException(requestId, "Request already claimed");
            }
            if (current.status() == HitlStatus.COMPLETED) {
                throw new InvalidRequestStateException(requestId, "Request already completed");
            }
        }
        throw new AlreadyClaimedException(requestId, "Request already claimed");
    }

    /**
     * Records the assignee's decision and completes the request.
     */
    public HitlRequest respond(TenantContext ctx, String requestId, String reviewerId, RespondCommand command) {
        requireText(reviewerId, "Reviewer id");
        if (command == null || command.decision() == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        if (command.decision() == ReviewDecision.MODIFY && (command.modifiedOutput() == null || command.modifiedOutput().isEmpty())) {
            throw new IllegalArgumentException("A modify decision requires the edited output");
        }
        Instant now = this.clock.instant();
        Map<String, Object> output = command.modifiedOutput() != null ? new LinkedHashMap<>(command.modifiedOutput()) : null;
        Optional<HitlRequest> completed = this.store.complete(ctx.tenantId(), requestId, reviewerId, command.decision(),
                blankToNull(command.notes()), output, now);
        if (completed.isEmpty()) {
            throw respondFailure(ctx, requestId, reviewerId, now);
        }
        HitlRequest request = completed.get();
        log.info("HITL request {} completed by {} with decision {}", requestId, LogSanitizer.sanitize(reviewerId), request.decision());
        afterTerminal(ctx, request);
        emit(ctx, request.decision().eventType(), request, decisionPayload(request));
        dispatchOutcome(ctx, request);
        return request;
    }

    private void dispatchOutcome(TenantContext ctx, HitlRequest request) {
        for (HitlOutcomeListener listener : this.outcomeListeners) {
            try {
                this.outcomeExecutor.execute(() -> notifyListener(listener, ctx, request));
            }
            catch (RejectedExecutionException e) {
                log.warn("Outcome of HITL request {} not delivered to {}: {}", request.requestId(),
                        listener.getClass().getSimpleName(), e.getMessage());
                this.failureLog.record(ctx.tenantId(), "hitl.outcome", request.requestId(), e);
            }
        }
    }

    private void notifyListener(HitlOutcomeListener listener, TenantContext ctx, HitlRequest request) {
        try {
            listener.onCompleted(ctx, request);
        }
        catch (RuntimeException e) {
            this.failureLog.record(ctx.tenantId(), "hitl.outcome", request.requestId(), e);
        }
    }

    /**
     * The assignee hands the request back to the queue.
     */
    public HitlRequest release(TenantContext ctx, String requestId, String reviewerId) {
        requireText(reviewerId, "Reviewer id");
        Optional<HitlRequest> released = this.store.release(ctx.tenantId(), requestId, reviewerId);
        if (released.isEmpty()) {
            HitlRequest current = load(ctx, requestId);
            if (current.status().isTerminal()) {
                throw new InvalidRequestStateException(requestId, "Request is already " + current.status().name().toLowerCase(Locale.ROOT));
            }
            throw new NotAssigneeException(requestId, "Request is not assigned to this reviewer");
        }
        emit(ctx, ActivityEventTypes.HITL_RELEASED, released.get(), Map.of("reviewerId", reviewerId));
        return released.get();
    }

    /**
     * Moves an open request from one reviewer to another. Returns empty when the request changed
     * state underneath, e.g. the current assignee responded first.
     */
    public Optional<HitlRequest> reassign(TenantContext ctx, String requestId, String fromReviewer, String toReviewer) {
        requireText(toReviewer, "Target reviewer id");
        if (fromReviewer != null && this.store.release(ctx.tenantId(), requestId, fromReviewer).isEmpty()) {
            return Optional.empty();
        }
        Optional<HitlRequest> claimed = this.store.claim(ctx.tenantId(), requestId, toReviewer, this.clock.instant());
        claimed.ifPresent(request -> {
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("reviewerId", toReviewer);
            if (fromReviewer != null) {
                extra.put("previousReviewerId", fromReviewer);
            }
            emit(ctx, ActivityEventTypes.HITL_REASSIGNED, request, extra);
        });
        return claimed;
    }

    /**
     * Marks an escalation rule as applied, optionally raising the priority. The SLA deadline is
     * kept as originally computed.
     */
    public Optional<HitlRequest> recordEscalation(TenantContext ctx, String requestId, String ruleName, HitlPriority newPriority) {
        Optional<HitlRequest> updated = this.store.recordEscalation(ctx.tenantId(), requestId, ruleName, newPriority);
        updated.ifPresent(request -> {
            if (newPriority != null) {
                emit(ctx, ActivityEventTypes.HITL_PRIORITY_ESCALATED, request, Map.of("rule", ruleName));
            }
        });
        return updated;
    }

    public HitlRequest manualEscalate(TenantContext ctx, String requestId, String reason) {
        HitlRequest current = load(ctx, requestId);
        if (!current.isOpen()) {
            throw new InvalidRequestStateException(requestId, "Only open requests can be escalated");
        }
        String ruleName = "manual-" + this.clock.millis();
        HitlRequest updated = this.store.recordEscalation(ctx.tenantId(), requestId, ruleName, current.priority().raise())
                .orElseThrow(() -> new InvalidRequestStateException(requestId, "Request changed state during escalation"));
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("rule", ruleName);
        extra.put("reason", reason != null ? reason : "manual");
        emit(ctx, ActivityEventTypes.HITL_PRIORITY_ESCALATED, updated, extra);
        log.info("HITL request {} manually escalated to {}", requestId, updated.priority());
        return updated;
    }

    public int sweepExpired() {
        return sweepExpired(() -> false);
    }

    /**
     * Expires every open request whose deadline has passed. Safe to run concurrently with itself
     * and with {@link #respond}: a request another caller already moved is skipped.
     *
     * @param stopRequested checked between requests so shutdown does not wait for a full sweep
     * @return requests this call expired
     */
    public int sweepExpired(BooleanSupplier stopRequested) {
        int expired = 0;
        while (!stopRequested.getAsBoolean()) {
            Instant now = this.clock.instant();
            List<HitlRequest> overdue = this.store.findOverdue(now, this.sweepBatchSize);
            int expiredThisBatch = 0;
            for (HitlRequest candidate : overdue) {
                if (stopRequested.getAsBoolean()) {
                    break;
                }
                Optional<HitlRequest> result = this.store.expire(candidate.tenantId(), candidate.requestId(), now);
                if (result.isEmpty()) {
                    continue;
                }
                expiredThisBatch++;
                HitlRequest request = result.get();
                TenantContext ctx = this.tenantService.systemContext(request.tenantId());
                log.info("SLA breached: HITL request {} ({}) expired at {}", request.requestId(), request.priority(), now);
                afterTerminal(ctx, request);
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put("slaDeadline", String.valueOf(request.slaDeadline()));
                extra.put("overdueSeconds", Duration.between(request.slaDeadline(), now).toSeconds());
                if (request.assignedTo() != null) {
                    extra.put("assignedTo", request.assignedTo());
                }
                emit(ctx, ActivityEventTypes.SLA_BREACHED, request, extra);
            }
            expired += expiredThisBatch;
            if (overdue.size() < this.sweepBatchSize || expiredThisBatch == 0) {
                break;
            }
        }
        return expired;
    }

    public HitlRequest get(TenantContext ctx, String requestId) {
        return load(ctx, requestId);
    }

    public List<HitlRequest> list(TenantContext ctx, HitlStatus status, HitlPriority priority, int limit) {
        return this.store.list(ctx.tenantId(), status, priority, Math.max(1, Math.min(limit, MAX_LIST_LIMIT)));
    }

    public List<HitlRequest> assignmentsFor(TenantContext ctx, String reviewerId) {
        return this.store.findOpenByAssignee(ctx.tenantId(), reviewerId);
    }

    public int openAssignmentCount(TenantContext ctx, String reviewerId) {
        return this.store.findOpenByAssignee(ctx.tenantId(), reviewerId).size();
    }

    public HitlQueueStats stats(TenantContext ctx) {
        Map<HitlStatus, Long> byStatus = new EnumMap<>(HitlStatus.class);
        for (HitlStatus status : HitlStatus.values()) {
            byStatus.put(status, this.store.count(ctx.tenantId(), status, null));
        }
        Map<HitlPriority, Long> openByPriority = new EnumMap<>(HitlPriority.class);
        for (HitlPriority priority : HitlPriority.values()) {
            openByPriority.put(priority, this.store.count(ctx.tenantId(), HitlStatus.PENDING, priority)
                    + this.store.count(ctx.tenantId(), HitlStatus.ASSIGNED, priority));
        }
        double averageSeconds = this.store.recentCompleted(ctx.tenantId(), RESPONSE_TIME_SAMPLE).stream()
                .filter(r -> r.respondedAt() != null && r.createdAt() != null)
                .mapToLong(r -> Duration.between(r.createdAt(), r.respondedAt()).toSeconds())
                .average()
                .orElse(0.0);
        return new HitlQueueStats(byStatus, openByPriority, byStatus.get(HitlStatus.EXPIRED), averageSeconds);
    }

    private HitlRequest load(TenantContext ctx, String requestId) {
        requireText(requestId, "Request id");
        HitlRequest request = this.store.findById(requestId).orElseThrow(() -> new NotFoundException("request", requestId));
        ctx.requireSameTenant(request.tenantId());
        return request;
    }

    private RuntimeException respondFailure(TenantContext ctx, String requestId, String reviewerId, Instant now) {
        HitlRequest current = load(ctx, requestId);
        if (current.status() == HitlStatus.EXPIRED || (current.isOpen() && current.isPastDeadline(now))) {
            return new RequestExpiredException(requestId, "Request expired before a decision was recorded");
        }
        if (current.status() == HitlStatus.COMPLETED) {
            return new InvalidRequestStateException(requestId, "Request already completed");
        }
        if (current.status() == HitlStatus.PENDING) {
            return new NotAssigneeException(requestId, "Request must be claimed before responding");
        }
        log.debug("Respond on {} rejected: {} is not the assignee", requestId, LogSanitizer.sanitize(reviewerId));
        return new NotAssigneeException(requestId, "Request is assigned to another reviewer");
    }

    private void afterTerminal(TenantContext ctx, HitlRequest request) {
        try {
            this.quotaService.release(ctx, QuotaResource.HITL_QUEUE, 1);
        }
        catch (RuntimeException e) {
            this.failureLog.record(ctx.tenantId(), "quota.release", request.requestId(), e);
        }
    }

    private void emit(TenantContext ctx, String eventType, HitlRequest request, Map<String, Object> extra) {
        Map<String, Object> payload = basePayload(request);
        payload.putAll(extra);
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(eventType, SOURCE, payload));
    }

    private static Map<String, Object> basePayload(HitlRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", request.requestId());
        payload.put("agentId", request.agentId());
        payload.put("priority", request.priority().name());
        payload.put("status", request.status().name());
        payload.put("requestType", request.requestType().name());
        putIfPresent(payload, HitlRequest.CTX_TICKET_ID, request.contextString(HitlRequest.CTX_TICKET_ID));
        putIfPresent(payload, HitlRequest.CTX_CUSTOMER_ID, request.contextString(HitlRequest.CTX_CUSTOMER_ID));
        putIfPresent(payload, HitlRequest.CTX_CATEGORY, request.contextString(HitlRequest.CTX_CATEGORY));
        return payload;
    }

    private static Map<String, Object> decisionPayload(HitlRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reviewerId", request.assignedTo());
        payload.put("decision", request.decision().name());
        putIfPresent(payload, "notes", request.notes());
        putIfPresent(payload, "confidence", request.context() != null ? request.context().get("confidence") : null);
        List<String> steps = request.contextList(HitlRequest.CTX_STEPS);
        if (!steps.isEmpty()) {
            payload.put("steps", steps);
        }
        List<String> articles = request.contextList(HitlRequest.CTX_ARTICLES);
        if (!articles.isEmpty()) {
            payload.put("articles", articles);
        }
        if (request.modifiedOutput() != null) {
            payload.put("modifiedOutput", request.modifiedOutput());
        }
        return payload;
    }

    private void validate(SubmitCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        requireText(command.agentId(), "Agent id");
        requireText(command.question(), "Question");
        if (command.question().length() > MAX_QUESTION_LENGTH) {
            throw new IllegalArgumentException("Question is too long");
        }
        if (command.priority() == null) {
            throw new IllegalArgumentException("Priority is required");
        }
    }

    private List<String> normalizeOptions(List<String> options) {
        if (options == null || options.isEmpty()) {
            return this.defaultOptions;
        }
        if (options.size() > MAX_OPTIONS) {
            throw new IllegalArgumentException("At most " + MAX_OPTIONS + " options are allowed");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String option : options) {
            if (option == null || option.isBlank()) {
                throw new IllegalArgumentException("Options must not be blank");
            }
            if (!normalized.add(option.trim())) {
                throw new IllegalArgumentException("Duplicate option: " + option.trim());
            }
        }
        return new ArrayList<>(normalized);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    public record SubmitCommand(
        String agentId,
        HitlRequestType requestType,
        HitlPriority priority,
        String question,
        Map<String, Object> context,
        List<String> options,
        String dedupKey
    ) {
    }

    public record RespondCommand(ReviewDecision decision, String notes, Map<String, Object> modifiedOutput) {
    }
}
