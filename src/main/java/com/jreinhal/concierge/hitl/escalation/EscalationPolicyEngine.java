package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlQueueService;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlRequestStore;
import com.jreinhal.concierge.hitl.HitlStatus;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies age/priority/status rules to open HITL requests. Runs right after each SLA sweep.
 *
 * <p>A rule fires at most once per request; the rule name is recorded on the request only after
 * its action succeeded, so a reassignment that found no reviewer is tried again next pass.</p>
 */
@Service
public class EscalationPolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(EscalationPolicyEngine.class);
    static final String NO_REVIEWER = "no_reviewer_available";
    static final String STATE_CHANGED = "request_state_changed";

    private final HitlRequestStore requestStore;
    private final HitlQueueService queueService;
    private final ReviewerSelector reviewerSelector;
    private final EscalationProperties properties;
    private final TenantService tenantService;
    private final ActivityStreamService activityStream;
    private final PipelineFailureLog failureLog;
    private final Clock clock;
    private final Map<String, List<EscalationRule>> tenantRules = new ConcurrentHashMap<>();
    private volatile List<EscalationRule> defaultRules;
    private ScanPosition scanPosition;

    public EscalationPolicyEngine(HitlRequestStore requestStore,
                                  HitlQueueService queueService,
                                  ReviewerSelector reviewerSelector,
                                  EscalationProperties properties,
                                  TenantService tenantService,
                                  ActivityStreamService activityStream,
                                  PipelineFailureLog failureLog,
                                  Clock clock) {
        this.requestStore = requestStore;
        this.queueService = queueService;
        this.reviewerSelector = reviewerSelector;
        this.properties = properties;
        this.tenantService = tenantService;
        this.activityStream = activityStream;
        this.failureLog = failureLog;
        this.clock = clock;
        this.defaultRules = properties.toRules();
    }

    public EscalationReport evaluate() {
        return evaluate(this.clock.instant());
    }

    public EscalationReport evaluate(Instant now) {
        if (!this.properties.isEnabled()) {
            return EscalationReport.empty(now);
        }
        List<HitlRequest> open = nextScanWindow(Math.max(1, this.properties.getScanLimit()));
        List<EscalationReport.ActionTaken> actions = new ArrayList<>();
        List<EscalationReport.Failure> failures = new ArrayList<>();
        List<EscalationReport.SlaBreach> breaches = new ArrayList<>();
        Map<String, TenantContext> contexts = new HashMap<>();
        for (HitlRequest request : open) {
            if (request.isPastDeadline(now)) {
                breaches.add(new EscalationReport.SlaBreach(request.tenantId(), request.requestId(), request.priority(), request.slaDeadline()));
                continue;
            }
            TenantContext ctx = contexts.computeIfAbsent(request.tenantId(), this.tenantService::systemContext);
            HitlRequest current = request;
            for (EscalationRule rule : rulesFor(request.tenantId())) {
                if (!rule.matches(current, now)) {
                    continue;
                }
                try {
                    Optional<HitlRequest> updated = apply(ctx, current, rule, now, actions, failures);
                    if (updated.isEmpty()) {
                        break;
                    }
                    boolean priorityChanged = updated.get().priority() != current.priority();
                    current = updated.get();
                    if (priorityChanged || current.status() != request.status()) {
                        break;
                    }
                }
                catch (RuntimeException e) {
                    this.failureLog.record(request.tenantId(), "escalation", request.requestId(), e);
                    failures.add(new EscalationReport.Failure(request.tenantId(), request.requestId(), rule.name(), "error: " + e.getMessage()));
                    break;
                }
            }
        }
        if (!actions.isEmpty() || !failures.isEmpty()) {
            log.info("Escalation pass: {} open requests, {} actions, {} failures, {} past SLA",
                    open.size(), actions.size(), failures.size(), breaches.size());
        }
        return new EscalationReport(now, open.size(), actions, failures, breaches);
    }

    /**
     * Up to {@code limit} open requests continuing from where the previous pass stopped, wrapping
     * to the oldest request at the end, so a backlog larger than the limit is still covered over
     * consecutive passes.
     */
    private synchronized List<HitlRequest> nextScanWindow(int limit) {
        ScanPosition start = this.scanPosition;
        List<HitlRequest> window = new ArrayList<>(start != null
                ? this.requestStore.findOpen(start.createdAt(), start.requestId(), limit)
                : this.requestStore.findOpen(null, null, limit));
        if (window.size() < limit && start != null) {
            Set<String> seen = new HashSet<>();
            window.forEach(r -> seen.add(r.requestId()));
            for (HitlRequest request : this.requestStore.findOpen(null, null, limit - window.size())) {
                if (seen.add(request.requestId())) {
                    window.add(request);
                }
            }
        }
        this.scanPosition = window.size() < limit ? null : ScanPosition.of(window.get(window.size() - 1));
        return window;
    }

    /**
     * Replaces the default rules for one tenant. An empty list disables escalation for the tenant.
     */
    public void setTenantRules(TenantContext ctx, List<EscalationRule> rules) {
        this.tenantRules.put(ctx.tenantId(), List.copyOf(rules));
        log.info("Escalation rules for tenant {} overridden ({} rules)", ctx.tenantId(), rules.size());
    }

    public void clearTenantRules(TenantContext ctx) {
        this.tenantRules.remove(ctx.tenantId());
    }

    public List<EscalationRule> rulesFor(TenantContext ctx) {
        return rulesFor(ctx.tenantId());
    }

    public void setDefaultRules(List<EscalationRule> rules) {
        this.defaultRules = List.copyOf(rules);
    }

    private List<EscalationRule> rulesFor(String tenantId) {
        return this.tenantRules.getOrDefault(tenantId, this.defaultRules);
    }

    /**
     * @return the request after the action, or empty when nothing more should run for it this pass
     */
    private Optional<HitlRequest> apply(TenantContext ctx, HitlRequest request, EscalationRule rule, Instant now,
                                        List<EscalationReport.ActionTaken> actions, List<EscalationReport.Failure> failures) {
        switch (rule.action()) {
            case NOTIFY: {
                Optional<HitlRequest> marked = this.queueService.recordEscalation(ctx, request.requestId(), rule.name(), null);
                if (marked.isEmpty()) {
                    failures.add(new EscalationReport.Failure(ctx.tenantId(), request.requestId(), rule.name(), STATE_CHANGED));
                    return Optional.empty();
                }
                notify(ctx, marked.get(), rule, now);
                actions.add(new EscalationReport.ActionTaken(ctx.tenantId(), request.requestId(), rule.name(), rule.action(),
                        "notified at " + request.priority().name().toLowerCase(Locale.ROOT)));
                return marked;
            }
            case AUTO_ESCALATE_PRIORITY: {
                HitlPriority raised = request.priority().raise();
                Optional<HitlRequest> updated = this.queueService.recordEscalation(ctx, request.requestId(), rule.name(),
                        raised != request.priority() ? raised : null);
                if (updated.isEmpty()) {
                    failures.add(new EscalationReport.Failure(ctx.tenantId(), request.requestId(), rule.name(), STATE_CHANGED));
                    return Optional.empty();
                }
                actions.add(new EscalationReport.ActionTaken(ctx.tenantId(), request.requestId(), rule.name(), rule.action(),
                        request.priority() + " -> " + updated.get().priority()));
                return updated;
            }
            case REASSIGN:
            default: {
                Optional<String> target = this.reviewerSelector.select(ctx.tenantId(), request.assignedTo());
                if (target.isEmpty()) {
                    log.warn("No reviewer available to take over HITL request {} (rule {})", request.requestId(), rule.name());
                    failures.add(new EscalationReport.Failure(ctx.tenantId(), request.requestId(), rule.name(), NO_REVIEWER));
                    return Optional.empty();
                }
                Optional<HitlRequest> reassigned = this.queueService.reassign(ctx, request.requestId(), request.assignedTo(), target.get());
                if (reassigned.isEmpty()) {
                    failures.add(new EscalationReport.Failure(ctx.tenantId(), request.requestId(), rule.name(), STATE_CHANGED));
                    return Optional.empty();
                }
                Optional<HitlRequest> marked = this.queueService.recordEscalation(ctx, request.requestId(), rule.name(), null);
                actions.add(new EscalationReport.ActionTaken(ctx.tenantId(), request.requestId(), rule.name(), rule.action(),
                        (request.assignedTo() != null ? request.assignedTo() : "queue") + " -> " + target.get()));
                return marked.isPresent() ? marked : reassigned;
            }
        }
    }

    private void notify(TenantContext ctx, HitlRequest request, EscalationRule rule, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", request.requestId());
        payload.put("rule", rule.name());
        payload.put("priority", request.priority().name());
        payload.put("status", request.status().name());
        payload.put("ageSeconds", Duration.between(request.createdAt(), now).toSeconds());
        payload.put("slaDeadline", String.valueOf(request.slaDeadline()));
        if (request.status() == HitlStatus.ASSIGNED) {
            payload.put("assignedTo", request.assignedTo());
        }
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(ActivityEventTypes.HITL_ESCALATION_NOTIFIED, "escalation", payload));
    }

    private record ScanPosition(Instant createdAt, String requestId) {
        static ScanPosition of(HitlRequest request) {
            return new ScanPosition(request.createdAt(), request.requestId());
        }
    }
}
