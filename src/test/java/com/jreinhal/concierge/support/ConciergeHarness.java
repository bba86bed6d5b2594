package com.jreinhal.concierge.support;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.activity.RingBufferActivityStore;
import com.jreinhal.concierge.compliance.CompliancePurgeService;
import com.jreinhal.concierge.feedback.FeedbackLoopService;
import com.jreinhal.concierge.feedback.FeedbackProperties;
import com.jreinhal.concierge.feedback.InMemoryGoldenPathStore;
import com.jreinhal.concierge.governance.GovernanceViewService;
import com.jreinhal.concierge.graph.ActivityGraphProjector;
import com.jreinhal.concierge.graph.ActivityGraphService;
import com.jreinhal.concierge.graph.InMemoryGraphStore;
import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlQueueService;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlRequestType;
import com.jreinhal.concierge.hitl.HitlSlaPolicy;
import com.jreinhal.concierge.hitl.InMemoryHitlRequestStore;
import com.jreinhal.concierge.hitl.ReviewDecision;
import com.jreinhal.concierge.hitl.escalation.ContextEscalationPolicy;
import com.jreinhal.concierge.hitl.escalation.EscalationPolicyEngine;
import com.jreinhal.concierge.hitl.escalation.EscalationProperties;
import com.jreinhal.concierge.hitl.escalation.InMemoryReviewerDirectory;
import com.jreinhal.concierge.hitl.escalation.LeastLoadedReviewerStrategy;
import com.jreinhal.concierge.hitl.escalation.ReviewerSelector;
import com.jreinhal.concierge.hitl.escalation.ReviewerService;
import com.jreinhal.concierge.hitl.escalation.RoundRobinReviewerStrategy;
import com.jreinhal.concierge.playbook.DagWorkflowCompiler;
import com.jreinhal.concierge.playbook.InMemoryPlaybookStore;
import com.jreinhal.concierge.playbook.PlaybookEngine;
import com.jreinhal.concierge.playbook.PlaybookProperties;
import com.jreinhal.concierge.tenant.InMemoryTenantStore;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantQuotaService;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.OutageTracker;
import com.jreinhal.concierge.util.PipelineFailureLog;
import com.jreinhal.concierge.util.SimpleCircuitBreaker;
import com.jreinhal.concierge.vector.HashingEmbeddingModel;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The whole pipeline wired over in-memory stores. Store calls, outcome listeners and graph
 * projection all run on the caller thread, so a test sees every downstream effect as soon as the call
 * that caused it returns.
 */
public class ConciergeHarness implements AutoCloseable {
    public static final String START = "2026-03-02T09:00:00Z";

    public final MutableClock clock = MutableClock.startingAt(START);
    public final OutageTracker outageTracker = new OutageTracker(clock);
    public final PipelineFailureLog failureLog = new PipelineFailureLog(clock);

    public final InMemoryTenantStore tenantStore = new InMemoryTenantStore();
    public final TenantService tenantService = new TenantService(tenantStore, clock, "PROFESSIONAL");
    public final TenantQuotaService quotaService = new TenantQuotaService(tenantStore);

    public final RingBufferActivityStore activityStore = new RingBufferActivityStore(10_000);
    public final GuardedCall activityGuard = guard("activity");
    private final ExecutorService subscriptionExecutor = Executors.newCachedThreadPool();
    public final ActivityStreamService activityStream;

    public final InMemoryHitlRequestStore requestStore = new InMemoryHitlRequestStore();
    public final InMemoryGoldenPathStore goldenPathStore = new InMemoryGoldenPathStore();
    public final GuardedCall semanticGuard = guard("semantic");
    public final FeedbackProperties feedbackProperties = new FeedbackProperties();
    public final FeedbackLoopService feedbackLoop;
    public final HitlQueueService queue;

    public final InMemoryReviewerDirectory reviewerDirectory = new InMemoryReviewerDirectory();
    public final ReviewerService reviewerService = new ReviewerService(reviewerDirectory, clock);
    public final EscalationProperties escalationProperties = new EscalationProperties();
    public final ReviewerSelector reviewerSelector;
    public final ContextEscalationPolicy contextEscalation;
    public final EscalationPolicyEngine escalationEngine;

    public final InMemoryGraphStore graphStore = new InMemoryGraphStore();
    public final GuardedCall graphGuard = guard("graph");
    public final ActivityGraphProjector projector;
    public final ActivityGraphService graphService;

    public final InMemoryPlaybookStore playbookStore = new InMemoryPlaybookStore();
    public final GuardedCall playbookGuard = guard("playbooks");
    public final PlaybookProperties playbookProperties = new PlaybookProperties();
    public final PlaybookEngine playbookEngine;

    public final GovernanceViewService governanceView;
    public final CompliancePurgeService compliancePurge;

    public ConciergeHarness() {
        this.activityStream = new ActivityStreamService(activityStore, activityStore, activityGuard, clock,
                subscriptionExecutor, failureLog, 20L, 50);
        this.feedbackLoop = new FeedbackLoopService(goldenPathStore, semanticGuard, new HashingEmbeddingModel(),
                requestStore, quotaService, activityStream, failureLog, feedbackProperties, clock);
        this.reviewerSelector = new ReviewerSelector(reviewerDirectory, requestStore, escalationProperties,
                List.of(new LeastLoadedReviewerStrategy(), new RoundRobinReviewerStrategy()));
        this.contextEscalation = new ContextEscalationPolicy(escalationProperties, reviewerSelector);
        this.queue = new HitlQueueService(requestStore, HitlSlaPolicy.defaults(), quotaService, tenantService,
                activityStream, contextEscalation, List.of(feedbackLoop), Runnable::run, failureLog, clock, List.of("approve", "reject", "modify"), 50);
        this.escalationEngine = new EscalationPolicyEngine(requestStore, queue, reviewerSelector, escalationProperties,
                tenantService, activityStream, failureLog, clock);
        this.projector = new ActivityGraphProjector(activityStream, graphStore, graphGuard, Runnable::run,
                tenantService, failureLog, 100, 10_000L);
        this.projector.start();
        this.graphService = new ActivityGraphService(graphStore, graphGuard);
        this.playbookEngine = new PlaybookEngine(playbookStore, playbookGuard, graphService, new DagWorkflowCompiler(),
                tenantService, quotaService, activityStream, failureLog, playbookProperties, clock);
        this.governanceView = new GovernanceViewService(queue, feedbackLoop, activityStream, graphService, playbookEngine,
                failureLog, quotaService, Caffeine.newBuilder().expireAfterWrite(Duration.ofSeconds(5)).build(), clock);
        this.compliancePurge = new CompliancePurgeService(feedbackLoop, projector, graphService, playbookEngine,
                activityStream, governanceView, failureLog, clock);
    }

    public TenantContext tenant(String tenantId) {
        return this.tenantService.ensureTenant(tenantId, "PROFESSIONAL").toContext();
    }

    /**
     * Submits, claims and approves a request carrying the given ticket context.
     */
    public HitlRequest approve(TenantContext ctx, String ticketId, String customerId, String category, List<String> steps) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(HitlRequest.CTX_TICKET_ID, ticketId);
        context.put(HitlRequest.CTX_CUSTOMER_ID, customerId);
        context.put(HitlRequest.CTX_CATEGORY, category);
        context.put(HitlRequest.CTX_STEPS, steps);
        context.put(HitlRequest.CTX_PROPOSED_RESOLUTION, "Run " + String.join(", ", steps) + " for " + category);
        context.put("confidence", 0.9);
        HitlRequest request = this.queue.submit(ctx, new HitlQueueService.SubmitCommand("agent-7", HitlRequestType.APPROVAL,
                HitlPriority.MEDIUM, "Resolve " + category + " ticket " + ticketId + "?", context, null, null));
        this.queue.claim(ctx, request.requestId(), "rev-1");
        return this.queue.respond(ctx, request.requestId(), "rev-1",
                new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));
    }

    private GuardedCall guard(String store) {
        return new GuardedCall(store, new SimpleCircuitBreaker(store, 3, Duration.ofSeconds(30), 1, clock), null,
                Duration.ofSeconds(2), outageTracker);
    }

    @Override
    public void close() {
        this.subscriptionExecutor.shutdownNow();
    }
}
