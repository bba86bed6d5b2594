package com.jreinhal.concierge.governance;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.activity.ActivityStreamStats;
import com.jreinhal.concierge.feedback.FeedbackLoopService;
import com.jreinhal.concierge.graph.ActivityGraphService;
import com.jreinhal.concierge.hitl.HitlQueueService;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantQuotaService;
import com.jreinhal.concierge.playbook.PlaybookEngine;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Read-only aggregation for dashboards. Snapshots are cached per tenant for a few seconds so
 * dashboards polling in a loop do not fan out to every store on each call.
 */
@Service
public class GovernanceViewService {
    private static final Logger log = LoggerFactory.getLogger(GovernanceViewService.class);
    private final HitlQueueService queueService;
    private final FeedbackLoopService feedbackLoop;
    private final ActivityStreamService activityStream;
    private final ActivityGraphService graphService;
    private final PlaybookEngine playbookEngine;
    private final PipelineFailureLog failureLog;
    private final TenantQuotaService quotaService;
    private final Cache<String, GovernanceSnapshot> snapshotCache;
    private final Clock clock;

    public GovernanceViewService(HitlQueueService queueService,
                                 FeedbackLoopService feedbackLoop,
                                 ActivityStreamService activityStream,
                                 ActivityGraphService graphService,
                                 PlaybookEngine playbookEngine,
                                 PipelineFailureLog failureLog,
                                 TenantQuotaService quotaService,
                                 @Qualifier("governanceSnapshotCache") Cache<String, GovernanceSnapshot> snapshotCache,
                                 Clock clock) {
        this.queueService = queueService;
        this.feedbackLoop = feedbackLoop;
        this.activityStream = activityStream;
        this.graphService = graphService;
        this.playbookEngine = playbookEngine;
        this.failureLog = failureLog;
        this.quotaService = quotaService;
        this.snapshotCache = snapshotCache;
        this.clock = clock;
    }

    public GovernanceSnapshot snapshot(TenantContext ctx) {
        return this.snapshotCache.get(ctx.tenantId(), tenantId -> build(ctx));
    }

    /**
     * Drops the cached snapshot so the next read reflects a change made just now.
     */
    public void invalidate(TenantContext ctx) {
        this.snapshotCache.invalidate(ctx.tenantId());
    }

    private GovernanceSnapshot build(TenantContext ctx) {
        ActivityStreamStats activity = this.activityStream.stats(ctx);
        Map<String, Boolean> degraded = new LinkedHashMap<>();
        degraded.put("activity", activity.degraded());
        degraded.put("semantic", this.feedbackLoop.isDegraded());
        degraded.put("graph", this.graphService.isDegraded());
        degraded.put("playbooks", this.playbookEngine.isDegraded());
        return new GovernanceSnapshot(ctx.tenantId(), this.clock.instant(), this.queueService.stats(ctx),
                this.feedbackLoop.stats(ctx), activity, this.graphService.stats(ctx), this.playbookEngine.stats(ctx),
                this.failureLog.counts(ctx.tenantId()), this.failureLog.recent(ctx.tenantId()), quotaUsage(ctx), degraded);
    }

    private Map<QuotaResource, Long> quotaUsage(TenantContext ctx) {
        try {
            return this.quotaService.usage(ctx);
        }
        catch (RuntimeException e) {
            log.debug("Quota usage unavailable for tenant {}: {}", ctx.tenantId(), e.getMessage());
            return Map.of();
        }
    }
}
