package com.jreinhal.concierge.governance;

import com.jreinhal.concierge.activity.ActivityStreamStats;
import com.jreinhal.concierge.feedback.FeedbackStats;
import com.jreinhal.concierge.graph.GraphStats;
import com.jreinhal.concierge.hitl.HitlQueueStats;
import com.jreinhal.concierge.playbook.PlaybookStats;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.util.PipelineFailureLog.PipelineFailure;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time operational view of one tenant. Counts of -1 mean the owning store could not be
 * read when the snapshot was taken.
 *
 * @param degraded store name to whether it is currently running degraded
 */
public record GovernanceSnapshot(
    String tenantId,
    Instant generatedAt,
    HitlQueueStats hitl,
    FeedbackStats feedback,
    ActivityStreamStats activity,
    GraphStats graph,
    PlaybookStats playbooks,
    Map<String, Long> pipelineFailures,
    List<PipelineFailure> recentFailures,
    Map<QuotaResource, Long> quotaUsage,
    Map<String, Boolean> degraded
) {
}
