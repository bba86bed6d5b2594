package com.jreinhal.concierge.compliance;

import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.feedback.FeedbackLoopService;
import com.jreinhal.concierge.governance.GovernanceViewService;
import com.jreinhal.concierge.graph.ActivityGraphProjector;
import com.jreinhal.concierge.graph.ActivityGraphService;
import com.jreinhal.concierge.graph.GraphPurgeResult;
import com.jreinhal.concierge.playbook.PlaybookEngine;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.util.LogSanitizer;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes everything the learning pipeline holds about one subject within a tenant.
 *
 * <p>Order matters: the graph projector is caught up first so pending events cannot re-create
 * purged nodes, and stream events go last because the graph could otherwise be rebuilt from them.
 * Every step is idempotent, so a purge that failed on an unavailable store is safe to repeat.</p>
 */
@Service
public class CompliancePurgeService {
    private static final Logger log = LoggerFactory.getLogger(CompliancePurgeService.class);
    private static final String SOURCE = "compliance";
    private static final int MAX_SUBJECT_LENGTH = 256;

    private final FeedbackLoopService feedbackLoop;
    private final ActivityGraphProjector graphProjector;
    private final ActivityGraphService graphService;
    private final PlaybookEngine playbookEngine;
    private final ActivityStreamService activityStream;
    private final GovernanceViewService governanceView;
    private final PipelineFailureLog failureLog;
    private final Clock clock;

    public CompliancePurgeService(FeedbackLoopService feedbackLoop,
                                  ActivityGraphProjector graphProjector,
                                  ActivityGraphService graphService,
                                  PlaybookEngine playbookEngine,
                                  ActivityStreamService activityStream,
                                  GovernanceViewService governanceView,
                                  PipelineFailureLog failureLog,
                                  Clock clock) {
        this.feedbackLoop = feedbackLoop;
        this.graphProjector = graphProjector;
        this.graphService = graphService;
        this.playbookEngine = playbookEngine;
        this.activityStream = activityStream;
        this.governanceView = governanceView;
        this.failureLog = failureLog;
        this.clock = clock;
    }

    /**
     * @throws com.jreinhal.concierge.exception.BackingStoreUnavailableException when a store
     *         holding subject data cannot be reached; nothing after the failing step has run
     */
    public PurgeResult purgeSubject(TenantContext ctx, String subjectId, String requestedBy) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject id is required");
        }
        if (subjectId.length() > MAX_SUBJECT_LENGTH) {
            throw new IllegalArgumentException("Subject id is too long");
        }
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new IllegalArgumentException("Requesting operator is required");
        }
        String subjectHash = subjectHash(ctx.tenantId(), subjectId);
        try {
            this.graphProjector.catchUp(ctx);
            long goldenPaths = this.feedbackLoop.purgeSubject(ctx, subjectId);
            GraphPurgeResult graph = this.graphService.purgeSubject(ctx, subjectId);
            long playbooks = this.playbookEngine.purgeSources(ctx, graph.resolutionIds());
            long events = this.activityStream.purgeSubject(ctx, subjectId);
            Instant purgedAt = this.clock.instant();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("subjectHash", subjectHash);
            payload.put("requestedBy", requestedBy);
            payload.put("goldenPathsDeleted", goldenPaths);
            payload.put("graphNodesDeleted", graph.nodesDeleted());
            payload.put("playbooksUpdated", playbooks);
            payload.put("eventsDeleted", events);
            ActivityEvent tombstone = this.activityStream.append(ctx,
                    new ActivityEventDraft(null, ActivityEventTypes.COMPLIANCE_PURGED, SOURCE, payload, purgedAt));
            this.governanceView.invalidate(ctx);
            log.info("Compliance purge for tenant {} subject {} by {}: {} golden paths, {} graph nodes, {} playbooks, {} events",
                    ctx.tenantId(), subjectHash, LogSanitizer.sanitize(requestedBy), goldenPaths, graph.nodesDeleted(),
                    playbooks, events);
            return new PurgeResult(subjectHash, goldenPaths, graph.nodesDeleted(), playbooks, events,
                    tombstone.sequenceNo(), purgedAt);
        }
        catch (RuntimeException e) {
            log.warn("Compliance purge for tenant {} subject {} incomplete: {}", ctx.tenantId(), subjectHash, e.getMessage());
            this.failureLog.record(ctx.tenantId(), "compliance.purge", subjectHash, e);
            throw e;
        }
    }

    static String subjectHash(String tenantId, String subjectId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest((tenantId + ":" + subjectId).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed).toLowerCase(Locale.ROOT);
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
