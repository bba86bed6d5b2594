package com.jreinhal.concierge.e2e;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.feedback.GoldenPathRecord;
import com.jreinhal.concierge.graph.EdgeLabel;
import com.jreinhal.concierge.graph.GraphEdge;
import com.jreinhal.concierge.graph.GraphNode;
import com.jreinhal.concierge.graph.NodeType;
import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlQueueService;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlRequestType;
import com.jreinhal.concierge.hitl.HitlStatus;
import com.jreinhal.concierge.hitl.RequestExpiredException;
import com.jreinhal.concierge.hitl.ReviewDecision;
import com.jreinhal.concierge.support.ConciergeHarness;
import com.jreinhal.concierge.tenant.TenantContext;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Drives a request from submission to its terminal state and checks every downstream store.
 */
class HitlPipelineEndToEndTest {

    private final ConciergeHarness harness = new ConciergeHarness();
    private final TenantContext acme = harness.tenant("acme");

    @AfterEach
    void close() {
        harness.close();
    }

    @Test
    @DisplayName("Approved critical request becomes a golden path and a graph resolution")
    void approvedCriticalRequestFeedsTheLearningPipeline() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(HitlRequest.CTX_TICKET_ID, "T-100");
        context.put(HitlRequest.CTX_CUSTOMER_ID, "C-1");
        context.put(HitlRequest.CTX_CATEGORY, "billing");
        context.put(HitlRequest.CTX_STEPS, List.of("verify_account", "issue_refund"));
        context.put(HitlRequest.CTX_PROPOSED_RESOLUTION, "Refund the duplicate charge");
        HitlRequest submitted = harness.queue.submit(acme, new HitlQueueService.SubmitCommand("agent-7",
                HitlRequestType.APPROVAL, HitlPriority.CRITICAL, "Refund duplicate charge?", context, null, null));

        harness.queue.claim(acme, submitted.requestId(), "rev-1");
        harness.clock.advance(Duration.ofMinutes(4));
        HitlRequest completed = harness.queue.respond(acme, submitted.requestId(), "rev-1",
                new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, "looks right", null));

        assertThat(completed.status()).isEqualTo(HitlStatus.COMPLETED);

        List<GoldenPathRecord> paths = harness.goldenPathStore.recent("acme", 10);
        assertThat(paths).singleElement().satisfies(path -> {
            assertThat(path.sourceRequestId()).isEqualTo(submitted.requestId());
            assertThat(path.category()).isEqualTo("billing");
            assertThat(path.steps()).containsExactly("verify_account", "issue_refund");
            assertThat(path.approvedBy()).isEqualTo("rev-1");
        });

        List<ActivityEvent> events = harness.activityStream.read(acme, 0L, 100);
        long createdSeq = sequenceOf(events, ActivityEventTypes.HITL_CREATED);
        long approvedSeq = sequenceOf(events, ActivityEventTypes.HITL_APPROVED);
        assertThat(approvedSeq).isGreaterThan(createdSeq);
        assertThat(events).extracting(ActivityEvent::tenantId).containsOnly("acme");

        String ticket = GraphNode.nodeId("acme", NodeType.TICKET, "T-100");
        assertThat(harness.graphStore.outgoing("acme", ticket, EdgeLabel.RESOLVED_BY))
                .extracting(GraphEdge::toId)
                .containsExactly(GraphNode.nodeId("acme", NodeType.RESOLUTION, submitted.requestId()));
        assertThat(harness.graphService.customerJourney(acme, "C-1"))
                .singleElement()
                .satisfies(entry -> assertThat(entry.resolutions()).hasSize(1));
    }

    @Test
    @DisplayName("Unanswered low-priority request expires without learning anything")
    void unansweredRequestExpiresOnSweep() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(HitlRequest.CTX_TICKET_ID, "T-200");
        context.put(HitlRequest.CTX_CATEGORY, "shipping");
        HitlRequest submitted = harness.queue.submit(acme, new HitlQueueService.SubmitCommand("agent-7",
                HitlRequestType.CLARIFICATION, HitlPriority.LOW, "Which address?", context, null, null));

        harness.clock.advance(Duration.ofHours(24).plusSeconds(1));
        int expired = harness.queue.sweepExpired();

        assertThat(expired).isEqualTo(1);
        assertThat(harness.queue.get(acme, submitted.requestId()).status()).isEqualTo(HitlStatus.EXPIRED);
        assertThat(harness.goldenPathStore.recent("acme", 10)).isEmpty();
        assertThat(harness.activityStream.read(acme, 0L, 100))
                .extracting(ActivityEvent::eventType)
                .contains(ActivityEventTypes.SLA_BREACHED);
        assertThatThrownBy(() -> harness.queue.claim(acme, submitted.requestId(), "rev-1"))
                .isInstanceOf(RequestExpiredException.class);
        assertThat(harness.queue.sweepExpired()).isZero();
    }

    @Test
    @DisplayName("Three approvals of one sequence mine a playbook")
    void repeatedApprovalsMineAPlaybook() {
        for (int i = 1; i <= 3; i++) {
            harness.approve(acme, "T-" + i, "C-" + i, "password_reset", List.of("verify_identity", "send_reset_link"));
        }

        harness.playbookEngine.extract(acme, "password_reset");

        assertThat(harness.playbookEngine.suggestions(acme, "password_reset", 5)).isNotEmpty();
    }

    private static long sequenceOf(List<ActivityEvent> events, String type) {
        Optional<ActivityEvent> event = events.stream().filter(e -> type.equals(e.eventType())).findFirst();
        assertThat(event).as("event %s", type).isPresent();
        return event.get().sequenceNo();
    }
}
