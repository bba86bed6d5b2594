package com.jreinhal.concierge.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.activity.RingBufferActivityStore;
import com.jreinhal.concierge.support.MutableClock;
import com.jreinhal.concierge.tenant.InMemoryTenantStore;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.OutageTracker;
import com.jreinhal.concierge.util.PipelineFailureLog;
import com.jreinhal.concierge.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActivityGraphProjectorTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final PipelineFailureLog failureLog = new PipelineFailureLog(clock);
    private final ExecutorService subscriptions = Executors.newCachedThreadPool();
    private final FailingGraphStore graphStore = new FailingGraphStore();
    private ActivityStreamService stream;
    private TenantService tenantService;
    private TenantContext acme;

    @BeforeEach
    void setUp() {
        RingBufferActivityStore ring = new RingBufferActivityStore(1000);
        OutageTracker tracker = new OutageTracker(clock);
        stream = new ActivityStreamService(ring, ring, guard("activity", tracker), clock, subscriptions, failureLog, 20L, 50);
        tenantService = new TenantService(new InMemoryTenantStore(), clock, "STARTER");
        acme = tenantService.ensureTenant("acme", "STARTER").toContext();
    }

    @AfterEach
    void tearDown() {
        subscriptions.shutdownNow();
    }

    private GuardedCall guard(String name, OutageTracker tracker) {
        return new GuardedCall(name, new SimpleCircuitBreaker(name, 10, Duration.ofSeconds(30), 1, clock), null,
                Duration.ofSeconds(1), tracker);
    }

    private ActivityGraphProjector projector(Executor executor, int batchSize) {
        return new ActivityGraphProjector(stream, graphStore, guard("graph", new OutageTracker(clock)), executor,
                tenantService, failureLog, batchSize, 1000L);
    }

    private void appendTicketHistory() {
        stream.append(acme, ActivityEventDraft.of(ActivityEventTypes.TICKET_CREATED, "helpdesk",
                Map.of("ticketId", "T-1", "customerId", "C-1", "category", "billing")));
        stream.append(acme, ActivityEventDraft.of(ActivityEventTypes.HITL_CREATED, "hitl-queue",
                Map.of("requestId", "r-1", "ticketId", "T-1", "customerId", "C-1", "category", "billing")));
        stream.append(acme, ActivityEventDraft.of(ActivityEventTypes.HITL_CLAIMED, "hitl-queue",
                Map.of("requestId", "r-1", "reviewerId", "rev-1")));
        stream.append(acme, ActivityEventDraft.of(ActivityEventTypes.HITL_APPROVED, "hitl-queue",
                Map.of("requestId", "r-1", "ticketId", "T-1", "customerId", "C-1", "category", "billing",
                        "steps", List.of("lookup_order", "issue_refund"))));
    }

    @Test
    void catchUpAppliesPendingEventsAndAdvancesCheckpoint() {
        ActivityGraphProjector projector = projector(task -> { }, 2);
        appendTicketHistory();

        assertThat(projector.catchUp(acme)).isEqualTo(3);
        assertThat(projector.checkpoint(acme)).isEqualTo(4L);
        assertThat(projector.catchUp(acme)).isZero();

        String ticket = GraphNode.nodeId("acme", NodeType.TICKET, "T-1");
        assertThat(graphStore.delegate.outgoing("acme", ticket, EdgeLabel.RESOLVED_BY))
                .extracting(GraphEdge::toId)
                .containsExactly(GraphNode.nodeId("acme", NodeType.RESOLUTION, "r-1"));
    }

    @Test
    void rebuildConvergesOnTheSameGraph() {
        ActivityGraphProjector projector = projector(task -> { }, 50);
        appendTicketHistory();
        projector.catchUp(acme);
        Map<NodeType, Long> nodes = graphStore.delegate.countNodes("acme");
        long edges = graphStore.delegate.countEdges("acme");

        int replayed = projector.rebuild(acme);

        assertThat(replayed).isEqualTo(3);
        assertThat(graphStore.delegate.countNodes("acme")).isEqualTo(nodes);
        assertThat(graphStore.delegate.countEdges("acme")).isEqualTo(edges);
        assertThat(projector.checkpoint(acme)).isEqualTo(4L);
    }

    @Test
    void redeliveredEventIsAppliedOnce() {
        ActivityGraphProjector projector = projector(task -> { }, 50);
        Map<String, Object> first = Map.of("ticketId", "T-9", "category", "billing");
        Map<String, Object> redelivered = Map.of("ticketId", "T-9", "category", "shipping");
        stream.append(acme, new ActivityEventDraft("helpdesk-42", ActivityEventTypes.TICKET_CREATED, "helpdesk", first, null));
        stream.append(acme, new ActivityEventDraft("helpdesk-42", ActivityEventTypes.TICKET_CREATED, "helpdesk", redelivered, null));

        assertThat(projector.catchUp(acme)).isEqualTo(1);
        assertThat(graphStore.delegate.findNode("acme", GraphNode.nodeId("acme", NodeType.TICKET, "T-9")))
                .map(node -> node.attrString("category"))
                .contains("billing");
    }

    @Test
    void outagePausesProjectionWithoutLosingEvents() {
        ActivityGraphProjector projector = projector(task -> { }, 50);
        appendTicketHistory();
        graphStore.down.set(true);

        assertThat(projector.catchUp(acme)).isZero();
        assertThat(failureLog.counts("acme")).containsKey("graph.project");

        graphStore.down.set(false);
        assertThat(projector.catchUp(acme)).isEqualTo(3);
        assertThat(projector.checkpoint(acme)).isEqualTo(4L);
    }

    @Test
    void appendsAreProjectedInTheBackgroundOnceStarted() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ActivityGraphProjector projector = projector(executor, 50);
            projector.start();
            appendTicketHistory();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (projector.checkpoint(acme) < 4L && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(projector.checkpoint(acme)).isEqualTo(4L);
            assertThat(graphStore.delegate.countNodes("acme")).containsEntry(NodeType.RESOLUTION, 1L);
        }
        finally {
            executor.shutdownNow();
        }
    }
}
