package com.jreinhal.concierge.hitl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.concierge.feedback.FeedbackLoopService;
import com.jreinhal.concierge.feedback.FeedbackProperties;
import com.jreinhal.concierge.feedback.InMemoryGoldenPathStore;
import com.jreinhal.concierge.support.ConciergeHarness;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Outcome listeners run off the reviewer's thread. These tests wire the queue with real executors
 * instead of the harness's inline one.
 */
class HitlOutcomeDispatchTest {

    private final ConciergeHarness harness = new ConciergeHarness();
    private final TenantContext acme = harness.tenant("acme");
    private final ExecutorService outcomeExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService storeCallExecutor = Executors.newCachedThreadPool();
    private final CountDownLatch unblock = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        unblock.countDown();
        outcomeExecutor.shutdownNow();
        storeCallExecutor.shutdownNow();
        harness.close();
    }

    private HitlQueueService queueWith(List<HitlOutcomeListener> listeners, Executor executor) {
        return new HitlQueueService(harness.requestStore, HitlSlaPolicy.defaults(), harness.quotaService,
                harness.tenantService, harness.activityStream, HitlIntakePolicy.NONE, listeners, executor, harness.failureLog, harness.clock,
                List.of("approve", "reject", "modify"), 50);
    }

    private HitlRequest claimedCritical(HitlQueueService queue) {
        HitlRequest request = queue.submit(acme, new HitlQueueService.SubmitCommand("agent-7", HitlRequestType.APPROVAL,
                HitlPriority.CRITICAL, "Refund order 1142?",
                Map.of(HitlRequest.CTX_CATEGORY, "billing", HitlRequest.CTX_QUERY, "refund duplicate charge"), null, null));
        return queue.claim(acme, request.requestId(), "rev-1");
    }

    @Test
    @DisplayName("A hanging embedding model does not slow down respond")
    void hangingSemanticStoreDoesNotDelayRespond() {
        EmbeddingModel hanging = mock(EmbeddingModel.class);
        when(hanging.embed(anyString())).thenAnswer(invocation -> {
            unblock.await(5, TimeUnit.SECONDS);
            return new float[384];
        });
        GuardedCall slowGuard = new GuardedCall("semantic",
                new SimpleCircuitBreaker("semantic", 3, Duration.ofSeconds(30), 1, harness.clock),
                storeCallExecutor, Duration.ofMillis(1500), harness.outageTracker);
        FeedbackLoopService feedback = new FeedbackLoopService(new InMemoryGoldenPathStore(), slowGuard, hanging,
                harness.requestStore, harness.quotaService, harness.activityStream, harness.failureLog,
                new FeedbackProperties(), harness.clock);
        HitlQueueService queue = queueWith(List.of(feedback), outcomeExecutor);
        HitlRequest claimed = claimedCritical(queue);

        long started = System.nanoTime();
        HitlRequest completed = queue.respond(acme, claimed.requestId(), "rev-1",
                new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(completed.status()).isEqualTo(HitlStatus.COMPLETED);
        assertThat(elapsedMillis).isLessThan(500L);
    }

    @Test
    @DisplayName("Listener runs after respond returns")
    void listenerRunsAfterRespondReturns() throws Exception {
        CountDownLatch delivered = new CountDownLatch(1);
        HitlOutcomeListener blocking = (ctx, request) -> {
            try {
                unblock.await(5, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        };
        HitlQueueService queue = queueWith(List.of(blocking), outcomeExecutor);
        HitlRequest claimed = claimedCritical(queue);

        queue.respond(acme, claimed.requestId(), "rev-1", new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));

        assertThat(delivered.getCount()).isEqualTo(1L);
        unblock.countDown();
        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Listener failures are recorded, not thrown")
    void listenerFailureIsRecorded() throws Exception {
        CountDownLatch attempted = new CountDownLatch(1);
        HitlOutcomeListener failing = (ctx, request) -> {
            attempted.countDown();
            throw new IllegalStateException("feedback store down");
        };
        HitlQueueService queue = queueWith(List.of(failing), outcomeExecutor);
        HitlRequest claimed = claimedCritical(queue);

        HitlRequest completed = queue.respond(acme, claimed.requestId(), "rev-1",
                new HitlQueueService.RespondCommand(ReviewDecision.REJECT, "wrong order", null));

        assertThat(completed.status()).isEqualTo(HitlStatus.COMPLETED);
        assertThat(attempted.await(5, TimeUnit.SECONDS)).isTrue();
        outcomeExecutor.shutdown();
        assertThat(outcomeExecutor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(harness.failureLog.counts("acme")).containsEntry("hitl.outcome", 1L);
    }

    @Test
    @DisplayName("A saturated outcome pool still completes the request")
    void rejectedDispatchIsRecorded() {
        HitlOutcomeListener listener = (ctx, request) -> { };
        HitlQueueService queue = queueWith(List.of(listener), task -> {
            throw new RejectedExecutionException("outcome pool full");
        });
        HitlRequest claimed = claimedCritical(queue);

        HitlRequest completed = queue.respond(acme, claimed.requestId(), "rev-1",
                new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));

        assertThat(completed.status()).isEqualTo(HitlStatus.COMPLETED);
        assertThat(harness.failureLog.counts("acme")).containsEntry("hitl.outcome", 1L);
    }
}
