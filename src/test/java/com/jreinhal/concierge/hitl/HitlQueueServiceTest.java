package com.jreinhal.concierge.hitl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.support.ConciergeHarness;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantMismatchException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HitlQueueServiceTest {

    private ConciergeHarness harness;
    private HitlQueueService queue;
    private TenantContext acme;

    @BeforeEach
    void setUp() {
        harness = new ConciergeHarness();
        queue = harness.queue;
        acme = harness.tenant("acme");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private HitlRequest submit(HitlPriority priority) {
        return submit(acme, priority, null);
    }

    private HitlRequest submit(TenantContext ctx, HitlPriority priority, String dedupKey) {
        return queue.submit(ctx, new HitlQueueService.SubmitCommand("agent-7", HitlRequestType.APPROVAL, priority,
                "Refund order 1142?", Map.of(HitlRequest.CTX_TICKET_ID, "T-1", HitlRequest.CTX_CATEGORY, "billing"),
                null, dedupKey));
    }

    private long openUsage(TenantContext ctx) {
        return harness.quotaService.usage(ctx).getOrDefault(QuotaResource.HITL_QUEUE, 0L);
    }

    private List<String> eventTypes(TenantContext ctx) {
        return harness.activityStream.read(ctx, 0L, 1000).stream().map(ActivityEvent::eventType).toList();
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        void admitsPendingRequestWithPriorityDeadline() {
            HitlRequest request = submit(HitlPriority.HIGH);

            assertThat(request.status()).isEqualTo(HitlStatus.PENDING);
            assertThat(request.slaDeadline()).isEqualTo(Instant.parse(ConciergeHarness.START).plus(Duration.ofMinutes(30)));
            assertThat(request.options()).containsExactly("approve", "reject", "modify");
            assertThat(openUsage(acme)).isEqualTo(1L);
            assertThat(eventTypes(acme)).containsExactly(ActivityEventTypes.HITL_CREATED);
        }

        @Test
        void repeatedDedupKeyReturnsFirstRequest() {
            HitlRequest first = submit(acme, HitlPriority.MEDIUM, "ticket-T-1");
            HitlRequest second = submit(acme, HitlPriority.MEDIUM, "ticket-T-1");

            assertThat(second.requestId()).isEqualTo(first.requestId());
            assertThat(openUsage(acme)).isEqualTo(1L);
            assertThat(eventTypes(acme)).hasSize(1);
        }

        @Test
        @DisplayName("Concurrent submits with one dedup key create one request and one reservation")
        void concurrentSubmitsWithSameDedupKeyCreateOneRequest() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                for (int round = 0; round < 50; round++) {
                    String key = "ticket-" + round;
                    CountDownLatch start = new CountDownLatch(1);
                    List<Future<HitlRequest>> results = new ArrayList<>();
                    for (int i = 0; i < 8; i++) {
                        results.add(pool.submit(() -> {
                            start.await();
                            return submit(acme, HitlPriority.MEDIUM, key);
                        }));
                    }
                    start.countDown();
                    String firstId = results.get(0).get(10, TimeUnit.SECONDS).requestId();
                    for (Future<HitlRequest> result : results) {
                        assertThat(result.get(10, TimeUnit.SECONDS).requestId()).isEqualTo(firstId);
                    }
                }
            }
            finally {
                pool.shutdownNow();
            }
            assertThat(queue.list(acme, HitlStatus.PENDING, null, 500)).hasSize(50);
            assertThat(openUsage(acme)).isEqualTo(50L);
            assertThat(eventTypes(acme).stream().filter(ActivityEventTypes.HITL_CREATED::equals)).hasSize(50);
        }

        @Test
        void dedupKeysAreScopedPerTenant() {
            TenantContext globex = harness.tenant("globex");

            HitlRequest a = submit(acme, HitlPriority.LOW, "same-key");
            HitlRequest b = submit(globex, HitlPriority.LOW, "same-key");

            assertThat(a.requestId()).isNotEqualTo(b.requestId());
        }

        @Test
        void rejectsBlankQuestionAndDuplicateOptions() {
            assertThatThrownBy(() -> queue.submit(acme, new HitlQueueService.SubmitCommand("agent-7", null,
                    HitlPriority.LOW, "  ", Map.of(), null, null)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> queue.submit(acme, new HitlQueueService.SubmitCommand("agent-7", null,
                    HitlPriority.LOW, "Proceed?", Map.of(), List.of("yes", "yes"), null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate option");
            assertThat(openUsage(acme)).isZero();
        }
    }

    @Nested
    @DisplayName("claim and respond")
    class ClaimAndRespond {

        @Test
        void concurrentClaimsHaveExactlyOneWinner() throws Exception {
            HitlRequest request = submit(HitlPriority.CRITICAL);
            int reviewers = 16;
            ExecutorService pool = Executors.newFixedThreadPool(reviewers);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger lost = new AtomicInteger();
            List<Future<String>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < reviewers; i++) {
                    String reviewerId = "rev-" + i;
                    Callable<String> claim = () -> {
                        start.await();
                        try {
                            return queue.claim(acme, request.requestId(), reviewerId).assignedTo();
                        }
                        catch (AlreadyClaimedException e) {
                            lost.incrementAndGet();
                            return null;
                        }
                    };
                    futures.add(pool.submit(claim));
                }
                start.countDown();
                List<String> winners = new ArrayList<>();
                for (Future<String> future : futures) {
                    String winner = future.get(10, TimeUnit.SECONDS);
                    if (winner != null) {
                        winners.add(winner);
                    }
                }
                assertThat(winners).hasSize(1);
                assertThat(lost.get()).isEqualTo(reviewers - 1);
                assertThat(queue.get(acme, request.requestId()).assignedTo()).isEqualTo(winners.get(0));
            }
            finally {
                pool.shutdownNow();
            }
        }

        @Test
        void approveCompletesAndReleasesQuota() {
            HitlRequest request = submit(HitlPriority.HIGH);
            queue.claim(acme, request.requestId(), "rev-1");
            harness.clock.advance(Duration.ofMinutes(3));

            HitlRequest done = queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, "looks right", null));

            assertThat(done.status()).isEqualTo(HitlStatus.COMPLETED);
            assertThat(done.decision()).isEqualTo(ReviewDecision.APPROVE);
            assertThat(done.respondedAt()).isEqualTo(harness.clock.instant());
            assertThat(openUsage(acme)).isZero();
            assertThat(eventTypes(acme)).contains(ActivityEventTypes.HITL_CLAIMED, ActivityEventTypes.HITL_APPROVED);
        }

        @Test
        void respondRequiresTheAssignee() {
            HitlRequest request = submit(HitlPriority.HIGH);
            HitlQueueService.RespondCommand approve = new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null);

            assertThatThrownBy(() -> queue.respond(acme, request.requestId(), "rev-1", approve))
                    .isInstanceOf(NotAssigneeException.class);

            queue.claim(acme, request.requestId(), "rev-1");
            assertThatThrownBy(() -> queue.respond(acme, request.requestId(), "rev-2", approve))
                    .isInstanceOf(NotAssigneeException.class);
        }

        @Test
        void otherTenantCannotTouchTheRequest() {
            HitlRequest request = submit(HitlPriority.HIGH);
            queue.claim(acme, request.requestId(), "rev-1");
            TenantContext globex = harness.tenant("globex");

            assertThatThrownBy(() -> queue.respond(globex, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null)))
                    .isInstanceOf(TenantMismatchException.class);
            assertThatThrownBy(() -> queue.get(globex, request.requestId()))
                    .isInstanceOf(TenantMismatchException.class);
            assertThat(queue.get(acme, request.requestId()).status()).isEqualTo(HitlStatus.ASSIGNED);
        }

        @Test
        void secondResponseIsRejected() {
            HitlRequest request = submit(HitlPriority.HIGH);
            queue.claim(acme, request.requestId(), "rev-1");
            queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.REJECT, "wrong customer", null));

            assertThatThrownBy(() -> queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null)))
                    .isInstanceOf(InvalidRequestStateException.class);
        }

        @Test
        void modifyNeedsEditedOutput() {
            HitlRequest request = submit(HitlPriority.HIGH);
            queue.claim(acme, request.requestId(), "rev-1");

            assertThatThrownBy(() -> queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.MODIFY, null, Map.of())))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void respondAfterDeadlineFailsAsExpired() {
            HitlRequest request = submit(HitlPriority.CRITICAL);
            queue.claim(acme, request.requestId(), "rev-1");
            harness.clock.advance(Duration.ofMinutes(11));

            assertThatThrownBy(() -> queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null)))
                    .isInstanceOf(RequestExpiredException.class);
        }

        @Test
        void releaseReturnsRequestToQueue() {
            HitlRequest request = submit(HitlPriority.MEDIUM);
            queue.claim(acme, request.requestId(), "rev-1");

            assertThatThrownBy(() -> queue.release(acme, request.requestId(), "rev-2"))
                    .isInstanceOf(NotAssigneeException.class);
            HitlRequest released = queue.release(acme, request.requestId(), "rev-1");

            assertThat(released.status()).isEqualTo(HitlStatus.PENDING);
            assertThat(released.assignedTo()).isNull();
            assertThat(queue.claim(acme, request.requestId(), "rev-2").assignedTo()).isEqualTo("rev-2");
        }

        @Test
        void unknownRequestIsNotFound() {
            assertThatThrownBy(() -> queue.claim(acme, "missing", "rev-1"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("SLA sweep")
    class Sweep {

        @Test
        void expiresOverdueRequestsOnce() {
            HitlRequest critical = submit(HitlPriority.CRITICAL);
            HitlRequest low = submit(HitlPriority.LOW);
            harness.clock.advance(Duration.ofMinutes(10));

            assertThat(queue.sweepExpired()).isEqualTo(1);
            assertThat(queue.sweepExpired()).isZero();

            assertThat(queue.get(acme, critical.requestId()).status()).isEqualTo(HitlStatus.EXPIRED);
            assertThat(queue.get(acme, low.requestId()).status()).isEqualTo(HitlStatus.PENDING);
            assertThat(eventTypes(acme).stream().filter(ActivityEventTypes.SLA_BREACHED::equals)).hasSize(1);
            assertThat(openUsage(acme)).isEqualTo(1L);
        }

        @Test
        void completedRequestIsNotExpiredLater() {
            HitlRequest request = submit(HitlPriority.CRITICAL);
            queue.claim(acme, request.requestId(), "rev-1");
            queue.respond(acme, request.requestId(), "rev-1",
                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));
            harness.clock.advance(Duration.ofHours(1));

            assertThat(queue.sweepExpired()).isZero();
            assertThat(queue.get(acme, request.requestId()).status()).isEqualTo(HitlStatus.COMPLETED);
        }

        @Test
        void concurrentSweepsExpireEachRequestExactlyOnce() throws Exception {
            for (int i = 0; i < 40; i++) {
                submit(HitlPriority.CRITICAL);
            }
            harness.clock.advance(Duration.ofMinutes(15));
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<Integer>> sweeps = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    sweeps.add(pool.submit(() -> queue.sweepExpired()));
                }
                int total = 0;
                for (Future<Integer> sweep : sweeps) {
                    total += sweep.get(10, TimeUnit.SECONDS);
                }
                assertThat(total).isEqualTo(40);
            }
            finally {
                pool.shutdownNow();
            }
            assertThat(eventTypes(acme).stream().filter(ActivityEventTypes.SLA_BREACHED::equals)).hasSize(40);
        }

        @Test
        @DisplayName("Racing sweep and responses leave each request in exactly one terminal state")
        void sweepRacingResponsesPicksOneOutcomePerRequest() throws Exception {
            List<HitlRequest> claimed = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                HitlRequest request = submit(HitlPriority.CRITICAL);
                queue.claim(acme, request.requestId(), "rev-1");
                claimed.add(request);
            }
            harness.clock.advance(Duration.ofMinutes(10).minusMillis(5));
            AtomicInteger approved = new AtomicInteger();
            AtomicInteger refused = new AtomicInteger();
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> responder = pool.submit(() -> {
                    go.await();
                    for (HitlRequest request : claimed) {
                        try {
                            queue.respond(acme, request.requestId(), "rev-1",
                                    new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));
                            approved.incrementAndGet();
                        }
                        catch (RequestExpiredException e) {
                            refused.incrementAndGet();
                        }
                    }
                    return null;
                });
                Future<Integer> sweeper = pool.submit(() -> {
                    go.await();
                    harness.clock.advance(Duration.ofMillis(5));
                    return queue.sweepExpired();
                });
                go.countDown();
                responder.get(10, TimeUnit.SECONDS);
                int expired = sweeper.get(10, TimeUnit.SECONDS) + queue.sweepExpired();

                assertThat(approved.get() + refused.get()).isEqualTo(30);
                assertThat(expired).isEqualTo(refused.get());
            }
            finally {
                pool.shutdownNow();
            }
            List<String> types = eventTypes(acme);
            assertThat(types.stream().filter(ActivityEventTypes.HITL_APPROVED::equals)).hasSize(approved.get());
            assertThat(types.stream().filter(ActivityEventTypes.SLA_BREACHED::equals)).hasSize(refused.get());
            assertThat(queue.list(acme, HitlStatus.ASSIGNED, null, 100)).isEmpty();
        }

        @Test
        void stopSignalEndsSweepEarly() {
            submit(HitlPriority.CRITICAL);
            harness.clock.advance(Duration.ofMinutes(15));

            assertThat(queue.sweepExpired(() -> true)).isZero();
            assertThat(queue.sweepExpired()).isEqualTo(1);
        }
    }

    @Test
    void pendingListIsOrderedByPriorityThenAge() {
        HitlRequest low = submit(HitlPriority.LOW);
        harness.clock.advance(Duration.ofSeconds(1));
        HitlRequest critical = submit(HitlPriority.CRITICAL);
        harness.clock.advance(Duration.ofSeconds(1));
        HitlRequest high = submit(HitlPriority.HIGH);
        harness.clock.advance(Duration.ofSeconds(1));
        HitlRequest secondCritical = submit(HitlPriority.CRITICAL);

        List<String> order = queue.list(acme, HitlStatus.PENDING, null, 10).stream().map(HitlRequest::requestId).toList();

        assertThat(order).containsExactly(critical.requestId(), secondCritical.requestId(), high.requestId(), low.requestId());
    }

    @Test
    void manualEscalationRaisesPriority() {
        HitlRequest request = submit(HitlPriority.MEDIUM);

        HitlRequest escalated = queue.manualEscalate(acme, request.requestId(), "customer called");

        assertThat(escalated.priority()).isEqualTo(HitlPriority.HIGH);
        assertThat(escalated.slaDeadline()).isEqualTo(request.slaDeadline());
        assertThat(eventTypes(acme)).contains(ActivityEventTypes.HITL_PRIORITY_ESCALATED);
    }

    @Test
    void statsCountByStatus() {
        HitlRequest first = submit(HitlPriority.HIGH);
        submit(HitlPriority.LOW);
        queue.claim(acme, first.requestId(), "rev-1");
        harness.clock.advance(Duration.ofMinutes(2));
        queue.respond(acme, first.requestId(), "rev-1", new HitlQueueService.RespondCommand(ReviewDecision.APPROVE, null, null));

        HitlQueueStats stats = queue.stats(acme);

        assertThat(stats.byStatus().get(HitlStatus.COMPLETED)).isEqualTo(1L);
        assertThat(stats.byStatus().get(HitlStatus.PENDING)).isEqualTo(1L);
        assertThat(stats.openByPriority().get(HitlPriority.LOW)).isEqualTo(1L);
    }
}
