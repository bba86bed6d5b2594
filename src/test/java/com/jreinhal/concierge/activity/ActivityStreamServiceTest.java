package com.jreinhal.concierge.activity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.concierge.support.MutableClock;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantTier;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.OutageTracker;
import com.jreinhal.concierge.util.PipelineFailureLog;
import com.jreinhal.concierge.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ActivityStreamServiceTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final PipelineFailureLog failureLog = new PipelineFailureLog(clock);
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final TenantContext acme = TenantContext.of("acme", TenantTier.PROFESSIONAL);
    private final TenantContext globex = TenantContext.of("globex", TenantTier.PROFESSIONAL);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ActivityStreamService stream(ActivityStore primary, RingBufferActivityStore fallback) {
        GuardedCall guard = new GuardedCall("activity", new SimpleCircuitBreaker("activity", 3, Duration.ofSeconds(30), 1, clock),
                null, Duration.ofSeconds(1), new OutageTracker(clock));
        return new ActivityStreamService(primary, fallback, guard, clock, executor, failureLog, 20L, 10);
    }

    private ActivityStreamService inMemory() {
        RingBufferActivityStore ring = new RingBufferActivityStore(1000);
        return stream(ring, ring);
    }

    private static ActivityEventDraft event(String type, Map<String, Object> payload) {
        return ActivityEventDraft.of(type, "test", payload);
    }

    private static List<Long> sequences(List<ActivityEvent> events) {
        return events.stream().map(ActivityEvent::sequenceNo).toList();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }

    @Nested
    class Ordering {

        @Test
        void concurrentAppendsGetGapFreeSequenceNumbers() throws Exception {
            ActivityStreamService stream = inMemory();
            int writers = 8;
            int perWriter = 50;
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        stream.append(acme, event("ticket.updated", Map.of("ticketId", "T-" + i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            List<ActivityEvent> all = stream.read(acme, 0L, 1000);

            assertThat(sequences(all)).containsExactlyElementsOf(LongStream.rangeClosed(1, writers * perWriter).boxed().toList());
            assertThat(stream.length(acme)).isEqualTo(writers * perWriter);
        }

        @Test
        void tenantsHaveIndependentStreams() {
            ActivityStreamService stream = inMemory();
            stream.append(acme, event("ticket.created", Map.of()));
            stream.append(acme, event("ticket.updated", Map.of()));
            ActivityEvent other = stream.append(globex, event("ticket.created", Map.of()));

            assertThat(other.sequenceNo()).isEqualTo(1L);
            assertThat(stream.read(globex, 0L, 10)).extracting(ActivityEvent::tenantId).containsOnly("globex");
            assertThat(stream.read(acme, 0L, 10)).hasSize(2);
        }

        @Test
        void draftDefaultsAreFilledIn() {
            ActivityStreamService stream = inMemory();

            ActivityEvent event = stream.append(acme, new ActivityEventDraft(null, " ticket.created ", null, null, null));

            assertThat(event.eventId()).isNotBlank();
            assertThat(event.eventType()).isEqualTo("ticket.created");
            assertThat(event.source()).isEqualTo("unknown");
            assertThat(event.timestamp()).isEqualTo(clock.instant());
            assertThat(event.payload()).isEmpty();
        }

        @Test
        void blankEventTypeIsRejected() {
            ActivityStreamService stream = inMemory();

            assertThatThrownBy(() -> stream.append(acme, event(" ", Map.of()))).isInstanceOf(IllegalArgumentException.class);
            assertThat(stream.appendQuietly(acme, event("", Map.of()))).isEmpty();
            assertThat(failureLog.counts("acme")).containsEntry("activity.append", 1L);
        }
    }

    @Nested
    class Cursors {

        @Test
        void reopenedCursorResumesWhereTheLastOneStopped() throws Exception {
            ActivityStreamService stream = inMemory();
            for (int i = 0; i < 5; i++) {
                stream.append(acme, event("ticket.updated", Map.of("n", i)));
            }
            long saved;
            try (ActivityCursor cursor = stream.subscribe(acme, 0L)) {
                for (int i = 0; i < 3; i++) {
                    assertThat(cursor.poll(Duration.ofMillis(100))).isPresent();
                }
                saved = cursor.position();
            }

            List<Long> rest = new ArrayList<>();
            try (ActivityCursor cursor = stream.subscribe(acme, saved)) {
                Optional<ActivityEvent> next;
                while ((next = cursor.poll(Duration.ofMillis(50))).isPresent()) {
                    rest.add(next.get().sequenceNo());
                }
            }

            assertThat(saved).isEqualTo(3L);
            assertThat(rest).containsExactly(4L, 5L);
        }

        @Test
        void pollWakesOnAppend() throws Exception {
            ActivityStreamService stream = inMemory();
            try (ActivityCursor cursor = stream.subscribe(acme, 0L)) {
                Future<Optional<ActivityEvent>> waiting = executor.submit(() -> cursor.poll(Duration.ofSeconds(5)));
                Thread.sleep(50);
                stream.append(acme, event("ticket.created", Map.of()));

                assertThat(waiting.get(5, TimeUnit.SECONDS)).map(ActivityEvent::sequenceNo).contains(1L);
            }
        }

        @Test
        void listenerReceivesEventsInOrderAndFailedDeliveryIsRetried() throws Exception {
            ActivityStreamService stream = inMemory();
            List<Long> seen = new CopyOnWriteArrayList<>();
            AtomicBoolean failedOnce = new AtomicBoolean();
            try (ActivitySubscription subscription = stream.subscribe(acme, 0L, e -> {
                if (e.sequenceNo() == 2L && failedOnce.compareAndSet(false, true)) {
                    throw new IllegalStateException("consumer hiccup");
                }
                seen.add(e.sequenceNo());
            })) {
                for (int i = 0; i < 3; i++) {
                    stream.append(acme, event("ticket.updated", Map.of()));
                }
                await(() -> seen.size() >= 3);

                assertThat(seen).containsExactly(1L, 2L, 3L);
                assertThat(subscription.position()).isEqualTo(3L);
            }
        }
    }

    @Nested
    class DegradedDurableStore {

        @Test
        void appendsContinueInMemoryAndResyncAfterRecovery() {
            FlakyDurableStore durable = new FlakyDurableStore();
            RingBufferActivityStore ring = new RingBufferActivityStore(100);
            ActivityStreamService stream = stream(durable, ring);

            stream.append(acme, event("ticket.created", Map.of()));
            stream.append(acme, event("ticket.updated", Map.of()));
            durable.down.set(true);
            ActivityEvent buffered1 = stream.append(acme, event("ticket.updated", Map.of()));
            ActivityEvent buffered2 = stream.append(acme, event("ticket.updated", Map.of()));

            assertThat(buffered1.sequenceNo()).isEqualTo(3L);
            assertThat(buffered2.sequenceNo()).isEqualTo(4L);
            assertThat(stream.stats(acme).degraded()).isTrue();
            assertThat(sequences(stream.read(acme, 2L, 10))).containsExactly(3L, 4L);

            durable.down.set(false);
            clock.advance(Duration.ofSeconds(31));
            ActivityEvent resumed = stream.append(acme, event("ticket.resolved", Map.of()));

            assertThat(resumed.sequenceNo()).isEqualTo(5L);
            assertThat(sequences(stream.read(acme, 0L, 10))).containsExactly(1L, 2L, 3L, 4L, 5L);
            assertThat(stream.isDurable()).isTrue();
        }

        @Test
        void timedOutDurableInsertThatCommitsLateKeepsOneEventId() throws Exception {
            SlowDurableStore durable = new SlowDurableStore();
            RingBufferActivityStore ring = new RingBufferActivityStore(100);
            GuardedCall guard = new GuardedCall("activity", new SimpleCircuitBreaker("activity", 3, Duration.ofSeconds(30), 1, clock),
                    executor, Duration.ofMillis(100), new OutageTracker(clock));
            ActivityStreamService stream = new ActivityStreamService(durable, ring, guard, clock, executor, failureLog, 20L, 10);

            ActivityEvent appended = stream.append(acme, event("ticket.created", Map.of("ticketId", "T-1")));

            assertThat(ring.readAfter("acme", 0L, 10)).extracting(ActivityEvent::eventId).containsExactly(appended.eventId());
            durable.commit.countDown();
            await(() -> durable.count("acme") == 1L);
            assertThat(durable.readAfter("acme", 0L, 10)).extracting(ActivityEvent::eventId).containsExactly(appended.eventId());
            assertThat(stream.read(acme, 0L, 10)).extracting(ActivityEvent::eventId).containsExactly(appended.eventId());
        }
    }

    @Test
    void purgeRemovesEventsNamingTheSubject() {
        ActivityStreamService stream = inMemory();
        stream.append(acme, event("ticket.created", Map.of("customerId", "cust-9")));
        stream.append(acme, event("ticket.created", Map.of("customerId", "cust-1")));
        stream.append(acme, event("feedback.recorded", Map.of("subjectId", "cust-9")));

        assertThat(stream.purgeSubject(acme, "cust-9")).isEqualTo(2L);
        assertThat(stream.read(acme, 0L, 10)).extracting(e -> e.payloadString("customerId")).containsExactly("cust-1");
    }

    /**
     * Durable store whose inserts hang until released, then commit.
     */
    static class SlowDurableStore extends RingBufferActivityStore {
        final CountDownLatch commit = new CountDownLatch(1);

        SlowDurableStore() {
            super(1000);
        }

        @Override
        public void insert(ActivityEvent event) {
            try {
                commit.await(5, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                // the guard gave up on this call; the write still goes through
            }
            super.insert(event);
        }

        @Override
        public boolean isDurable() {
            return true;
        }
    }

    /**
     * Ring buffer that claims durability and can be switched off.
     */
    static class FlakyDurableStore extends RingBufferActivityStore {
        final AtomicBoolean down = new AtomicBoolean();

        FlakyDurableStore() {
            super(1000);
        }

        private void check() {
            if (down.get()) {
                throw new IllegalStateException("connection refused");
            }
        }

        @Override
        public long allocateSequence(String tenantId) {
            check();
            return super.allocateSequence(tenantId);
        }

        @Override
        public void insert(ActivityEvent event) {
            check();
            super.insert(event);
        }

        @Override
        public List<ActivityEvent> readAfter(String tenantId, long afterSequence, int limit) {
            check();
            return super.readAfter(tenantId, afterSequence, limit);
        }

        @Override
        public long count(String tenantId) {
            check();
            return super.count(tenantId);
        }

        @Override
        public long highestSequence(String tenantId) {
            check();
            return super.highestSequence(tenantId);
        }

        @Override
        public boolean isDurable() {
            return true;
        }
    }
}
