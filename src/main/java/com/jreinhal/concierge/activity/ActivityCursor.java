package com.jreinhal.concierge.activity;

import com.jreinhal.concierge.tenant.TenantContext;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Restartable read position over one tenant's stream. A consumer that stores
 * {@link #position()} after each processed event can reopen the cursor from that value and
 * receive exactly the remaining events in order.
 *
 * <p>Not thread-safe; one consumer per cursor. {@link #close()} may be called from any thread and
 * wakes a blocked {@link #poll(Duration)}.</p>
 */
public class ActivityCursor implements AutoCloseable {
    private final ActivityStreamService stream;
    private final TenantContext ctx;
    private final int batchSize;
    private final Duration pollInterval;
    private final Deque<ActivityEvent> buffer = new ArrayDeque<>();
    private volatile boolean closed;
    private long position;

    ActivityCursor(ActivityStreamService stream, TenantContext ctx, long fromSequence, int batchSize, Duration pollInterval) {
        this.stream = stream;
        this.ctx = ctx;
        this.position = Math.max(0L, fromSequence);
        this.batchSize = Math.max(1, batchSize);
        this.pollInterval = pollInterval;
    }

    /**
     * Waits up to {@code timeout} for the next event after the current position.
     */
    public Optional<ActivityEvent> poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!this.closed) {
            ActivityEvent next = this.buffer.pollFirst();
            if (next != null) {
                if (next.sequenceNo() <= this.position) {
                    continue;
                }
                this.position = next.sequenceNo();
                return Optional.of(next);
            }
            long version = this.stream.appendVersion(this.ctx.tenantId());
            List<ActivityEvent> batch = this.stream.read(this.ctx, this.position, this.batchSize);
            if (!batch.isEmpty()) {
                this.buffer.addAll(batch);
                continue;
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            this.stream.awaitAppend(this.ctx.tenantId(), version, Math.min(remainingMs, this.pollInterval.toMillis()));
        }
        return Optional.empty();
    }

    /**
     * Moves the cursor back so the next poll redelivers everything after {@code sequenceNo}.
     */
    public void rewindTo(long sequenceNo) {
        this.buffer.clear();
        this.position = Math.max(0L, sequenceNo);
    }

    public long position() {
        return this.position;
    }

    public boolean isClosed() {
        return this.closed;
    }

    @Override
    public void close() {
        this.closed = true;
        this.buffer.clear();
        this.stream.wake(this.ctx.tenantId());
    }
}
