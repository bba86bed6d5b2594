package com.jreinhal.concierge.activity;

import java.util.concurrent.Future;

/**
 * Handle for a background delivery loop started by
 * {@link ActivityStreamService#subscribe(com.jreinhal.concierge.tenant.TenantContext, long, java.util.function.Consumer)}.
 */
public class ActivitySubscription implements AutoCloseable {
    private final ActivityCursor cursor;
    private volatile Future<?> task;

    ActivitySubscription(ActivityCursor cursor) {
        this.cursor = cursor;
    }

    void attach(Future<?> future) {
        this.task = future;
    }

    /**
     * Sequence number of the last event the listener accepted.
     */
    public long position() {
        return this.cursor.position();
    }

    public boolean isCancelled() {
        return this.cursor.isClosed();
    }

    public void cancel() {
        this.cursor.close();
        Future<?> current = this.task;
        if (current != null) {
            current.cancel(true);
        }
    }

    @Override
    public void close() {
        cancel();
    }
}
