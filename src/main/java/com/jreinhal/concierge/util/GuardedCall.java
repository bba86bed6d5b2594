package com.jreinhal.concierge.util;

import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps calls into one optional backing store with a timeout and a circuit breaker.
 *
 * <p>Every failure (exception, timeout, open circuit, saturated pool) surfaces as
 * {@link BackingStoreUnavailableException}; callers decide which degraded path to take.
 * Without an executor the call runs on the caller thread and only the breaker applies.</p>
 */
public class GuardedCall {
    private final String store;
    private final SimpleCircuitBreaker breaker;
    private final ExecutorService executor;
    private final Duration timeout;
    private final OutageTracker outageTracker;

    public GuardedCall(String store, SimpleCircuitBreaker breaker, ExecutorService executor, Duration timeout, OutageTracker outageTracker) {
        this.store = store;
        this.breaker = breaker;
        this.executor = executor;
        this.timeout = timeout == null ? Duration.ofSeconds(2) : timeout;
        this.outageTracker = outageTracker;
    }

    public <T> T call(Callable<T> action) {
        if (!this.breaker.allowRequest()) {
            throw new BackingStoreUnavailableException(this.store, "circuit open");
        }
        try {
            T result = this.executor == null ? action.call() : this.callWithTimeout(action);
            this.breaker.recordSuccess();
            this.outageTracker.recordSuccess(this.store);
            return result;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw this.failed(e);
        }
        catch (Exception e) {
            throw this.failed(e);
        }
    }

    public void run(Runnable action) {
        this.call(() -> {
            action.run();
            return null;
        });
    }

    public boolean isDegraded() {
        return this.breaker.getState() != SimpleCircuitBreaker.State.CLOSED || this.outageTracker.isDown(this.store);
    }

    public String getStore() {
        return this.store;
    }

    public SimpleCircuitBreaker.State breakerState() {
        return this.breaker.getState();
    }

    private <T> T callWithTimeout(Callable<T> action) throws Exception {
        Future<T> future;
        try {
            future = this.executor.submit(action);
        }
        catch (RejectedExecutionException e) {
            throw new BackingStoreUnavailableException(this.store, "executor saturated", e);
        }
        try {
            return future.get(this.timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new BackingStoreUnavailableException(this.store, "timed out after " + this.timeout.toMillis() + "ms", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private BackingStoreUnavailableException failed(Exception e) {
        this.breaker.recordFailure();
        this.outageTracker.recordFailure(this.store, e);
        if (e instanceof BackingStoreUnavailableException unavailable) {
            return unavailable;
        }
        return new BackingStoreUnavailableException(this.store, e.getMessage(), e);
    }
}
