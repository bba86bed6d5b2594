package com.jreinhal.concierge.util;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal three-state breaker guarding one optional backing store.
 *
 * <p>Time comes from the injected {@link Clock} so tests can move through the open window
 * without sleeping.</p>
 */
public class SimpleCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.millis();
        if (this.state == State.OPEN) {
            if (now < this.openUntilEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.openUntilEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.halfOpenCalls.set(0);
                }
            }
        }
        return this.halfOpenCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.failureCount.set(0);
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
            this.openUntilEpochMs = 0L;
        }
    }

    public void recordFailure() {
        if (this.state == State.HALF_OPEN) {
            openCircuit();
            return;
        }
        if (this.failureCount.incrementAndGet() >= this.failureThreshold) {
            openCircuit();
        }
    }

    public State getState() {
        return this.state;
    }

    public String getName() {
        return this.name;
    }

    private void openCircuit() {
        synchronized (this) {
            this.state = State.OPEN;
            this.openUntilEpochMs = this.clock.millis() + this.openDuration.toMillis();
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
        }
    }
}
