package com.jreinhal.concierge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.concierge.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SimpleCircuitBreakerTest {
    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("mongo", 3, Duration.ofSeconds(30), 1, clock);

    @Test
    void opensAfterConsecutiveFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());

        breaker.recordFailure();

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void successResetsTheFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void halfOpenAllowsOneTrialCallAfterTheWindow() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.allowRequest());
        assertEquals(SimpleCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());

        breaker.recordSuccess();

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void failedTrialCallReopens() {
        tripOpen();
        clock.advance(Duration.ofSeconds(31));
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        clock.advance(Duration.ofSeconds(29));
        assertFalse(breaker.allowRequest());
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }
}
