package com.jreinhal.scrubber.fusion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RecognitionCircuitBreakerTest {

    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration duration) {
            this.now = this.now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return this.now;
        }
    }

    private final MutableClock clock = new MutableClock();
    private final RecognitionCircuitBreaker breaker = new RecognitionCircuitBreaker(3, Duration.ofSeconds(30), clock);

    @Test
    void opensAfterConsecutiveFailures() {
        breaker.onFailure();
        breaker.onFailure();
        assertEquals(RecognitionCircuitBreaker.State.CLOSED, breaker.state());
        breaker.onFailure();

        assertEquals(RecognitionCircuitBreaker.State.OPEN, breaker.state());
        assertFalse(breaker.tryAcquire());
    }

    @Test
    void successResetsFailureCount() {
        breaker.onFailure();
        breaker.onFailure();
        breaker.onSuccess();
        breaker.onFailure();

        assertEquals(RecognitionCircuitBreaker.State.CLOSED, breaker.state());
    }

    @Test
    void halfOpenAllowsSingleTrial() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure();
        }
        clock.advance(Duration.ofSeconds(31));

        assertTrue(breaker.tryAcquire());
        assertEquals(RecognitionCircuitBreaker.State.HALF_OPEN, breaker.state());
        assertFalse(breaker.tryAcquire());

        breaker.onSuccess();
        assertEquals(RecognitionCircuitBreaker.State.CLOSED, breaker.state());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void failedTrialReopens() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure();
        }
        clock.advance(Duration.ofSeconds(31));
        assertTrue(breaker.tryAcquire());

        breaker.onFailure();

        assertEquals(RecognitionCircuitBreaker.State.OPEN, breaker.state());
        assertFalse(breaker.tryAcquire());
    }
}
