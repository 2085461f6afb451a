package com.jreinhal.scrubber.fusion;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stops calling the recognition model after repeated failures, then lets a single trial
 * call through once the open period has elapsed.
 */
public class RecognitionCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger trialCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public RecognitionCircuitBreaker(int failureThreshold, Duration openDuration) {
        this(failureThreshold, openDuration, Clock.systemUTC());
    }

    RecognitionCircuitBreaker(int failureThreshold, Duration openDuration, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.clock = clock;
    }

    public boolean tryAcquire() {
        if (this.state == State.CLOSED) {
            return true;
        }
        synchronized (this) {
            if (this.state == State.OPEN) {
                if (this.clock.millis() < this.openUntilEpochMs) {
                    return false;
                }
                this.state = State.HALF_OPEN;
                this.trialCalls.set(0);
            }
            return this.trialCalls.incrementAndGet() <= 1;
        }
    }

    public void onSuccess() {
        this.consecutiveFailures.set(0);
        if (this.state != State.CLOSED) {
            synchronized (this) {
                this.state = State.CLOSED;
                this.trialCalls.set(0);
                this.openUntilEpochMs = 0L;
            }
        }
    }

    public void onFailure() {
        if (this.state == State.HALF_OPEN || this.consecutiveFailures.incrementAndGet() >= this.failureThreshold) {
            synchronized (this) {
                this.state = State.OPEN;
                this.openUntilEpochMs = this.clock.millis() + this.openDuration.toMillis();
                this.consecutiveFailures.set(0);
                this.trialCalls.set(0);
            }
        }
    }

    public State state() {
        return this.state;
    }
}
