package io.stagemesh.resilience;

import io.stagemesh.error.CircuitOpenException;

import java.util.function.LongSupplier;

/**
 * Consecutive-failure breaker for one kind of work.
 *
 * <p>Callers pair every successful {@link #acquire()} with exactly one of
 * {@link #recordSuccess()}, {@link #recordFailure()} or {@link #release()}.
 * While HALF_OPEN a single trial call is admitted; others are rejected until
 * the trial reports back.
 */
public final class CircuitBreaker {
    private final String key;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final LongSupplier clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private long openedAtMs;
    private boolean trialInFlight;
    private long rejectedCount;

    public CircuitBreaker(String key, int failureThreshold, long resetTimeoutMs, LongSupplier clock) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("circuit key cannot be empty");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeoutMs < 0L) {
            throw new IllegalArgumentException("resetTimeoutMs must be >= 0");
        }
        this.key = key;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    public String key() {
        return key;
    }

    /**
     * Admits a call or throws {@link CircuitOpenException}. An OPEN breaker whose
     * cool-down has elapsed moves to HALF_OPEN and admits the caller as its trial.
     */
    public synchronized void acquire() {
        if (state == CircuitState.OPEN) {
            long remaining = remainingCooldownMs();
            if (remaining > 0L) {
                rejectedCount++;
                throw new CircuitOpenException(key, consecutiveFailures, remaining);
            }
            state = CircuitState.HALF_OPEN;
            trialInFlight = false;
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                rejectedCount++;
                throw new CircuitOpenException(key, consecutiveFailures, 0L);
            }
            trialInFlight = true;
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.OPEN) {
            // Late result from a call admitted before the breaker opened.
            return;
        }
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAtMs = 0L;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            trip();
            return;
        }
        if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            trip();
        }
    }

    /**
     * Gives back an admitted call that ended without an outcome (cancelled).
     */
    public synchronized void release() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAtMs = 0L;
        trialInFlight = false;
        rejectedCount = 0L;
    }

    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && remainingCooldownMs() <= 0L) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized Status status() {
        return new Status(
                key,
                state(),
                consecutiveFailures,
                state == CircuitState.OPEN ? remainingCooldownMs() : 0L,
                openedAtMs,
                rejectedCount
        );
    }

    private void trip() {
        state = CircuitState.OPEN;
        openedAtMs = clock.getAsLong();
        trialInFlight = false;
    }

    private long remainingCooldownMs() {
        return Math.max(0L, openedAtMs + resetTimeoutMs - clock.getAsLong());
    }

    public record Status(
            String key,
            CircuitState state,
            int consecutiveFailures,
            long remainingCooldownMs,
            long openedAtMs,
            long rejectedCount
    ) {
    }
}
