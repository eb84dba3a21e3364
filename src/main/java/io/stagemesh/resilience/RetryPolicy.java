package io.stagemesh.resilience;

import io.stagemesh.error.FailureKind;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff. Pure apart from the jitter source; the caller
 * performs the wait.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0L || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelayMs <= maxDelayMs");
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be within [0,1]");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public static boolean isRetryable(FailureKind kind) {
        return kind == FailureKind.TIMEOUT || kind == FailureKind.TRANSIENT;
    }

    /**
     * @param attempts attempts made so far, including the one that just failed
     */
    public RetryDecision decide(int attempts, FailureKind kind) {
        if (!isRetryable(kind)) {
            return RetryDecision.giveUp("non_retryable:" + kind);
        }
        if (attempts >= maxAttempts) {
            return RetryDecision.giveUp("attempts_exhausted");
        }
        return RetryDecision.retryAfter(delayFor(attempts));
    }

    public long delayFor(int attempts) {
        long backoff = baseDelayMs;
        for (int i = 1; i < attempts; i++) {
            if (backoff > maxDelayMs - backoff) {
                backoff = maxDelayMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxDelayMs);
        if (jitterRatio <= 0.0 || backoff == 0L) {
            return backoff;
        }
        double factor = 1.0 + (random.getAsDouble() - 0.5) * jitterRatio;
        long jittered = Math.round(backoff * factor);
        return Math.max(0L, Math.min(maxDelayMs, jittered));
    }
}
