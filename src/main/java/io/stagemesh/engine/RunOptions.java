package io.stagemesh.engine;

import io.stagemesh.storage.SessionRepository;

import java.util.Set;

/**
 * Per-run settings. {@code perUnitTimeoutMs} and {@code wholeRunTimeoutMs} of 0
 * mean unbounded.
 */
public record RunOptions(
        int globalConcurrency,
        long perUnitTimeoutMs,
        long wholeRunTimeoutMs,
        boolean failFast,
        Set<String> requiredUnitIds,
        boolean allowPartialResults,
        double minSuccessRatio,
        CircuitBreakerSettings circuitBreaker,
        RetrySettings retry,
        LockSettings lock,
        long staleClaimMs,
        long foreignPollMs
) {
    public static final int DEFAULT_GLOBAL_CONCURRENCY = 4;
    public static final long DEFAULT_PER_UNIT_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_STALE_CLAIM_MS = 300_000L;
    public static final long DEFAULT_FOREIGN_POLL_MS = 100L;

    public RunOptions {
        if (globalConcurrency < 1) {
            throw new IllegalArgumentException("globalConcurrency must be >= 1");
        }
        if (perUnitTimeoutMs < 0L || wholeRunTimeoutMs < 0L) {
            throw new IllegalArgumentException("timeouts must be >= 0");
        }
        if (Double.isNaN(minSuccessRatio) || minSuccessRatio < 0.0 || minSuccessRatio > 1.0) {
            throw new IllegalArgumentException("minSuccessRatio must be within [0,1]");
        }
        if (staleClaimMs < 1L || foreignPollMs < 1L) {
            throw new IllegalArgumentException("staleClaimMs and foreignPollMs must be positive");
        }
        requiredUnitIds = requiredUnitIds == null ? Set.of() : Set.copyOf(requiredUnitIds);
        circuitBreaker = circuitBreaker == null ? CircuitBreakerSettings.defaults() : circuitBreaker;
        retry = retry == null ? RetrySettings.defaults() : retry;
        lock = lock == null ? LockSettings.defaults() : lock;
    }

    public static RunOptions defaults() {
        return new RunOptions(
                DEFAULT_GLOBAL_CONCURRENCY,
                DEFAULT_PER_UNIT_TIMEOUT_MS,
                0L,
                false,
                Set.of(),
                false,
                1.0,
                CircuitBreakerSettings.defaults(),
                RetrySettings.defaults(),
                LockSettings.defaults(),
                DEFAULT_STALE_CLAIM_MS,
                DEFAULT_FOREIGN_POLL_MS
        );
    }

    public RunOptions withGlobalConcurrency(int value) {
        return new RunOptions(value, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withPerUnitTimeoutMs(long value) {
        return new RunOptions(globalConcurrency, value, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withWholeRunTimeoutMs(long value) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, value, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withFailFast(boolean value, Set<String> required) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, value, required,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withPartialResults(boolean allow, double ratio) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allow, ratio, circuitBreaker, retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withCircuitBreaker(int failureThreshold, long resetTimeoutMs) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, new CircuitBreakerSettings(failureThreshold, resetTimeoutMs),
                retry, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withRetry(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        return withRetry(new RetrySettings(maxAttempts, baseDelayMs, maxDelayMs, retry.jitterRatio()));
    }

    public RunOptions withRetry(RetrySettings value) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, value, lock, staleClaimMs, foreignPollMs);
    }

    public RunOptions withLock(long ttlMs, long waitMs) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, new LockSettings(ttlMs, waitMs),
                staleClaimMs, foreignPollMs);
    }

    public RunOptions withClaimPolling(long staleMs, long pollMs) {
        return new RunOptions(globalConcurrency, perUnitTimeoutMs, wholeRunTimeoutMs, failFast, requiredUnitIds,
                allowPartialResults, minSuccessRatio, circuitBreaker, retry, lock, staleMs, pollMs);
    }

    public record CircuitBreakerSettings(int failureThreshold, long resetTimeoutMs) {
        public static final int DEFAULT_FAILURE_THRESHOLD = 5;
        public static final long DEFAULT_RESET_TIMEOUT_MS = 30_000L;

        public CircuitBreakerSettings {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("circuitBreaker.failureThreshold must be >= 1");
            }
            if (resetTimeoutMs < 0L) {
                throw new IllegalArgumentException("circuitBreaker.resetTimeoutMs must be >= 0");
            }
        }

        public static CircuitBreakerSettings defaults() {
            return new CircuitBreakerSettings(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT_MS);
        }
    }

    public record RetrySettings(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio) {
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
        public static final long DEFAULT_MAX_DELAY_MS = 60_000L;

        public RetrySettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
            }
            if (baseDelayMs < 0L || maxDelayMs < baseDelayMs) {
                throw new IllegalArgumentException("retry delays must satisfy 0 <= baseDelayMs <= maxDelayMs");
            }
            if (Double.isNaN(jitterRatio) || jitterRatio < 0.0 || jitterRatio > 1.0) {
                throw new IllegalArgumentException("retry.jitterRatio must be within [0,1]");
            }
        }

        public static RetrySettings defaults() {
            return new RetrySettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, 0.0);
        }
    }

    public record LockSettings(long ttlMs, long waitMs) {
        public LockSettings {
            if (ttlMs < 1L || waitMs < 0L) {
                throw new IllegalArgumentException("lock.ttlMs must be positive and lock.waitMs >= 0");
            }
        }

        public static LockSettings defaults() {
            return new LockSettings(SessionRepository.DEFAULT_LOCK_TTL_MS, SessionRepository.DEFAULT_LOCK_WAIT_MS);
        }
    }
}
