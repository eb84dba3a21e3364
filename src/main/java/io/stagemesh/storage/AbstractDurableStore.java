package io.stagemesh.storage;

import io.stagemesh.error.LockTimeoutException;

import java.util.Optional;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Shared key validation and the polling acquire loop. Backends only provide a
 * single non-blocking acquisition attempt.
 */
abstract class AbstractDurableStore implements DurableStore {
    private static final long MIN_POLL_MS = 5L;
    private static final long MAX_POLL_MS = 50L;

    protected final LongSupplier clock;

    protected AbstractDurableStore(LongSupplier clock) {
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    protected abstract Optional<Lock> tryAcquire(String key, String holderToken, long ttlMs, long nowMs);

    @Override
    public Lock acquireLock(String key, long ttlMs, long timeoutMs) {
        validateKey(key);
        if (ttlMs <= 0L) {
            throw new IllegalArgumentException("lock ttlMs must be positive");
        }
        String holderToken = "lk_" + UUID.randomUUID();
        long startedAt = System.nanoTime();
        long timeoutNanos = Math.max(0L, timeoutMs) * 1_000_000L;
        long pollMs = MIN_POLL_MS;
        while (true) {
            Optional<Lock> acquired = tryAcquire(key, holderToken, ttlMs, clock.getAsLong());
            if (acquired.isPresent()) {
                return acquired.get();
            }
            long elapsed = System.nanoTime() - startedAt;
            if (elapsed >= timeoutNanos) {
                throw new LockTimeoutException(key, elapsed / 1_000_000L);
            }
            long sleepMs = Math.min(pollMs, Math.max(1L, (timeoutNanos - elapsed) / 1_000_000L));
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                // Interrupted waits surface as a timeout; the flag stays set for the caller.
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(key, (System.nanoTime() - startedAt) / 1_000_000L);
            }
            pollMs = Math.min(MAX_POLL_MS, pollMs * 2L);
        }
    }

    protected static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("store key cannot be empty");
        }
        if (key.startsWith("/") || key.contains("..") || key.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("invalid store key: " + key);
        }
    }

    protected static String normalizePrefix(String prefix) {
        return prefix == null ? "" : prefix;
    }
}
