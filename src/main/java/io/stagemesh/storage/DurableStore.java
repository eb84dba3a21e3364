package io.stagemesh.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key/value persistence with per-key atomic writes and an exclusive, TTL-bounded
 * lock. A lock whose TTL has elapsed may be taken over by another holder even if
 * the original holder never released it.
 */
public interface DurableStore extends AutoCloseable {
    Optional<String> read(String key);

    /**
     * Replaces the value for {@code key}. Readers observe either the old or the new
     * value, never a partial write.
     */
    void write(String key, String value);

    /**
     * Keys starting with {@code prefix}, sorted ascending.
     */
    List<String> list(String prefix);

    boolean delete(String key);

    /**
     * Blocks up to {@code timeoutMs} for the lock.
     *
     * @throws io.stagemesh.error.LockTimeoutException when the lock is still held at the deadline
     */
    Lock acquireLock(String key, long ttlMs, long timeoutMs);

    /**
     * @throws IllegalStateException when the lock is no longer held by {@code lock}'s holder
     */
    Lock extendLock(Lock lock, long ttlMs);

    boolean releaseLock(Lock lock);

    @Override
    default void close() {
    }
}
