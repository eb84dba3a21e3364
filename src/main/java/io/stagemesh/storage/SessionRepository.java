package io.stagemesh.storage;

import io.stagemesh.model.Session;
import io.stagemesh.util.Jsons;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Reads and mutates persisted sessions. Every mutation is lock, re-read, mutate,
 * write, release against the store; an in-process lock per session id keeps
 * threads of one process from polling the store lock against each other. An
 * in-process lock lives only while some thread holds or waits for it.
 */
public final class SessionRepository {
    public static final String SESSION_PREFIX = "sessions/";
    public static final String LOCK_PREFIX = "locks/sessions/";
    public static final long DEFAULT_LOCK_TTL_MS = 10_000L;
    public static final long DEFAULT_LOCK_WAIT_MS = 5_000L;

    private final DurableStore store;
    private final long lockTtlMs;
    private final long lockWaitMs;
    private final ConcurrentMap<String, LocalLock> localLocks;

    public SessionRepository(DurableStore store) {
        this(store, DEFAULT_LOCK_TTL_MS, DEFAULT_LOCK_WAIT_MS);
    }

    public SessionRepository(DurableStore store, long lockTtlMs, long lockWaitMs) {
        this(store, lockTtlMs, lockWaitMs, new ConcurrentHashMap<>());
    }

    private SessionRepository(DurableStore store, long lockTtlMs, long lockWaitMs, ConcurrentMap<String, LocalLock> localLocks) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
        this.lockTtlMs = Math.max(1L, lockTtlMs);
        this.lockWaitMs = Math.max(0L, lockWaitMs);
        this.localLocks = localLocks;
    }

    /**
     * Same store and in-process locks, different lock timings.
     */
    public SessionRepository withLockSettings(long ttlMs, long waitMs) {
        return new SessionRepository(store, ttlMs, waitMs, localLocks);
    }

    public DurableStore store() {
        return store;
    }

    public static String sessionKey(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    public static String lockKey(String sessionId) {
        return LOCK_PREFIX + sessionId;
    }

    public Optional<Session> load(String sessionId) {
        return store.read(sessionKey(validateId(sessionId))).map(raw -> Jsons.fromJson(raw, Session.class));
    }

    public List<String> listSessionIds() {
        return store.list(SESSION_PREFIX).stream()
                .map(key -> key.substring(SESSION_PREFIX.length()))
                .toList();
    }

    /**
     * Applies {@code mutator} to the session that must already exist.
     */
    public Session update(String sessionId, UnaryOperator<Session> mutator) {
        return compute(sessionId, current -> mutator.apply(current.orElseThrow(
                () -> new IllegalArgumentException("Session not found: " + sessionId))));
    }

    /**
     * Runs {@code fn} over the latest persisted state under the session lock and
     * writes its result. Returning the same instance skips the write.
     *
     * @throws io.stagemesh.error.LockTimeoutException when the lock cannot be taken in time
     */
    public Session compute(String sessionId, Function<Optional<Session>, Session> fn) {
        String id = validateId(sessionId);
        LocalLock local = enterLocal(id);
        try {
            Lock lock = store.acquireLock(lockKey(id), lockTtlMs, lockWaitMs);
            try {
                Optional<Session> current = load(id);
                Session next = fn.apply(current);
                if (next == null) {
                    throw new IllegalStateException("Session mutator returned null: " + id);
                }
                if (!id.equals(next.sessionId())) {
                    throw new IllegalStateException("Session mutator changed id: " + id + " -> " + next.sessionId());
                }
                if (current.isEmpty() || current.get() != next) {
                    store.write(sessionKey(id), Jsons.toCompactJson(next));
                }
                return next;
            } finally {
                store.releaseLock(lock);
            }
        } finally {
            exitLocal(id, local);
        }
    }

    public boolean delete(String sessionId) {
        String id = validateId(sessionId);
        LocalLock local = enterLocal(id);
        try {
            Lock lock = store.acquireLock(lockKey(id), lockTtlMs, lockWaitMs);
            try {
                return store.delete(sessionKey(id));
            } finally {
                store.releaseLock(lock);
            }
        } finally {
            exitLocal(id, local);
        }
    }

    private LocalLock enterLocal(String id) {
        LocalLock local = localLocks.compute(id, (k, existing) -> {
            LocalLock next = existing == null ? new LocalLock() : existing;
            next.users++;
            return next;
        });
        local.lock.lock();
        return local;
    }

    private void exitLocal(String id, LocalLock local) {
        local.lock.unlock();
        localLocks.computeIfPresent(id, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    int localLockCount() {
        return localLocks.size();
    }

    private static String validateId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be empty");
        }
        String id = sessionId.trim();
        if (id.contains("/") || id.contains("..")) {
            throw new IllegalArgumentException("invalid sessionId: " + sessionId);
        }
        return id;
    }

    // users is only touched inside ConcurrentMap.compute for the owning key.
    private static final class LocalLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
