package io.stagemesh.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * Process-local store. Every operation runs under the instance monitor.
 */
public final class InMemoryStore extends AbstractDurableStore {
    private final TreeMap<String, String> entries = new TreeMap<>();
    private final Map<String, Lock> locks = new HashMap<>();

    public InMemoryStore() {
        this(System::currentTimeMillis);
    }

    public InMemoryStore(LongSupplier clock) {
        super(clock);
    }

    @Override
    public synchronized Optional<String> read(String key) {
        validateKey(key);
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void write(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null: " + key);
        }
        entries.put(key, value);
    }

    @Override
    public synchronized List<String> list(String prefix) {
        String p = normalizePrefix(prefix);
        List<String> out = new ArrayList<>();
        for (String key : entries.tailMap(p, true).keySet()) {
            if (!key.startsWith(p)) {
                break;
            }
            out.add(key);
        }
        return out;
    }

    @Override
    public synchronized boolean delete(String key) {
        validateKey(key);
        return entries.remove(key) != null;
    }

    @Override
    protected synchronized Optional<Lock> tryAcquire(String key, String holderToken, long ttlMs, long nowMs) {
        Lock current = locks.get(key);
        if (current != null && !current.isExpired(nowMs)) {
            return Optional.empty();
        }
        Lock lock = new Lock(key, holderToken, nowMs, ttlMs);
        locks.put(key, lock);
        return Optional.of(lock);
    }

    @Override
    public synchronized Lock extendLock(Lock lock, long ttlMs) {
        Lock current = locks.get(lock.key());
        if (current == null || !current.holderToken().equals(lock.holderToken())) {
            throw new IllegalStateException("Lock no longer held: " + lock.key());
        }
        Lock extended = current.extended(clock.getAsLong(), ttlMs);
        locks.put(lock.key(), extended);
        return extended;
    }

    @Override
    public synchronized boolean releaseLock(Lock lock) {
        Lock current = locks.get(lock.key());
        if (current == null || !current.holderToken().equals(lock.holderToken())) {
            return false;
        }
        locks.remove(lock.key());
        return true;
    }
}
