package io.stagemesh.storage;

public record Lock(String key, String holderToken, long acquiredAtMs, long ttlMs) {
    public long expiresAtMs() {
        return acquiredAtMs + ttlMs;
    }

    public boolean isExpired(long nowMs) {
        return nowMs >= expiresAtMs();
    }

    Lock extended(long nowMs, long newTtlMs) {
        return new Lock(key, holderToken, nowMs, newTtlMs);
    }
}
