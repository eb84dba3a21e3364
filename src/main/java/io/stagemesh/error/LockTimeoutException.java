package io.stagemesh.error;

public final class LockTimeoutException extends StageMeshException {
    private final String lockKey;
    private final long waitedMs;

    public LockTimeoutException(String lockKey, long waitedMs) {
        super("Timed out after " + waitedMs + "ms waiting for lock: " + lockKey);
        this.lockKey = lockKey;
        this.waitedMs = waitedMs;
    }

    public String lockKey() {
        return lockKey;
    }

    public long waitedMs() {
        return waitedMs;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.LOCK_TIMEOUT;
    }
}
