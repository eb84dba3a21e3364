package io.stagemesh.error;

public final class StageTimeoutException extends StageMeshException {
    private final String unitId;
    private final long timeoutMs;

    public StageTimeoutException(String unitId, long timeoutMs) {
        super("Unit \"" + unitId + "\" timed out after " + timeoutMs + "ms");
        this.unitId = unitId;
        this.timeoutMs = timeoutMs;
    }

    public String unitId() {
        return unitId;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
