package io.stagemesh.error;

import java.util.List;

public final class ParallelExecutionTimeoutException extends StageMeshException {
    private final long timeoutMs;
    private final List<String> pendingUnitIds;

    public ParallelExecutionTimeoutException(long timeoutMs, List<String> pendingUnitIds) {
        super("Run exceeded " + timeoutMs + "ms with pending units: " + pendingUnitIds);
        this.timeoutMs = timeoutMs;
        this.pendingUnitIds = List.copyOf(pendingUnitIds);
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public List<String> pendingUnitIds() {
        return pendingUnitIds;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RUN_TIMEOUT;
    }
}
