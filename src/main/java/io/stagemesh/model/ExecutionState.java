package io.stagemesh.model;

public record ExecutionState(
        UnitStatus status,
        int attemptCount,
        FailureRecord lastError,
        long startedAtMs,
        long finishedAtMs,
        String ownerToken,
        String output
) {
    public ExecutionState {
        status = status == null ? UnitStatus.PENDING : status;
        attemptCount = Math.max(0, attemptCount);
    }

    public static ExecutionState initial(boolean hasDependencies) {
        return new ExecutionState(hasDependencies ? UnitStatus.BLOCKED : UnitStatus.PENDING, 0, null, 0L, 0L, null, null);
    }

    public ExecutionState withStatus(UnitStatus value) {
        return new ExecutionState(value, attemptCount, lastError, startedAtMs, finishedAtMs, ownerToken, output);
    }

    public ExecutionState claimed(String owner, long nowMs) {
        return new ExecutionState(UnitStatus.RUNNING, attemptCount, lastError, nowMs, 0L, owner, null);
    }

    public ExecutionState attempted(int attempts, FailureRecord error) {
        return new ExecutionState(status, attempts, error, startedAtMs, finishedAtMs, ownerToken, output);
    }

    public ExecutionState succeeded(int attempts, String result, long nowMs) {
        return new ExecutionState(UnitStatus.SUCCEEDED, attempts, null, startedAtMs, nowMs, ownerToken, result);
    }

    public ExecutionState failed(int attempts, FailureRecord error, long nowMs) {
        return new ExecutionState(UnitStatus.FAILED, attempts, error, startedAtMs, nowMs, ownerToken, null);
    }

    public ExecutionState skipped(FailureRecord reason, long nowMs) {
        return new ExecutionState(UnitStatus.SKIPPED, attemptCount, reason, startedAtMs, nowMs, ownerToken, null);
    }

    /**
     * Resets a non-successful state so a resumed run can schedule the unit again.
     * Attempt history is kept.
     */
    public ExecutionState resetForResume(boolean hasDependencies) {
        UnitStatus next = hasDependencies ? UnitStatus.BLOCKED : UnitStatus.PENDING;
        return new ExecutionState(next, attemptCount, lastError, 0L, 0L, null, null);
    }

    public long durationMs() {
        if (startedAtMs <= 0L || finishedAtMs <= 0L) {
            return 0L;
        }
        return Math.max(0L, finishedAtMs - startedAtMs);
    }
}
