package io.stagemesh.model;

import io.stagemesh.error.CriticalStageFailureException;
import io.stagemesh.error.FailureKind;
import io.stagemesh.error.InsufficientPartialResultsException;
import io.stagemesh.error.LockTimeoutException;
import io.stagemesh.error.ParallelExecutionTimeoutException;
import io.stagemesh.error.StageExecutionException;
import io.stagemesh.error.StageMeshException;

import java.util.List;

/**
 * Run-level failure. {@code unitIds} holds the pending ids for a run timeout and
 * the failed ids for a critical failure; for a lock timeout it holds the lock key.
 */
public record RunFailure(
        FailureKind kind,
        String message,
        List<String> unitIds,
        long timeoutMs,
        int succeeded,
        int total,
        double minSuccessRatio
) {
    public RunFailure {
        unitIds = unitIds == null ? List.of() : List.copyOf(unitIds);
        message = message == null ? "" : message;
    }

    public static RunFailure from(StageMeshException e) {
        if (e instanceof ParallelExecutionTimeoutException t) {
            return new RunFailure(t.kind(), t.getMessage(), t.pendingUnitIds(), t.timeoutMs(), 0, 0, 0.0);
        }
        if (e instanceof CriticalStageFailureException c) {
            return new RunFailure(c.kind(), c.getMessage(), c.failedUnitIds(), 0L, 0, 0, 0.0);
        }
        if (e instanceof InsufficientPartialResultsException p) {
            return new RunFailure(p.kind(), p.getMessage(), List.of(), 0L, p.succeeded(), p.total(), p.minSuccessRatio());
        }
        if (e instanceof LockTimeoutException l) {
            return new RunFailure(l.kind(), l.getMessage(), List.of(l.lockKey()), l.waitedMs(), 0, 0, 0.0);
        }
        return new RunFailure(e.kind(), e.getMessage(), List.of(), 0L, 0, 0, 0.0);
    }

    public static RunFailure cancelled(String message) {
        return new RunFailure(FailureKind.CANCELLED, message, List.of(), 0L, 0, 0, 0.0);
    }

    public StageMeshException toException() {
        return switch (kind) {
            case RUN_TIMEOUT -> new ParallelExecutionTimeoutException(timeoutMs, unitIds);
            case CRITICAL_FAILURE -> new CriticalStageFailureException(unitIds);
            case INSUFFICIENT_RESULTS -> new InsufficientPartialResultsException(succeeded, total, minSuccessRatio);
            case LOCK_TIMEOUT -> new LockTimeoutException(unitIds.isEmpty() ? "" : unitIds.get(0), timeoutMs);
            default -> new StageExecutionException(unitIds.isEmpty() ? "run" : String.join(",", unitIds), message, 0);
        };
    }
}
