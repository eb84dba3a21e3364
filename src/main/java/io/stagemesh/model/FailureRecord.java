package io.stagemesh.model;

import io.stagemesh.error.CircuitOpenException;
import io.stagemesh.error.FailureKind;
import io.stagemesh.error.StageExecutionException;
import io.stagemesh.error.StageMeshException;
import io.stagemesh.error.StageTimeoutException;

public record FailureRecord(
        FailureKind kind,
        String unitId,
        String cause,
        int attempts
) {
    private static final int MAX_CAUSE_CHARS = 1024;

    public FailureRecord {
        kind = kind == null ? FailureKind.TRANSIENT : kind;
        cause = truncate(cause);
    }

    public static FailureRecord of(FailureKind kind, String unitId, String cause, int attempts) {
        return new FailureRecord(kind, unitId, cause, attempts);
    }

    public FailureRecord withAttempts(int value) {
        return new FailureRecord(kind, unitId, cause, value);
    }

    /**
     * Rebuilds the exception this record was captured from. Timeouts and breaker
     * rejections keep their type; everything else surfaces as a stage failure.
     */
    public StageMeshException toException() {
        return switch (kind) {
            case TIMEOUT -> new StageTimeoutException(unitId, 0L);
            case CIRCUIT_OPEN -> new CircuitOpenException(unitId, attempts, 0L);
            default -> new StageExecutionException(unitId, kind.name().toLowerCase() + ": " + cause, attempts);
        };
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_CAUSE_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_CAUSE_CHARS) + "...";
    }
}
