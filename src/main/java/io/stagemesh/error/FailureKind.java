package io.stagemesh.error;

public enum FailureKind {
    TRANSIENT,
    TIMEOUT,
    VALIDATION,
    EXECUTION,
    CIRCUIT_OPEN,
    DEPENDENCY_FAILED,
    RUN_TIMEOUT,
    CRITICAL_FAILURE,
    INSUFFICIENT_RESULTS,
    LOCK_TIMEOUT,
    CANCELLED;

    public static FailureKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRANSIENT;
        }
        for (FailureKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown failure kind: " + raw);
    }
}
