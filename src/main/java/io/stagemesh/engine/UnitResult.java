package io.stagemesh.engine;

import io.stagemesh.error.FailureKind;

/**
 * Outcome of one handler invocation. A plain {@link #fail(String)} is treated as
 * transient and retried per policy.
 */
public record UnitResult(
        boolean success,
        String output,
        FailureKind failureKind,
        String error
) {
    public static UnitResult ok(String output) {
        return new UnitResult(true, output, null, null);
    }

    public static UnitResult fail(String error) {
        return new UnitResult(false, null, FailureKind.TRANSIENT, error);
    }

    public static UnitResult fail(FailureKind kind, String error) {
        return new UnitResult(false, null, kind == null ? FailureKind.TRANSIENT : kind, error);
    }
}
