package io.stagemesh.error;

import java.util.List;

public final class CriticalStageFailureException extends StageMeshException {
    private final List<String> failedUnitIds;

    public CriticalStageFailureException(List<String> failedUnitIds) {
        super("Required unit(s) failed: " + String.join(", ", failedUnitIds));
        this.failedUnitIds = List.copyOf(failedUnitIds);
    }

    public List<String> failedUnitIds() {
        return failedUnitIds;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CRITICAL_FAILURE;
    }
}
