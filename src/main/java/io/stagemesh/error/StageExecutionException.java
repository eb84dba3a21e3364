package io.stagemesh.error;

public final class StageExecutionException extends StageMeshException {
    private final String unitId;
    private final int attempts;

    public StageExecutionException(String unitId, String reason, int attempts) {
        super("Unit \"" + unitId + "\" failed after " + attempts + " attempt(s): " + reason);
        this.unitId = unitId;
        this.attempts = attempts;
    }

    public String unitId() {
        return unitId;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.EXECUTION;
    }
}
