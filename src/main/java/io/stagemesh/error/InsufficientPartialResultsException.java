package io.stagemesh.error;

public final class InsufficientPartialResultsException extends StageMeshException {
    private final int succeeded;
    private final int total;
    private final double minSuccessRatio;

    public InsufficientPartialResultsException(int succeeded, int total, double minSuccessRatio) {
        super("Only " + succeeded + "/" + total + " units succeeded, below required ratio " + minSuccessRatio);
        this.succeeded = succeeded;
        this.total = total;
        this.minSuccessRatio = minSuccessRatio;
    }

    public int succeeded() {
        return succeeded;
    }

    public int total() {
        return total;
    }

    public double minSuccessRatio() {
        return minSuccessRatio;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.INSUFFICIENT_RESULTS;
    }
}
