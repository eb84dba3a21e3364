package io.stagemesh.error;

public final class CircuitOpenException extends StageMeshException {
    private final String circuitKey;
    private final int consecutiveFailures;
    private final long remainingMs;

    public CircuitOpenException(String circuitKey, int consecutiveFailures, long remainingMs) {
        super("Circuit \"" + circuitKey + "\" is open after " + consecutiveFailures
                + " consecutive failure(s), retry in " + remainingMs + "ms");
        this.circuitKey = circuitKey;
        this.consecutiveFailures = consecutiveFailures;
        this.remainingMs = remainingMs;
    }

    public String circuitKey() {
        return circuitKey;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public long remainingMs() {
        return remainingMs;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CIRCUIT_OPEN;
    }
}
