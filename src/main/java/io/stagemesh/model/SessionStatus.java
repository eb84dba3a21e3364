package io.stagemesh.model;

public enum SessionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED || this == ABORTED;
    }

    public boolean isAcceptable() {
        return this == COMPLETED || this == PARTIAL;
    }
}
