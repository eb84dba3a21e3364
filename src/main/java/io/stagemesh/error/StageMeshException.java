package io.stagemesh.error;

/**
 * Root of the scheduler's error taxonomy. Every subtype maps to exactly one
 * {@link FailureKind} so failures can be persisted as plain records and rebuilt
 * into exceptions later.
 */
public abstract class StageMeshException extends RuntimeException {
    protected StageMeshException(String message) {
        super(message);
    }

    protected StageMeshException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
