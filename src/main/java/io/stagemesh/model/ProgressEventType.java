package io.stagemesh.model;

public enum ProgressEventType {
    SESSION_STARTED,
    SESSION_RESUMED,
    UNIT_TRANSITION,
    UNIT_RETRY,
    SESSION_FINISHED
}
