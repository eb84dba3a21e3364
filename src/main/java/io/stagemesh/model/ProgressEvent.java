package io.stagemesh.model;

public record ProgressEvent(
        long seq,
        String sessionId,
        String unitId,
        ProgressEventType type,
        UnitStatus fromStatus,
        UnitStatus toStatus,
        int attempt,
        long atMs,
        String message
) {
    public static ProgressEvent unit(String unitId, UnitStatus from, UnitStatus to, int attempt, long atMs, String message) {
        return new ProgressEvent(0L, null, unitId, ProgressEventType.UNIT_TRANSITION, from, to, attempt, atMs, message);
    }

    public static ProgressEvent retry(String unitId, int attempt, long atMs, String message) {
        return new ProgressEvent(0L, null, unitId, ProgressEventType.UNIT_RETRY, UnitStatus.RUNNING, UnitStatus.RUNNING, attempt, atMs, message);
    }

    public static ProgressEvent session(ProgressEventType type, long atMs, String message) {
        return new ProgressEvent(0L, null, null, type, null, null, 0, atMs, message);
    }

    ProgressEvent sequenced(long value, String session) {
        return new ProgressEvent(value, session, unitId, type, fromStatus, toStatus, attempt, atMs, message);
    }
}
