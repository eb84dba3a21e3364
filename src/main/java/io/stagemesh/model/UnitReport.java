package io.stagemesh.model;

public record UnitReport(
        String id,
        UnitStatus status,
        int attempts,
        long durationMs,
        FailureRecord error
) {
}
