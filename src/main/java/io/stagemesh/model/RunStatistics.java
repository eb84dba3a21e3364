package io.stagemesh.model;

public record RunStatistics(
        int total,
        int succeeded,
        int failed,
        int skipped,
        long totalDurationMs
) {
    public double successRatio() {
        if (total == 0) {
            return 1.0;
        }
        return (double) succeeded / (double) total;
    }
}
