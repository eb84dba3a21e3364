package io.stagemesh.model;

import java.util.Map;

public record SessionStatistics(
        int total,
        int pending,
        int running,
        int succeeded,
        int failed,
        int skipped,
        int totalAttempts
) {
    public static SessionStatistics empty() {
        return new SessionStatistics(0, 0, 0, 0, 0, 0, 0);
    }

    public static SessionStatistics of(Map<String, ExecutionState> states) {
        int pending = 0;
        int running = 0;
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int attempts = 0;
        for (ExecutionState state : states.values()) {
            attempts += state.attemptCount();
            switch (state.status()) {
                case RUNNING -> running++;
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> pending++;
            }
        }
        return new SessionStatistics(states.size(), pending, running, succeeded, failed, skipped, attempts);
    }
}
