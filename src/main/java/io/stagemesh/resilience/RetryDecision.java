package io.stagemesh.resilience;

public record RetryDecision(boolean retry, long delayMs, String reason) {
    public static RetryDecision retryAfter(long delayMs) {
        return new RetryDecision(true, Math.max(0L, delayMs), "retry");
    }

    public static RetryDecision giveUp(String reason) {
        return new RetryDecision(false, 0L, reason);
    }
}
