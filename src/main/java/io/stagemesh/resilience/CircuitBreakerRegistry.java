package io.stagemesh.resilience;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * One breaker per work kind, created on first use.
 */
public final class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final LongSupplier clock;

    public CircuitBreakerRegistry(int failureThreshold, long resetTimeoutMs, LongSupplier clock) {
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.clock = clock;
    }

    public CircuitBreaker forKind(String kind) {
        return breakers.computeIfAbsent(kind, k -> new CircuitBreaker(k, failureThreshold, resetTimeoutMs, clock));
    }

    public Map<String, CircuitBreaker.Status> statuses() {
        Map<String, CircuitBreaker.Status> out = new TreeMap<>();
        for (Map.Entry<String, CircuitBreaker> e : breakers.entrySet()) {
            out.put(e.getKey(), e.getValue().status());
        }
        return out;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
