package io.stagemesh.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A schedulable item. {@code kind} selects the handler; the rest drives ordering.
 */
public record WorkUnit(
        String id,
        String kind,
        Set<String> dependsOn,
        int priority,
        Long estimatedCost,
        Long timeoutOverrideMs,
        String input
) {
    public WorkUnit {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("work unit id cannot be empty");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("work unit kind cannot be empty: " + id);
        }
        id = id.trim();
        kind = kind.trim();
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(dependsOn));
        if (dependsOn.contains(id)) {
            throw new IllegalArgumentException("work unit cannot depend on itself: " + id);
        }
        if (estimatedCost != null && estimatedCost < 0) {
            throw new IllegalArgumentException("estimatedCost cannot be negative: " + id);
        }
        if (timeoutOverrideMs != null && timeoutOverrideMs <= 0) {
            throw new IllegalArgumentException("timeoutOverrideMs must be positive: " + id);
        }
    }

    public static WorkUnit of(String id, String kind, String... dependsOn) {
        return new WorkUnit(id, kind, new LinkedHashSet<>(Arrays.asList(dependsOn)), 0, null, null, null);
    }

    public WorkUnit withPriority(int value) {
        return new WorkUnit(id, kind, dependsOn, value, estimatedCost, timeoutOverrideMs, input);
    }

    public WorkUnit withEstimatedCost(long value) {
        return new WorkUnit(id, kind, dependsOn, priority, value, timeoutOverrideMs, input);
    }

    public WorkUnit withTimeoutOverrideMs(long value) {
        return new WorkUnit(id, kind, dependsOn, priority, estimatedCost, value, input);
    }

    public WorkUnit withInput(String value) {
        return new WorkUnit(id, kind, dependsOn, priority, estimatedCost, timeoutOverrideMs, value);
    }

    public long costOrDefault() {
        return estimatedCost == null ? 1L : estimatedCost;
    }
}
