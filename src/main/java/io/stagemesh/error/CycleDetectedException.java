package io.stagemesh.error;

import java.util.List;

public final class CycleDetectedException extends StageMeshException {
    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.VALIDATION;
    }
}
