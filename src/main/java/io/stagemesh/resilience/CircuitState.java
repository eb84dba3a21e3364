package io.stagemesh.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
