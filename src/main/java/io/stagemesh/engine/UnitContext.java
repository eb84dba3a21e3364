package io.stagemesh.engine;

public record UnitContext(
        String sessionId,
        String unitId,
        int attempt,
        CancellationToken token,
        String traceId,
        String spanId,
        String traceParent
) {
}
