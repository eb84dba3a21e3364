package io.stagemesh.model;

import java.util.List;
import java.util.Optional;

public record RunReport(
        String sessionId,
        SessionStatus overallStatus,
        List<UnitReport> perUnit,
        RunStatistics statistics,
        RunFailure runFailure,
        List<List<String>> waves,
        List<String> criticalPath,
        String traceId,
        int unitsExecuted
) {
    public RunReport {
        perUnit = perUnit == null ? List.of() : List.copyOf(perUnit);
        waves = waves == null ? List.of() : waves.stream().map(List::copyOf).toList();
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
    }

    public Optional<UnitReport> unit(String id) {
        return perUnit.stream().filter(u -> u.id().equals(id)).findFirst();
    }

    public UnitStatus statusOf(String id) {
        return unit(id).map(UnitReport::status).orElse(null);
    }

    /**
     * Rethrows the run-level failure, if any, as its typed exception.
     */
    public RunReport throwIfFailed() {
        if (runFailure != null && !overallStatus.isAcceptable()) {
            throw runFailure.toException();
        }
        return this;
    }
}
