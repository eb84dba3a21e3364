package io.stagemesh.engine;

import io.stagemesh.graph.DependencyGraph;
import io.stagemesh.model.ExecutionState;
import io.stagemesh.model.RunFailure;
import io.stagemesh.model.RunReport;
import io.stagemesh.model.RunStatistics;
import io.stagemesh.model.Session;
import io.stagemesh.model.SessionStatus;
import io.stagemesh.model.UnitReport;
import io.stagemesh.model.UnitStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class RunReports {
    private RunReports() {
    }

    /**
     * Report for a persisted session, e.g. one inspected after the run that wrote it.
     */
    public static RunReport fromSession(Session session) {
        return build(
                session.sessionId(),
                session.overallStatus(),
                session.unitStates(),
                List.copyOf(session.unitStates().keySet()),
                session.runFailure(),
                null,
                session.traceId(),
                0,
                Math.max(0L, session.updatedAtMs() - session.createdAtMs())
        );
    }

    static RunReport build(
            String sessionId,
            SessionStatus status,
            Map<String, ExecutionState> states,
            List<String> order,
            RunFailure failure,
            DependencyGraph graph,
            String traceId,
            int unitsExecuted,
            long totalDurationMs
    ) {
        List<UnitReport> perUnit = new ArrayList<>(order.size());
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (String id : order) {
            ExecutionState state = states.get(id);
            if (state == null) {
                continue;
            }
            UnitStatus unitStatus = state.status();
            if (unitStatus == UnitStatus.SUCCEEDED) {
                succeeded++;
            } else if (unitStatus == UnitStatus.FAILED) {
                failed++;
            } else if (unitStatus == UnitStatus.SKIPPED) {
                skipped++;
            }
            perUnit.add(new UnitReport(
                    id,
                    unitStatus,
                    state.attemptCount(),
                    state.durationMs(),
                    unitStatus == UnitStatus.SUCCEEDED ? null : state.lastError()
            ));
        }
        RunStatistics statistics = new RunStatistics(perUnit.size(), succeeded, failed, skipped, totalDurationMs);
        return new RunReport(
                sessionId,
                status,
                perUnit,
                statistics,
                failure,
                graph == null ? List.of() : graph.waves(),
                graph == null ? List.of() : graph.criticalPath(),
                traceId,
                unitsExecuted
        );
    }
}
