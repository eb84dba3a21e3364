package io.stagemesh.observability;

import io.stagemesh.error.FailureKind;
import io.stagemesh.model.FailureRecord;
import io.stagemesh.model.RunReport;
import io.stagemesh.model.RunStatistics;
import io.stagemesh.model.SessionStatus;
import io.stagemesh.model.UnitReport;
import io.stagemesh.model.UnitStatus;
import io.stagemesh.resilience.CircuitBreaker;
import io.stagemesh.resilience.CircuitState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsFormatterTest {
    @Test
    void formatShouldExposeUnitCountsAndRunStatus() {
        String text = MetricsFormatter.format(sampleReport());

        assertTrue(text.contains("# TYPE stagemesh_units_total gauge"));
        assertTrue(text.contains("stagemesh_units_total{session=\"ses_m\",status=\"succeeded\"} 2"));
        assertTrue(text.contains("stagemesh_units_total{session=\"ses_m\",status=\"failed\"} 1"));
        assertTrue(text.contains("stagemesh_units_total{session=\"ses_m\",status=\"running\"} 0"));
        assertTrue(text.contains("stagemesh_unit_attempts_total{session=\"ses_m\"} 5"));
        assertTrue(text.contains("stagemesh_run_status{session=\"ses_m\",status=\"failed\"} 1"));
        assertTrue(text.contains("stagemesh_run_status{session=\"ses_m\",status=\"completed\"} 0"));
        assertTrue(text.contains("stagemesh_run_waves{session=\"ses_m\"} 2"));
        assertTrue(text.contains("stagemesh_unit_duration_ms{session=\"ses_m\",unit=\"compile\"} 40"));
        assertFalse(text.contains("stagemesh_namespace_info"));
    }

    @Test
    void helpLinesShouldAppearOncePerMetric() {
        String text = MetricsFormatter.format(sampleReport());
        assertEquals(1, count(text, "# HELP stagemesh_unit_duration_ms "));
        assertEquals(1, count(text, "# HELP stagemesh_run_status "));
    }

    @Test
    void formatShouldIncludeBreakersAndNamespace() {
        Map<String, CircuitBreaker.Status> breakers = Map.of(
                "remote", new CircuitBreaker.Status("remote", CircuitState.OPEN, 3, 1_000L, 10L, 4L)
        );
        String text = MetricsFormatter.format(sampleReport(), breakers, "team \"a\"");

        assertTrue(text.contains("stagemesh_circuit_open{session=\"ses_m\",kind=\"remote\"} 1.0"));
        assertTrue(text.contains("stagemesh_circuit_rejected_total{session=\"ses_m\",kind=\"remote\"} 4"));
        assertTrue(text.contains("stagemesh_namespace_info{namespace=\"team \\\"a\\\"\"} 1"));
    }

    private static RunReport sampleReport() {
        List<UnitReport> units = List.of(
                new UnitReport("fetch", UnitStatus.SUCCEEDED, 1, 10L, null),
                new UnitReport("compile", UnitStatus.SUCCEEDED, 2, 40L, null),
                new UnitReport("test", UnitStatus.FAILED, 2, 15L,
                        FailureRecord.of(FailureKind.EXECUTION, "test", "exit 1", 2))
        );
        return new RunReport(
                "ses_m",
                SessionStatus.FAILED,
                units,
                new RunStatistics(3, 2, 1, 0, 70L),
                null,
                List.of(List.of("fetch"), List.of("compile", "test")),
                List.of("fetch", "compile"),
                "0123456789abcdef0123456789abcdef",
                3
        );
    }

    private static int count(String text, String needle) {
        int n = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            n++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return n;
    }
}
