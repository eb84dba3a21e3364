package io.stagemesh.observability;

import io.stagemesh.model.RunReport;
import io.stagemesh.model.SessionStatus;
import io.stagemesh.model.UnitReport;
import io.stagemesh.model.UnitStatus;
import io.stagemesh.resilience.CircuitBreaker;
import io.stagemesh.resilience.CircuitState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prometheus text exposition of a run report.
 */
public final class MetricsFormatter {
    private MetricsFormatter() {
    }

    public static String format(RunReport report) {
        return format(report, Map.of(), null);
    }

    public static String format(RunReport report, Map<String, CircuitBreaker.Status> breakers, String namespace) {
        StringBuilder sb = new StringBuilder();
        String session = report.sessionId();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (UnitStatus status : UnitStatus.values()) {
            byStatus.put(status.name().toLowerCase(), 0L);
        }
        long attempts = 0L;
        for (UnitReport unit : report.perUnit()) {
            byStatus.merge(unit.status().name().toLowerCase(), 1L, Long::sum);
            attempts += unit.attempts();
        }
        appendMapGauge(sb, "stagemesh_units_total", "Units grouped by status", session, "status", byStatus);
        appendGauge(sb, "stagemesh_unit_attempts_total", "Handler attempts across all units", session, null, null, attempts);
        appendGauge(sb, "stagemesh_run_duration_ms", "Run wall-clock duration in milliseconds", session, null, null,
                report.statistics().totalDurationMs());
        appendGauge(sb, "stagemesh_run_success_ratio", "Succeeded units divided by total units", session, null, null,
                report.statistics().successRatio());
        appendGauge(sb, "stagemesh_run_waves", "Number of dependency waves", session, null, null, report.waves().size());
        for (SessionStatus status : SessionStatus.values()) {
            appendGauge(sb, "stagemesh_run_status", "Run status marker (1=current)", session, "status",
                    status.name().toLowerCase(), status == report.overallStatus() ? 1 : 0);
        }
        for (UnitReport unit : report.perUnit()) {
            appendGauge(sb, "stagemesh_unit_duration_ms", "Unit duration in milliseconds", session, "unit",
                    unit.id(), unit.durationMs());
        }
        for (Map.Entry<String, CircuitBreaker.Status> e : breakers.entrySet()) {
            CircuitBreaker.Status status = e.getValue();
            appendGauge(sb, "stagemesh_circuit_open", "Circuit state per kind (1=open,0.5=half-open,0=closed)",
                    session, "kind", e.getKey(),
                    status.state() == CircuitState.OPEN ? 1 : status.state() == CircuitState.HALF_OPEN ? 0.5 : 0);
            appendGauge(sb, "stagemesh_circuit_rejected_total", "Calls rejected by an open circuit", session, "kind",
                    e.getKey(), status.rejectedCount());
        }
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (!normalizedNamespace.isBlank()) {
            sb.append("# HELP stagemesh_namespace_info Runtime namespace marker\n");
            sb.append("# TYPE stagemesh_namespace_info gauge\n");
            sb.append("stagemesh_namespace_info{namespace=\"").append(escapeLabel(normalizedNamespace)).append("\"} 1\n");
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String session, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append("session=\"").append(escapeLabel(session)).append("\",")
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String session, String label, String labelValue, Number value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric).append('{').append("session=\"").append(escapeLabel(session)).append('"');
        if (label != null && labelValue != null) {
            sb.append(',').append(label).append("=\"").append(escapeLabel(labelValue)).append('"');
        }
        sb.append('}').append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
