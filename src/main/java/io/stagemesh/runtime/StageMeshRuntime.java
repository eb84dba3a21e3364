package io.stagemesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagemesh.config.EngineSettings;
import io.stagemesh.config.StageMeshConfig;
import io.stagemesh.engine.CancellationToken;
import io.stagemesh.engine.ExecutionEngine;
import io.stagemesh.engine.RunOptions;
import io.stagemesh.engine.RunReports;
import io.stagemesh.graph.DependencyGraph;
import io.stagemesh.handler.EchoHandler;
import io.stagemesh.handler.FailHandler;
import io.stagemesh.handler.HandlerRegistry;
import io.stagemesh.handler.ScriptHandlers;
import io.stagemesh.model.ProgressEvent;
import io.stagemesh.model.RunReport;
import io.stagemesh.model.Session;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.observability.AuditLogger;
import io.stagemesh.observability.MetricsFormatter;
import io.stagemesh.storage.Database;
import io.stagemesh.storage.DurableStore;
import io.stagemesh.storage.FileStore;
import io.stagemesh.storage.SessionRepository;
import io.stagemesh.storage.SqliteStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Process-level wiring: one store backend, the handler registry, the audit log
 * and an {@link ExecutionEngine} for a namespace.
 */
public final class StageMeshRuntime implements AutoCloseable {
    public enum Backend {
        FILE,
        SQLITE;

        public static Backend fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return FILE;
            }
            try {
                return Backend.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown backend: " + raw + " (expected file|sqlite)", e);
            }
        }
    }

    private final StageMeshConfig config;
    private final Backend backend;
    private final HandlerRegistry handlers;
    private final AuditLogger auditLogger;
    private DurableStore store;
    private ExecutionEngine engine;

    public StageMeshRuntime(StageMeshConfig config, Backend backend) {
        this.config = config;
        this.backend = backend == null ? Backend.FILE : backend;
        this.handlers = new HandlerRegistry();
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace());
        registerDefaultHandlers();
    }

    public void init() {
        if (engine != null) {
            return;
        }
        if (backend == Backend.SQLITE) {
            Database database = new Database(config);
            database.init();
            store = new SqliteStore(database);
        } else {
            store = new FileStore(config.storeDir());
        }
        registerConfiguredScriptHandlers();
        engine = new ExecutionEngine(store, handlers, auditLogger, System::currentTimeMillis);
    }

    public StageMeshConfig config() {
        return config;
    }

    public Backend backend() {
        return backend;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public ExecutionEngine engine() {
        return requireEngine();
    }

    /**
     * Options from {@code settingsFile}, or from the namespace settings file when none is given.
     */
    public RunOptions loadOptions(Path settingsFile) {
        Path file = settingsFile == null ? config.settingsFile() : settingsFile;
        return EngineSettings.load(file);
    }

    public GraphView graph(Collection<WorkUnit> units) {
        DependencyGraph graph = DependencyGraph.build(units);
        return new GraphView(graph.size(), graph.waves(), graph.topologicalOrder(),
                graph.criticalPath(), graph.criticalPathCost());
    }

    public RunReport run(String sessionId, Collection<WorkUnit> units, RunOptions options, CancellationToken token) {
        ExecutionEngine current = requireEngine();
        if (sessionId == null || sessionId.isBlank()) {
            return current.run(units, options);
        }
        return current.run(sessionId, units, options, token);
    }

    public RunReport resume(String sessionId, Collection<WorkUnit> units, RunOptions options, CancellationToken token) {
        return requireEngine().resume(sessionId, units, options, token);
    }

    public Optional<Session> session(String sessionId) {
        return repository().load(sessionId);
    }

    public List<SessionSummary> sessions() {
        SessionRepository repository = repository();
        List<SessionSummary> out = new ArrayList<>();
        for (String id : repository.listSessionIds()) {
            repository.load(id).ifPresent(session -> out.add(new SessionSummary(
                    session.sessionId(),
                    session.overallStatus().name(),
                    session.createdAtMs(),
                    session.updatedAtMs(),
                    session.statistics().total(),
                    session.statistics().succeeded(),
                    session.statistics().failed(),
                    session.statistics().skipped()
            )));
        }
        return out;
    }

    public Optional<List<ProgressEvent>> events(String sessionId, long sinceSeq) {
        return session(sessionId).map(session -> session.eventsSince(sinceSeq));
    }

    public Optional<String> metricsText(String sessionId, RunOptions options) {
        Optional<Session> session = session(sessionId);
        if (session.isEmpty()) {
            return Optional.empty();
        }
        RunReport report = RunReports.fromSession(session.get());
        RunOptions effective = options == null ? RunOptions.defaults() : options;
        return Optional.of(MetricsFormatter.format(report,
                requireEngine().circuitBreakers(effective.circuitBreaker()).statuses(),
                config.namespace()));
    }

    public boolean deleteSession(String sessionId) {
        boolean deleted = repository().delete(sessionId);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "session.delete",
                "cli",
                "session/" + sessionId,
                deleted ? "deleted" : "not_found",
                null,
                null,
                sessionId,
                null,
                Map.of()
        ));
        return deleted;
    }

    public List<JsonNode> auditTail(int limit, String sessionId) {
        return auditLogger.tail(limit, sessionId);
    }

    public AuditLogger.IntegrityReport verifyAudit() {
        return auditLogger.verify();
    }

    @Override
    public void close() {
        if (store != null) {
            store.close();
        }
    }

    private SessionRepository repository() {
        return requireEngine().repository();
    }

    private ExecutionEngine requireEngine() {
        if (engine == null) {
            throw new IllegalStateException("runtime not initialized; call init() first");
        }
        return engine;
    }

    private void registerDefaultHandlers() {
        handlers.register(new EchoHandler());
        handlers.register(new FailHandler());
    }

    private void registerConfiguredScriptHandlers() {
        ScriptHandlers.LoadOutcome outcome = ScriptHandlers.loadInto(handlers, config.scriptsFile());
        if (outcome.loaded() == 0 && outcome.skipped().isEmpty()) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "handler.script.register",
                "system",
                "runtime/handlers",
                outcome.skipped().isEmpty() ? "ok" : "partial",
                null,
                null,
                null,
                null,
                Map.of(
                        "config", outcome.config(),
                        "loaded", outcome.loaded(),
                        "skipped", outcome.skipped()
                )
        ));
    }

    public record GraphView(
            int units,
            List<List<String>> waves,
            List<String> topologicalOrder,
            List<String> criticalPath,
            long criticalPathCost
    ) {
    }

    public record SessionSummary(
            String sessionId,
            String overallStatus,
            long createdAtMs,
            long updatedAtMs,
            int total,
            int succeeded,
            int failed,
            int skipped
    ) {
    }
}
