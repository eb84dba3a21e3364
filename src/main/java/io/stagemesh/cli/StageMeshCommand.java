package io.stagemesh.cli;

import io.stagemesh.config.PlanFile;
import io.stagemesh.config.StageMeshConfig;
import io.stagemesh.engine.RunOptions;
import io.stagemesh.model.ProgressEvent;
import io.stagemesh.model.RunReport;
import io.stagemesh.model.Session;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.runtime.StageMeshRuntime;
import io.stagemesh.storage.Database;
import io.stagemesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "stagemesh",
        mixinStandardHelpOptions = true,
        description = "StageMesh dependency-aware stage scheduler CLI",
        subcommands = {
                StageMeshCommand.InitCommand.class,
                StageMeshCommand.GraphCommand.class,
                StageMeshCommand.RunCommand.class,
                StageMeshCommand.ResumeCommand.class,
                StageMeshCommand.SessionCommand.class,
                StageMeshCommand.SessionsCommand.class,
                StageMeshCommand.EventsCommand.class,
                StageMeshCommand.MetricsCommand.class,
                StageMeshCommand.DeleteSessionCommand.class,
                StageMeshCommand.HandlersCommand.class,
                StageMeshCommand.AuditTailCommand.class,
                StageMeshCommand.AuditVerifyCommand.class,
                StageMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class StageMeshCommand implements Runnable {
    static final int EXIT_RUN_NOT_ACCEPTED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Option(names = {"--backend"}, description = "Session store backend: file | sqlite", defaultValue = "file")
    String backend;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | graph | run | resume | session | sessions | events | metrics | delete-session | handlers | audit-tail | audit-verify | schema-migrations");
    }

    StageMeshConfig config() {
        return StageMeshConfig.fromRoot(root, namespace);
    }

    StageMeshRuntime runtime() {
        StageMeshRuntime runtime = new StageMeshRuntime(config(), StageMeshRuntime.Backend.fromString(backend));
        runtime.init();
        return runtime;
    }

    static int exitCodeFor(RunReport report) {
        return report.overallStatus().isAcceptable() ? 0 : EXIT_RUN_NOT_ACCEPTED;
    }

    @Command(name = "init", description = "Initialize directories and the selected store backend")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                System.out.println("Initialized StageMesh (" + runtime.backend().name().toLowerCase()
                        + ") at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "graph", description = "Print waves, topological order and critical path of a plan")
    static final class GraphCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Override
        public Integer call() {
            List<WorkUnit> units = PlanFile.load(Paths.get(plan));
            StageMeshRuntime runtime = new StageMeshRuntime(parent.config(), StageMeshRuntime.Backend.FILE);
            System.out.println(Jsons.toJson(runtime.graph(units)));
            return 0;
        }
    }

    @Command(name = "run", description = "Execute a plan; prints the run report")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Option(names = {"--session"}, description = "Session id; an existing session is resumed")
        String sessionId;

        @Option(names = {"--settings"}, description = "Engine settings JSON file")
        String settings;

        @Override
        public Integer call() {
            List<WorkUnit> units = PlanFile.load(Paths.get(plan));
            try (StageMeshRuntime runtime = parent.runtime()) {
                RunOptions options = runtime.loadOptions(pathOrNull(settings));
                RunReport report = runtime.run(sessionId, units, options, null);
                System.out.println(Jsons.toJson(report));
                return exitCodeFor(report);
            }
        }
    }

    @Command(name = "resume", description = "Resume an existing session; succeeded units are not run again")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Option(names = {"--session"}, required = true, description = "Session id")
        String sessionId;

        @Option(names = {"--settings"}, description = "Engine settings JSON file")
        String settings;

        @Override
        public Integer call() {
            List<WorkUnit> units = PlanFile.load(Paths.get(plan));
            try (StageMeshRuntime runtime = parent.runtime()) {
                if (runtime.session(sessionId).isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                RunOptions options = runtime.loadOptions(pathOrNull(settings));
                RunReport report = runtime.resume(sessionId, units, options, null);
                System.out.println(Jsons.toJson(report));
                return exitCodeFor(report);
            }
        }
    }

    @Command(name = "session", description = "Show a persisted session")
    static final class SessionCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                Optional<Session> session = runtime.session(sessionId);
                if (session.isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
        }
    }

    @Command(name = "sessions", description = "List persisted sessions")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.sessions()));
                return 0;
            }
        }
    }

    @Command(name = "events", description = "Print progress events of a session")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--since"}, defaultValue = "0", description = "Only events with a greater sequence number")
        long since;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                Optional<List<ProgressEvent>> events = runtime.events(sessionId, since);
                if (events.isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(events.get()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics for a session")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                Optional<String> text = runtime.metricsText(sessionId, runtime.loadOptions(null));
                if (text.isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                System.out.print(text.get());
                return 0;
            }
        }
    }

    @Command(name = "delete-session", description = "Delete a persisted session")
    static final class DeleteSessionCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                boolean deleted = runtime.deleteSession(sessionId);
                System.out.println(Jsons.toJson(Map.of("sessionId", sessionId, "deleted", deleted)));
                return deleted ? 0 : 1;
            }
        }
    }

    @Command(name = "handlers", description = "List registered handler kinds")
    static final class HandlersCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.handlers().listKinds()));
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Option(names = {"--session"}, description = "Only rows of this session")
        String sessionId;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.auditTail(lines, sessionId)));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Override
        public Integer call() {
            try (StageMeshRuntime runtime = parent.runtime()) {
                var out = runtime.verifyAudit();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied SQLite schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        StageMeshCommand parent;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations()));
            return 0;
        }
    }

    static Path pathOrNull(String raw) {
        return raw == null || raw.isBlank() ? null : Paths.get(raw);
    }
}
