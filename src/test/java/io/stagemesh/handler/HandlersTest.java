package io.stagemesh.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagemesh.engine.CancellationToken;
import io.stagemesh.engine.UnitContext;
import io.stagemesh.engine.UnitResult;
import io.stagemesh.error.FailureKind;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.observability.TraceContextUtil;
import io.stagemesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class HandlersTest {

    @Test
    void echoReturnsUnitAndContextAsJson() throws Exception {
        WorkUnit unit = WorkUnit.of("greet", "echo").withInput("hello");
        UnitResult result = new EchoHandler().execute(unit, context("ses_echo", "greet", 2));

        Assertions.assertTrue(result.success());
        JsonNode output = Jsons.mapper().readTree(result.output());
        Assertions.assertEquals("echo", output.path("handler").asText());
        Assertions.assertEquals("ses_echo", output.path("sessionId").asText());
        Assertions.assertEquals("greet", output.path("unitId").asText());
        Assertions.assertEquals(2, output.path("attempt").asInt());
        Assertions.assertEquals("hello", output.path("received").asText());
        Assertions.assertTrue(output.path("traceParent").asText().startsWith("00-"));
    }

    @Test
    void failHandlerUsesInputAsFailureKind() {
        FailHandler handler = new FailHandler();

        UnitResult plain = handler.execute(WorkUnit.of("f", "fail"), context("s", "f", 1));
        UnitResult transientFailure = handler.execute(WorkUnit.of("f", "fail").withInput("transient"), context("s", "f", 1));
        UnitResult unknown = handler.execute(WorkUnit.of("f", "fail").withInput("no-such-kind"), context("s", "f", 1));

        Assertions.assertFalse(plain.success());
        Assertions.assertEquals(FailureKind.EXECUTION, plain.failureKind());
        Assertions.assertEquals(FailureKind.TRANSIENT, transientFailure.failureKind());
        Assertions.assertEquals(FailureKind.EXECUTION, unknown.failureKind());
    }

    @Test
    void registryListsKindsSortedAndRejectsBlankKinds() {
        HandlerRegistry registry = new HandlerRegistry()
                .register(new FailHandler())
                .register(new EchoHandler());

        Assertions.assertEquals(List.of("echo", "fail"), List.copyOf(registry.listKinds()));
        Assertions.assertTrue(registry.findByKind("echo").isPresent());
        Assertions.assertTrue(registry.findByKind("missing").isEmpty());
        Assertions.assertTrue(registry.findByKind(null).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(null));
    }

    @Test
    void scriptHandlersLoadValidEntriesAndReportSkipped() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-scripts-");
        try {
            Path file = root.resolve("scripts.json");
            Files.writeString(file, """
                    {"handlers": [
                      {"kind": "lint", "command": ["sh", "-c", "echo lint"], "timeoutMs": 5000},
                      {"kind": "broken"},
                      {"command": ["true"]}
                    ]}
                    """, StandardCharsets.UTF_8);
            HandlerRegistry registry = new HandlerRegistry();

            ScriptHandlers.LoadOutcome outcome = ScriptHandlers.loadInto(registry, file);

            Assertions.assertEquals(1, outcome.loaded());
            Assertions.assertEquals(List.of("broken", "<unnamed>"), outcome.skipped());
            UnitHandler lint = registry.findByKind("lint").orElseThrow();
            Assertions.assertEquals(List.of("sh", "-c", "echo lint"), ((ScriptHandler) lint).command());

            ScriptHandlers.LoadOutcome absent = ScriptHandlers.loadInto(registry, root.resolve("absent.json"));
            Assertions.assertEquals(0, absent.loaded());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void scriptHandlerPassesInputOnStdinAndReportsExitCode() throws Exception {
        ScriptHandler cat = new ScriptHandler("cat", List.of("sh", "-c", "cat; echo \" $STAGEMESH_UNIT_ID\""), 10_000L);
        UnitResult ok = cat.execute(WorkUnit.of("u1", "cat").withInput("payload"), context("s", "u1", 1));
        Assertions.assertTrue(ok.success());
        Assertions.assertEquals("payload u1", ok.output());

        ScriptHandler failing = new ScriptHandler("exit", List.of("sh", "-c", "echo broken; exit 3"), 10_000L);
        UnitResult failed = failing.execute(WorkUnit.of("u2", "exit"), context("s", "u2", 1));
        Assertions.assertFalse(failed.success());
        Assertions.assertEquals(FailureKind.TRANSIENT, failed.failureKind());
        Assertions.assertTrue(failed.error().contains("exit=3"));
        Assertions.assertTrue(failed.error().contains("broken"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void scriptHandlerStopsOnCancellation() throws Exception {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        ScriptHandler sleeper = new ScriptHandler("sleep", List.of("sh", "-c", "sleep 5"), 10_000L);

        UnitResult result = sleeper.execute(WorkUnit.of("u3", "sleep"), new UnitContext("s", "u3", 1, token,
                TraceContextUtil.newTraceId(), TraceContextUtil.newSpanId(), "00-x-y-01"));

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(FailureKind.CANCELLED, result.failureKind());
    }

    private static UnitContext context(String sessionId, String unitId, int attempt) {
        String traceId = TraceContextUtil.newTraceId();
        String spanId = TraceContextUtil.newSpanId();
        return new UnitContext(sessionId, unitId, attempt, CancellationToken.create(), traceId, spanId,
                TraceContextUtil.toTraceParent(traceId, spanId));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
