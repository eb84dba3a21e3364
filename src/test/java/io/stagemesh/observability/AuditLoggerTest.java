package io.stagemesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAndVerify() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "team-a");
            logger.log(event("run.start", "ses_1", null));
            logger.log(event("unit.transition", "ses_1", "build"));
            logger.log(event("run.start", "ses_2", null));

            List<JsonNode> rows = logger.tail(10, null);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals("team-a", rows.get(0).path("namespace").asText());
            Assertions.assertEquals(logger.currentHash(), rows.get(2).path("hash").asText());

            AuditLogger.IntegrityReport report = logger.verify();
            Assertions.assertTrue(report.ok());
            Assertions.assertEquals(3, report.totalRows());
            Assertions.assertEquals(logger.currentHash(), report.lastHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailFiltersBySessionAndKeepsOrder() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-audit-tail-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), null);
            logger.log(event("run.start", "ses_1", null));
            logger.log(event("run.start", "ses_2", null));
            logger.log(event("unit.transition", "ses_1", "a"));
            logger.log(event("run.finish", "ses_1", null));

            List<JsonNode> rows = logger.tail(2, "ses_1");
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("unit.transition", rows.get(0).path("action").asText());
            Assertions.assertEquals("run.finish", rows.get(1).path("action").asText());
            Assertions.assertEquals("default", rows.get(0).path("namespace").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLoggerContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-audit-reopen-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "default");
            first.log(event("run.start", "ses_1", null));
            String lastHash = first.currentHash();

            AuditLogger second = new AuditLogger(file, "default");
            Assertions.assertEquals(lastHash, second.currentHash());
            second.log(event("run.finish", "ses_1", null));

            Assertions.assertTrue(second.verify().ok());
            Assertions.assertEquals(2, second.verify().totalRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void verifyDetectsEditedRow() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default");
            logger.log(event("run.start", "ses_1", null));
            logger.log(event("run.finish", "ses_1", null));
            logger.log(event("session.delete", "ses_1", null));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"run.finish\"", "\"run.forged\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityReport report = logger.verify();
            Assertions.assertFalse(report.ok());
            Assertions.assertEquals(2, report.brokenLine());
            Assertions.assertEquals("hash_mismatch", report.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void verifyDetectsRemovedRow() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-audit-truncate-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default");
            logger.log(event("a", "ses_1", null));
            logger.log(event("b", "ses_1", null));
            logger.log(event("c", "ses_1", null));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityReport report = logger.verify();
            Assertions.assertFalse(report.ok());
            Assertions.assertEquals("prev_hash_mismatch", report.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    private static AuditLogger.AuditEvent event(String action, String sessionId, String unitId) {
        return AuditLogger.AuditEvent.of(action, "test", "session/" + sessionId, "ok",
                null, null, sessionId, unitId, Map.of("k", "v"));
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
