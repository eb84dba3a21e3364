package io.stagemesh.handler;

import io.stagemesh.engine.UnitContext;
import io.stagemesh.engine.UnitResult;
import io.stagemesh.error.FailureKind;
import io.stagemesh.model.WorkUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per unit. The unit input is written to stdin; stdout
 * and stderr are merged into the output. A non-zero exit is a transient failure.
 */
public final class ScriptHandler implements UnitHandler {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long POLL_MS = 50L;

    private final String kind;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptHandler(String kind, List<String> command, long timeoutMs) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("script handler kind cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script handler command cannot be empty: " + kind);
        }
        this.kind = kind;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String kind() {
        return kind;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public UnitResult execute(WorkUnit unit, UnitContext context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("STAGEMESH_SESSION_ID", context.sessionId());
        pb.environment().put("STAGEMESH_UNIT_ID", unit.id());
        pb.environment().put("STAGEMESH_ATTEMPT", String.valueOf(context.attempt()));
        pb.environment().put("TRACEPARENT", context.traceParent());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return UnitResult.fail(FailureKind.EXECUTION, "script spawn failed: " + e.getMessage());
        }

        try {
            byte[] input = unit.input() == null
                    ? new byte[0]
                    : unit.input().getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (!process.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (context.token() != null && context.token().isCancelled()) {
                    process.destroyForcibly();
                    return UnitResult.fail(FailureKind.CANCELLED, "script cancelled: " + context.token().reason());
                }
                if (System.nanoTime() >= deadline) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return UnitResult.fail(FailureKind.TIMEOUT, "script timeout after " + Duration.ofMillis(timeoutMs));
                }
            }

            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return UnitResult.ok(combined.strip());
            }
            return UnitResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException e) {
            process.destroyForcibly();
            return UnitResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
