package io.stagemesh.handler;

import io.stagemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads script handlers from a JSON file of the form
 * {@code {"handlers":[{"kind":"lint","command":["sh","-c","..."],"timeoutMs":60000}]}}.
 */
public final class ScriptHandlers {
    public static final long DEFAULT_TIMEOUT_MS = 60_000L;

    private ScriptHandlers() {
    }

    public static LoadOutcome loadInto(HandlerRegistry registry, Path file) {
        if (!Files.exists(file)) {
            return new LoadOutcome(file.toString(), 0, List.of());
        }
        ScriptHandlerFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), ScriptHandlerFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script handlers: " + file, e);
        }
        if (parsed == null || parsed.handlers() == null) {
            return new LoadOutcome(file.toString(), 0, List.of());
        }
        int loaded = 0;
        List<String> skipped = new ArrayList<>();
        for (ScriptHandlerEntry entry : parsed.handlers()) {
            if (entry == null || entry.kind() == null || entry.kind().isBlank()
                    || entry.command() == null || entry.command().isEmpty()) {
                skipped.add(entry == null || entry.kind() == null ? "<unnamed>" : entry.kind());
                continue;
            }
            long timeoutMs = entry.timeoutMs() == null ? DEFAULT_TIMEOUT_MS : entry.timeoutMs();
            registry.register(new ScriptHandler(entry.kind().trim(), entry.command(), timeoutMs));
            loaded++;
        }
        return new LoadOutcome(file.toString(), loaded, List.copyOf(skipped));
    }

    public record LoadOutcome(String config, int loaded, List<String> skipped) {
    }

    record ScriptHandlerFile(List<ScriptHandlerEntry> handlers) {
    }

    record ScriptHandlerEntry(String kind, List<String> command, Long timeoutMs) {
    }
}
