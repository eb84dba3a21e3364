package io.stagemesh.handler;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, UnitHandler> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry register(UnitHandler handler) {
        if (handler == null || handler.kind() == null || handler.kind().isBlank()) {
            throw new IllegalArgumentException("handler kind cannot be empty");
        }
        handlers.put(handler.kind().trim(), handler);
        return this;
    }

    public Optional<UnitHandler> findByKind(String kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(handlers.get(kind));
    }

    public Collection<String> listKinds() {
        return List.copyOf(new TreeSet<>(handlers.keySet()));
    }
}
