package io.stagemesh.handler;

import io.stagemesh.engine.UnitContext;
import io.stagemesh.engine.UnitResult;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.util.Jsons;

import java.time.Instant;

public final class EchoHandler implements UnitHandler {
    @Override
    public String kind() {
        return "echo";
    }

    @Override
    public UnitResult execute(WorkUnit unit, UnitContext context) {
        String output = """
                {
                  "handler": "echo",
                  "timestamp": "%s",
                  "sessionId": %s,
                  "unitId": %s,
                  "attempt": %d,
                  "traceParent": "%s",
                  "received": %s
                }
                """.formatted(
                Instant.now(),
                Jsons.toCompactJson(context.sessionId()),
                Jsons.toCompactJson(unit.id()),
                context.attempt(),
                context.traceParent(),
                Jsons.toCompactJson(unit.input())
        );
        return UnitResult.ok(output.strip());
    }
}
