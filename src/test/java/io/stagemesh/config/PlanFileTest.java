package io.stagemesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

final class PlanFileTest {

    @Test
    void parsesUnitsWithOptionalFields() throws Exception {
        JsonNode root = Jsons.mapper().readTree("""
                {"units": [
                  {"id": "fetch", "kind": "echo", "estimatedCost": 5, "input": "plain text"},
                  {"id": "compile", "kind": "echo", "dependsOn": ["fetch"], "priority": 3, "timeoutMs": 2000,
                   "input": {"target": "jar"}},
                  {"id": "test", "kind": "fail", "dependsOn": ["compile", "fetch"]}
                ]}
                """);

        List<WorkUnit> units = PlanFile.parse(root);

        Assertions.assertEquals(3, units.size());
        WorkUnit fetch = units.get(0);
        Assertions.assertEquals("fetch", fetch.id());
        Assertions.assertEquals("echo", fetch.kind());
        Assertions.assertTrue(fetch.dependsOn().isEmpty());
        Assertions.assertEquals(0, fetch.priority());
        Assertions.assertEquals(5L, fetch.estimatedCost());
        Assertions.assertNull(fetch.timeoutOverrideMs());
        Assertions.assertEquals("plain text", fetch.input());

        WorkUnit compile = units.get(1);
        Assertions.assertEquals(Set.of("fetch"), compile.dependsOn());
        Assertions.assertEquals(3, compile.priority());
        Assertions.assertEquals(2_000L, compile.timeoutOverrideMs());
        Assertions.assertNull(compile.estimatedCost());
        Assertions.assertEquals("{\"target\":\"jar\"}", compile.input());

        Assertions.assertEquals(Set.of("compile", "fetch"), units.get(2).dependsOn());
        Assertions.assertNull(units.get(2).input());
    }

    @Test
    void rejectsMalformedPlans() throws Exception {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFile.parse(Jsons.mapper().readTree("{\"stages\": []}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFile.parse(Jsons.mapper().readTree("{\"units\": [\"fetch\"]}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFile.parse(Jsons.mapper().readTree("{\"units\": [{\"id\": \"a\", \"kind\": \"echo\", \"dependsOn\": \"b\"}]}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFile.parse(Jsons.mapper().readTree("{\"units\": [{\"kind\": \"echo\"}]}")));
    }

    @Test
    void missingPlanFileIsReported() {
        Path missing = Paths.get("build", "does-not-exist", "plan.json");
        IllegalArgumentException error = Assertions.assertThrows(IllegalArgumentException.class,
                () -> PlanFile.load(missing));
        Assertions.assertTrue(error.getMessage().contains("Plan file not found"));
    }
}
