package io.stagemesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Plan file of the form
 * {@code {"units":[{"id":"build","kind":"echo","dependsOn":["fetch"],"priority":1,
 * "estimatedCost":30,"timeoutMs":5000,"input":{...}}]}}.
 * A text {@code input} is passed as is; any other JSON value is passed as compact JSON.
 */
public final class PlanFile {
    private PlanFile() {
    }

    public static List<WorkUnit> load(Path file) {
        if (file == null || !Files.exists(file)) {
            throw new IllegalArgumentException("Plan file not found: " + file);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read plan file: " + file, e);
        }
        return parse(root);
    }

    public static List<WorkUnit> parse(JsonNode root) {
        if (root == null || !root.path("units").isArray()) {
            throw new IllegalArgumentException("Plan must contain a \"units\" array");
        }
        List<WorkUnit> units = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.path("units")) {
            if (!node.isObject()) {
                throw new IllegalArgumentException("Plan unit #" + index + " is not an object");
            }
            LinkedHashSet<String> deps = new LinkedHashSet<>();
            JsonNode dependsOn = node.path("dependsOn");
            if (dependsOn.isArray()) {
                for (JsonNode dep : dependsOn) {
                    deps.add(dep.asText());
                }
            } else if (!dependsOn.isMissingNode() && !dependsOn.isNull()) {
                throw new IllegalArgumentException("dependsOn must be an array in unit #" + index);
            }
            units.add(new WorkUnit(
                    node.path("id").asText(null),
                    node.path("kind").asText(null),
                    deps,
                    node.path("priority").asInt(0),
                    node.hasNonNull("estimatedCost") ? node.get("estimatedCost").asLong() : null,
                    node.hasNonNull("timeoutMs") ? node.get("timeoutMs").asLong() : null,
                    inputOf(node.get("input"))
            ));
            index++;
        }
        return units;
    }

    private static String inputOf(JsonNode input) {
        if (input == null || input.isNull()) {
            return null;
        }
        if (input.isTextual()) {
            return input.asText();
        }
        return input.toString();
    }
}
