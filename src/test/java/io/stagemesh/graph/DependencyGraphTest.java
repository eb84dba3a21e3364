package io.stagemesh.graph;

import io.stagemesh.error.CycleDetectedException;
import io.stagemesh.model.WorkUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class DependencyGraphTest {

    @Test
    void unitsArePlacedInTheEarliestWaveTheirDependenciesAllow() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                WorkUnit.of("E", "echo", "D"),
                WorkUnit.of("D", "echo", "B", "C"),
                WorkUnit.of("C", "echo", "A"),
                WorkUnit.of("B", "echo"),
                WorkUnit.of("A", "echo")
        ));

        Assertions.assertEquals(List.of(
                List.of("A", "B"),
                List.of("C"),
                List.of("D"),
                List.of("E")
        ), graph.waves());
        Assertions.assertEquals(List.of("A", "B", "C", "D", "E"), graph.topologicalOrder());
        Assertions.assertEquals(0, graph.waveIndexOf("B"));
        Assertions.assertEquals(2, graph.waveIndexOf("D"));
        Assertions.assertEquals(List.of("B", "C"), graph.dependenciesOf("D"));
        Assertions.assertEquals(List.of("D"), graph.dependentsOf("C"));
        Assertions.assertEquals(5, graph.size());
    }

    @Test
    void withinAWaveHigherPriorityComesFirstThenId() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                WorkUnit.of("a", "echo"),
                WorkUnit.of("b", "echo").withPriority(5),
                WorkUnit.of("c", "echo").withPriority(5),
                WorkUnit.of("d", "echo", "a")
        ));

        Assertions.assertEquals(List.of("b", "c", "a"), graph.waves().get(0));
        Assertions.assertEquals(List.of("d"), graph.waves().get(1));
    }

    @Test
    void cycleIsRejectedWithTheOffendingIds() {
        CycleDetectedException error = Assertions.assertThrows(CycleDetectedException.class, () ->
                DependencyGraph.build(List.of(
                        WorkUnit.of("root", "echo"),
                        WorkUnit.of("x", "echo", "root", "z"),
                        WorkUnit.of("y", "echo", "x"),
                        WorkUnit.of("z", "echo", "y")
                )));

        Assertions.assertTrue(error.cycle().containsAll(List.of("x", "y", "z")));
        Assertions.assertFalse(error.cycle().contains("root"));
        Assertions.assertTrue(error.getMessage().contains("x"));
    }

    @Test
    void malformedInputIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                DependencyGraph.build(List.of(WorkUnit.of("a", "echo"), WorkUnit.of("a", "echo"))));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                DependencyGraph.build(List.of(WorkUnit.of("a", "echo", "missing"))));
        Assertions.assertThrows(IllegalArgumentException.class, () -> WorkUnit.of("a", "echo", "a"));
    }

    @Test
    void affectedByReturnsAllTransitiveDependentsInOrder() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                WorkUnit.of("A", "echo"),
                WorkUnit.of("B", "echo"),
                WorkUnit.of("C", "echo", "A"),
                WorkUnit.of("D", "echo", "B", "C"),
                WorkUnit.of("E", "echo", "D"),
                WorkUnit.of("F", "echo", "B")
        ));

        Assertions.assertEquals(List.of("D", "E"), List.copyOf(graph.affectedBy("C")));
        Assertions.assertEquals(Set.of("D", "E", "F"), graph.affectedBy("B"));
        Assertions.assertTrue(graph.affectedBy("E").isEmpty());
    }

    @Test
    void criticalPathFollowsTheHighestCumulativeCost() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                WorkUnit.of("fetch", "echo").withEstimatedCost(10),
                WorkUnit.of("lint", "echo", "fetch").withEstimatedCost(2),
                WorkUnit.of("compile", "echo", "fetch").withEstimatedCost(30),
                WorkUnit.of("test", "echo", "compile").withEstimatedCost(20),
                WorkUnit.of("package", "echo", "lint", "test").withEstimatedCost(5)
        ));

        Assertions.assertEquals(List.of("fetch", "compile", "test", "package"), graph.criticalPath());
        Assertions.assertEquals(65L, graph.criticalPathCost());
    }

    @Test
    void emptyInputBuildsAnEmptyGraph() {
        DependencyGraph graph = DependencyGraph.build(List.of());
        Assertions.assertEquals(0, graph.size());
        Assertions.assertTrue(graph.waves().isEmpty());
        Assertions.assertTrue(graph.criticalPath().isEmpty());
    }

    @Test
    void longChainBuildsOneWavePerUnit() {
        int length = 20_000;
        List<WorkUnit> units = new ArrayList<>(length);
        units.add(WorkUnit.of("u00000", "echo"));
        for (int i = 1; i < length; i++) {
            units.add(WorkUnit.of(String.format("u%05d", i), "echo", String.format("u%05d", i - 1)));
        }

        DependencyGraph graph = Assertions.assertDoesNotThrow(() -> DependencyGraph.build(units));

        Assertions.assertEquals(length, graph.waves().size());
        Assertions.assertEquals(length - 1, graph.waveIndexOf("u19999"));
        Assertions.assertEquals(length, graph.criticalPath().size());
    }

    @Test
    void cycleClosingALongChainIsStillReported() {
        int length = 20_000;
        List<WorkUnit> units = new ArrayList<>(length);
        units.add(WorkUnit.of("u00000", "echo", String.format("u%05d", length - 1)));
        for (int i = 1; i < length; i++) {
            units.add(WorkUnit.of(String.format("u%05d", i), "echo", String.format("u%05d", i - 1)));
        }

        CycleDetectedException error = Assertions.assertThrows(CycleDetectedException.class,
                () -> DependencyGraph.build(units));
        Assertions.assertEquals(length + 1, error.cycle().size());
        Assertions.assertEquals(error.cycle().get(0), error.cycle().get(length));
    }
}
