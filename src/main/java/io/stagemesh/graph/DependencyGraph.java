package io.stagemesh.graph;

import io.stagemesh.error.CycleDetectedException;
import io.stagemesh.model.WorkUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable DAG over a set of work units.
 *
 * <p>Units are grouped into waves: a unit's wave index is one more than the
 * highest wave index among its dependencies, so wave 0 holds every root and the
 * wave count is the minimum possible. Inside a wave units are ordered by
 * priority (higher first) and then by id.
 */
public final class DependencyGraph {
    private static final Comparator<WorkUnit> WAVE_ORDER = Comparator
            .comparingInt(WorkUnit::priority).reversed()
            .thenComparing(WorkUnit::id);

    private final Map<String, WorkUnit> units;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final List<List<String>> waves;
    private final Map<String, Integer> waveIndex;
    private final List<String> topologicalOrder;

    private DependencyGraph(
            Map<String, WorkUnit> units,
            Map<String, List<String>> dependencies,
            Map<String, List<String>> dependents,
            List<List<String>> waves
    ) {
        this.units = units;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.waves = waves;
        Map<String, Integer> index = new HashMap<>();
        List<String> order = new ArrayList<>(units.size());
        for (int i = 0; i < waves.size(); i++) {
            for (String id : waves.get(i)) {
                index.put(id, i);
                order.add(id);
            }
        }
        this.waveIndex = Map.copyOf(index);
        this.topologicalOrder = List.copyOf(order);
    }

    public static DependencyGraph build(Collection<WorkUnit> input) {
        if (input == null) {
            throw new IllegalArgumentException("work units cannot be null");
        }
        Map<String, WorkUnit> units = new TreeMap<>();
        for (WorkUnit unit : input) {
            if (unit == null) {
                throw new IllegalArgumentException("work unit cannot be null");
            }
            if (units.putIfAbsent(unit.id(), unit) != null) {
                throw new IllegalArgumentException("Duplicate work unit id: " + unit.id());
            }
        }
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String id : units.keySet()) {
            dependents.put(id, new ArrayList<>());
        }
        for (WorkUnit unit : units.values()) {
            List<String> deps = new ArrayList<>(unit.dependsOn());
            deps.sort(Comparator.naturalOrder());
            for (String dep : deps) {
                if (!units.containsKey(dep)) {
                    throw new IllegalArgumentException("Unknown dependsOn unit: " + dep + " (required by " + unit.id() + ")");
                }
                dependents.get(dep).add(unit.id());
            }
            dependencies.put(unit.id(), List.copyOf(deps));
        }

        detectCycles(units.keySet(), dependencies);

        Map<String, List<String>> frozenDependents = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : dependents.entrySet()) {
            frozenDependents.put(e.getKey(), List.copyOf(e.getValue()));
        }
        List<List<String>> waves = computeWaves(units, dependencies, frozenDependents);
        return new DependencyGraph(
                Collections.unmodifiableMap(units),
                Collections.unmodifiableMap(dependencies),
                Collections.unmodifiableMap(frozenDependents),
                waves
        );
    }

    // Iterative DFS; each frame remembers the next dependency to visit.
    private static void detectCycles(Set<String> ids, Map<String, List<String>> dependencies) {
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        for (String root : ids) {
            if (visited.contains(root)) {
                continue;
            }
            visiting.add(root);
            path.add(root);
            stack.push(new Frame(root, dependencies.getOrDefault(root, List.of())));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next >= frame.deps.size()) {
                    stack.pop();
                    path.remove(path.size() - 1);
                    visiting.remove(frame.id);
                    visited.add(frame.id);
                    continue;
                }
                String dep = frame.deps.get(frame.next++);
                if (visited.contains(dep)) {
                    continue;
                }
                if (!visiting.add(dep)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                    cycle.add(dep);
                    throw new CycleDetectedException(cycle);
                }
                path.add(dep);
                stack.push(new Frame(dep, dependencies.getOrDefault(dep, List.of())));
            }
        }
    }

    private static final class Frame {
        private final String id;
        private final List<String> deps;
        private int next;

        private Frame(String id, List<String> deps) {
            this.id = id;
            this.deps = deps;
        }
    }

    // Kahn's algorithm, one frontier per wave.
    private static List<List<String>> computeWaves(
            Map<String, WorkUnit> units,
            Map<String, List<String>> dependencies,
            Map<String, List<String>> dependents
    ) {
        Map<String, Integer> remaining = new HashMap<>();
        List<WorkUnit> frontier = new ArrayList<>();
        for (WorkUnit unit : units.values()) {
            int count = dependencies.get(unit.id()).size();
            remaining.put(unit.id(), count);
            if (count == 0) {
                frontier.add(unit);
            }
        }
        List<List<String>> waves = new ArrayList<>();
        int placed = 0;
        while (!frontier.isEmpty()) {
            frontier.sort(WAVE_ORDER);
            List<String> wave = frontier.stream().map(WorkUnit::id).toList();
            waves.add(wave);
            placed += wave.size();
            List<WorkUnit> next = new ArrayList<>();
            for (String id : wave) {
                for (String dependent : dependents.get(id)) {
                    int left = remaining.merge(dependent, -1, Integer::sum);
                    if (left == 0) {
                        next.add(units.get(dependent));
                    }
                }
            }
            frontier = next;
        }
        if (placed != units.size()) {
            throw new IllegalStateException("Wave computation left " + (units.size() - placed) + " unit(s) unplaced");
        }
        return List.copyOf(waves);
    }

    public List<List<String>> waves() {
        return waves;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public int size() {
        return units.size();
    }

    public Collection<WorkUnit> units() {
        return units.values();
    }

    public WorkUnit unit(String id) {
        WorkUnit unit = units.get(id);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown work unit: " + id);
        }
        return unit;
    }

    public boolean contains(String id) {
        return units.containsKey(id);
    }

    public List<String> dependenciesOf(String id) {
        unit(id);
        return dependencies.get(id);
    }

    public List<String> dependentsOf(String id) {
        unit(id);
        return dependents.get(id);
    }

    public int waveIndexOf(String id) {
        unit(id);
        return waveIndex.get(id);
    }

    /**
     * All transitive dependents of {@code id}, in topological order.
     */
    public Set<String> affectedBy(String id) {
        unit(id);
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependents.get(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependents.get(next));
            }
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String candidate : topologicalOrder) {
            if (seen.contains(candidate)) {
                ordered.add(candidate);
            }
        }
        return ordered;
    }

    /**
     * The dependency chain with the highest cumulative estimated cost, root first.
     * Units without an estimate count as 1. Ties resolve to the smaller id.
     */
    public List<String> criticalPath() {
        if (units.isEmpty()) {
            return List.of();
        }
        Map<String, Long> best = new HashMap<>();
        Map<String, String> via = new HashMap<>();
        for (String id : topologicalOrder) {
            long own = units.get(id).costOrDefault();
            long bestDep = 0L;
            String bestDepId = null;
            for (String dep : dependencies.get(id)) {
                long candidate = best.get(dep);
                if (bestDepId == null || candidate > bestDep
                        || (candidate == bestDep && dep.compareTo(bestDepId) < 0)) {
                    bestDep = candidate;
                    bestDepId = dep;
                }
            }
            best.put(id, own + bestDep);
            if (bestDepId != null) {
                via.put(id, bestDepId);
            }
        }
        String end = null;
        for (String id : units.keySet()) {
            if (end == null || best.get(id) > best.get(end)) {
                end = id;
            }
        }
        List<String> path = new ArrayList<>();
        for (String cursor = end; cursor != null; cursor = via.get(cursor)) {
            path.add(cursor);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    public long criticalPathCost() {
        long total = 0L;
        for (String id : criticalPath()) {
            total += units.get(id).costOrDefault();
        }
        return total;
    }
}
