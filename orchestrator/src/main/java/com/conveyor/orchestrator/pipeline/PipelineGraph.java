package com.conveyor.orchestrator.pipeline;

import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiled, validated form of a {@link PipelineDefinition}.
 *
 * Stages live in an array (the arena) and refer to each other by index, so the
 * graph holds no object references between stages. Dependencies, dependents and
 * a topological order are computed once in {@link #compile} and never change.
 */
public final class PipelineGraph {

    private final PipelineDefinition   definition;
    private final StageSpec[]          specs;
    private final Map<String, Integer> indexByName;
    private final int[][]              dependencies;
    private final int[][]              dependents;
    private final int[]                order;

    private PipelineGraph(PipelineDefinition definition,
                          StageSpec[] specs,
                          Map<String, Integer> indexByName,
                          int[][] dependencies,
                          int[][] dependents,
                          int[] order) {
        this.definition   = definition;
        this.specs        = specs;
        this.indexByName  = indexByName;
        this.dependencies = dependencies;
        this.dependents   = dependents;
        this.order        = order;
    }

    // ------------------------------------------------------------------
    // Compilation
    // ------------------------------------------------------------------

    /**
     * Validate a definition and build its graph.
     *
     * Every problem found is reported at once, so a broken definition can be
     * fixed in one edit rather than one error per attempt.
     *
     * @throws DefinitionInvalidException on an empty pipeline, duplicate stage names,
     *         unknown or self dependencies, or a dependency cycle
     */
    public static PipelineGraph compile(PipelineDefinition definition) {
        List<String> problems = new ArrayList<>();
        List<StageSpec> stages = definition.stages();
        if (stages.isEmpty()) {
            problems.add("pipeline declares no stages");
        }

        StageSpec[] specs = stages.toArray(new StageSpec[0]);
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < specs.length; i++) {
            if (indexByName.putIfAbsent(specs[i].name(), i) != null) {
                problems.add("duplicate stage name '" + specs[i].name() + "'");
            }
        }

        int[][] dependencies = new int[specs.length][];
        List<List<Integer>> dependentLists = new ArrayList<>();
        for (int i = 0; i < specs.length; i++) dependentLists.add(new ArrayList<>());

        for (int i = 0; i < specs.length; i++) {
            Set<String> declared = new LinkedHashSet<>(specs[i].dependsOn());
            List<Integer> resolved = new ArrayList<>();
            for (String dep : declared) {
                Integer target = indexByName.get(dep);
                if (target == null) {
                    problems.add("stage '" + specs[i].name() + "' depends on unknown stage '" + dep + "'");
                } else if (target == i) {
                    problems.add("stage '" + specs[i].name() + "' depends on itself");
                } else {
                    resolved.add(target);
                    dependentLists.get(target).add(i);
                }
            }
            dependencies[i] = toArray(resolved);
        }
        if (!problems.isEmpty()) {
            throw new DefinitionInvalidException(definition.name(), problems);
        }

        int[][] dependents = new int[specs.length][];
        for (int i = 0; i < specs.length; i++) dependents[i] = toArray(dependentLists.get(i));

        int[] order = topologicalOrder(specs, dependencies, dependents);
        if (order.length < specs.length) {
            BitSet placed = new BitSet(specs.length);
            for (int idx : order) placed.set(idx);
            List<String> cyclic = new ArrayList<>();
            for (int i = 0; i < specs.length; i++) {
                if (!placed.get(i)) cyclic.add(specs[i].name());
            }
            throw new DefinitionInvalidException(definition.name(),
                    List.of("dependency cycle among stages " + cyclic));
        }
        return new PipelineGraph(definition, specs, Map.copyOf(indexByName), dependencies, dependents, order);
    }

    /**
     * Kahn's algorithm. Ties are broken by declaration order so the order is
     * stable across runs of the same definition. Returns fewer than
     * {@code specs.length} entries when the graph has a cycle.
     */
    private static int[] topologicalOrder(StageSpec[] specs, int[][] dependencies, int[][] dependents) {
        int[] inDegree = new int[specs.length];
        for (int i = 0; i < specs.length; i++) inDegree[i] = dependencies[i].length;

        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < specs.length; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        int[] order = new int[specs.length];
        int placed = 0;
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order[placed++] = next;
            for (int dependent : dependents[next]) {
                if (--inDegree[dependent] == 0) ready.add(dependent);
            }
        }
        int[] result = new int[placed];
        System.arraycopy(order, 0, result, 0, placed);
        return result;
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public PipelineDefinition definition() {
        return definition;
    }

    public int size() {
        return specs.length;
    }

    public StageSpec spec(String name) {
        return specs[indexOf(name)];
    }

    public List<String> topologicalOrder() {
        List<String> names = new ArrayList<>(order.length);
        for (int idx : order) names.add(specs[idx].name());
        return names;
    }

    /** Direct dependencies of a stage. */
    public List<String> dependenciesOf(String name) {
        return names(dependencies[indexOf(name)]);
    }

    /** Stages that directly depend on the given stage. */
    public List<String> dependentsOf(String name) {
        return names(dependents[indexOf(name)]);
    }

    /** Every stage that depends on the given stage, directly or through other stages. */
    public Set<String> transitiveDependentsOf(String name) {
        return closure(indexOf(name), dependents);
    }

    /** Every stage the given stage depends on, directly or through other stages. */
    public Set<String> transitiveDependenciesOf(String name) {
        return closure(indexOf(name), dependencies);
    }

    private Set<String> closure(int start, int[][] edges) {
        BitSet seen = new BitSet(specs.length);
        Deque<Integer> pending = new ArrayDeque<>();
        for (int next : edges[start]) pending.push(next);
        while (!pending.isEmpty()) {
            int idx = pending.pop();
            if (seen.get(idx)) continue;
            seen.set(idx);
            for (int next : edges[idx]) pending.push(next);
        }
        Set<String> result = new LinkedHashSet<>();
        for (int idx : order) {
            if (seen.get(idx)) result.add(specs[idx].name());
        }
        return result;
    }

    private List<String> names(int[] indexes) {
        List<String> names = new ArrayList<>(indexes.length);
        for (int idx : indexes) names.add(specs[idx].name());
        return names;
    }

    private int indexOf(String name) {
        Integer idx = indexByName.get(name);
        if (idx == null) {
            throw new IllegalArgumentException("Pipeline '" + definition.name() + "' has no stage '" + name + "'");
        }
        return idx;
    }
}
