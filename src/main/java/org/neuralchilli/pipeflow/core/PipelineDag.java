package org.neuralchilli.pipeflow.core;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency graph of one pipeline, keyed by pipeline task name.
 * Rebuilt on every reconcile pass.
 */
public final class PipelineDag {

    private final Map<String, Set<String>> predecessors;
    private final List<String> topologicalOrder;

    PipelineDag(Map<String, Set<String>> predecessors, List<String> topologicalOrder) {
        this.predecessors = freeze(predecessors);
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    public Set<String> predecessors(String node) {
        return predecessors.getOrDefault(node, Set.of());
    }

    /**
     * Every node after all of its predecessors.
     */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Nodes not in {@code done} whose predecessors are all in {@code done}, in topological order.
     */
    public List<String> schedulable(Collection<String> done) {
        List<String> result = new ArrayList<>();
        for (String node : topologicalOrder) {
            if (!done.contains(node) && done.containsAll(predecessors(node))) {
                result.add(node);
            }
        }
        return result;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((node, edges) -> frozen.put(node, Collections.unmodifiableSet(new LinkedHashSet<>(edges))));
        return Collections.unmodifiableMap(frozen);
    }

    @Nonnull
    @Override
    public String toString() {
        return "PipelineDag" + predecessors;
    }
}
