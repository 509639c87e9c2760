package com.taskwave.core.graph;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layers a dependency graph with Kahn's algorithm.
 * <p>
 * Each layer is a {@link ReadySet}: every task whose dependencies were all emitted in
 * earlier layers. Members keep the graph's node order. A graph that cannot be fully
 * layered raises {@link CycleDetectedException}; a partial order is never returned.
 */
@Service
public class TopologicalSorter {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

    public List<ReadySet> sort(DependencyGraph graph) {
        if (graph.isEmpty()) {
            log.debug("Empty graph, no layers");
            return List.of();
        }
        Map<String, Integer> inDegree = new HashMap<>();
        var frontier = new LinkedHashSet<String>();
        for (String node : graph.nodes()) {
            int degree = graph.dependenciesOf(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                frontier.add(node);
            }
        }

        var layers = new ArrayList<ReadySet>();
        int emitted = 0;
        while (!frontier.isEmpty()) {
            var layer = new ReadySet(new ArrayList<>(frontier), GroupReason.DEPENDENCIES_SATISFIED);
            layers.add(layer);
            emitted += layer.size();
            log.debug("  layer {}: {}", layers.size(), layer.taskIds());

            var next = new LinkedHashSet<String>();
            for (String done : layer.taskIds()) {
                for (String dependent : graph.dependentsOf(done)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependent);
                    }
                }
            }
            frontier = new LinkedHashSet<>(graph.inNodeOrder(next));
        }

        if (emitted < graph.size()) {
            var unresolved = new LinkedHashSet<String>();
            for (String node : graph.nodes()) {
                if (inDegree.get(node) > 0) {
                    unresolved.add(node);
                }
            }
            var onCycle = peelDownstream(graph, unresolved);
            log.warn("Cycle detected: {} of {} tasks cannot be ordered, cycle members {}",
                    unresolved.size(), graph.size(), onCycle);
            throw new CycleDetectedException(onCycle, unresolved);
        }
        return layers;
    }

    /**
     * Narrows the unresolved remainder to nodes on or between cycles by repeatedly
     * removing nodes that nothing else in the remainder depends on.
     */
    private Set<String> peelDownstream(DependencyGraph graph, Set<String> unresolved) {
        var remaining = new LinkedHashSet<>(unresolved);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String node : List.copyOf(remaining)) {
                boolean needed = graph.dependentsOf(node).stream().anyMatch(remaining::contains);
                if (!needed) {
                    remaining.remove(node);
                    changed = true;
                }
            }
        }
        return remaining;
    }
}
