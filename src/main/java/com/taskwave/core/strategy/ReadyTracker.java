package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Incremental Kahn state for strategies that emit tasks one batch at a time
 * instead of a whole layer.
 */
class ReadyTracker {

    private final DependencyGraph graph;
    private final Map<String, Integer> unresolved = new HashMap<>();
    private final Set<String> remaining = new LinkedHashSet<>();

    ReadyTracker(DependencyGraph graph, Collection<String> taskIds) {
        this.graph = graph;
        this.remaining.addAll(graph.inNodeOrder(Set.copyOf(taskIds)));
        for (String id : remaining) {
            int count = 0;
            for (String dep : graph.dependenciesOf(id)) {
                if (remaining.contains(dep)) count++;
            }
            unresolved.put(id, count);
        }
    }

    boolean hasRemaining() {
        return !remaining.isEmpty();
    }

    Set<String> remaining() {
        return remaining;
    }

    /** Remaining tasks whose dependencies have all been emitted, in node order. */
    List<String> ready() {
        var ready = new ArrayList<String>();
        for (String id : remaining) {
            if (unresolved.get(id) == 0) {
                ready.add(id);
            }
        }
        return ready;
    }

    void emit(Collection<String> ids) {
        for (String id : ids) {
            if (!remaining.remove(id)) {
                throw new IllegalStateException("Task " + id + " emitted twice or unknown");
            }
            if (unresolved.get(id) != 0) {
                throw new IllegalStateException("Task " + id + " emitted before its dependencies");
            }
        }
        for (String id : ids) {
            for (String dependent : graph.dependentsOf(id)) {
                if (remaining.contains(dependent)) {
                    unresolved.merge(dependent, -1, Integer::sum);
                }
            }
        }
    }
}
