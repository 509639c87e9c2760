package com.taskwave.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed dependency graph for one planning call.
 * <p>
 * {@code adjacency} maps a task to the tasks it depends on; {@code reverseAdjacency}
 * maps a task to the tasks depending on it. Every node has an entry in both maps,
 * possibly empty, and every referenced ID is a node. Node order is the order tasks
 * were supplied in and drives every tie-break downstream.
 */
public final class DependencyGraph {

    private final Map<String, Task> tasks;
    private final Map<String, Set<String>> adjacency;
    private final Map<String, Set<String>> reverseAdjacency;
    private final Map<String, Integer> order = new HashMap<>();

    public DependencyGraph(Map<String, Task> tasks,
                           Map<String, Set<String>> adjacency,
                           Map<String, Set<String>> reverseAdjacency) {
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        this.adjacency = freeze(adjacency);
        this.reverseAdjacency = freeze(reverseAdjacency);
        for (String node : this.tasks.keySet()) {
            order.put(node, order.size());
        }
        for (String node : this.tasks.keySet()) {
            if (!this.adjacency.containsKey(node) || !this.reverseAdjacency.containsKey(node)) {
                throw new IllegalArgumentException("Node " + node + " is missing an adjacency entry");
            }
        }
        for (var entry : this.adjacency.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!this.tasks.containsKey(dep)) {
                    throw new IllegalArgumentException("Edge " + entry.getKey() + " -> " + dep
                            + " references an unknown node");
                }
            }
        }
    }

    public Set<String> nodes() {
        return tasks.keySet();
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public Task task(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return task;
    }

    /** IDs the given task depends on (within the graph). */
    public Set<String> dependenciesOf(String id) {
        return adjacency.getOrDefault(id, Set.of());
    }

    /** IDs of tasks that depend on the given task. */
    public Set<String> dependentsOf(String id) {
        return reverseAdjacency.getOrDefault(id, Set.of());
    }

    public Map<String, Set<String>> adjacency() {
        return adjacency;
    }

    public Map<String, Set<String>> reverseAdjacency() {
        return reverseAdjacency;
    }

    /** Position of a node in supply order, for stable sorting. */
    public int orderOf(String id) {
        Integer position = order.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return position;
    }

    /** Returns the given IDs sorted by supply order. */
    public List<String> inNodeOrder(Set<String> ids) {
        return tasks.keySet().stream().filter(ids::contains).toList();
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        var copy = new LinkedHashMap<String, Set<String>>();
        source.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(copy);
    }
}
