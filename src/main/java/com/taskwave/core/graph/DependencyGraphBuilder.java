package com.taskwave.core.graph;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a task snapshot into a {@link DependencyGraph}.
 * <p>
 * Closed tasks are dropped, and so are dependency IDs that do not name an open task
 * in the snapshot: a finished or unknown prerequisite no longer gates execution.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public DependencyGraph build(List<Task> tasks) {
        var nodes = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            if (task.isClosed()) {
                log.debug("  {}: closed, not scheduled", task.id());
                continue;
            }
            nodes.putIfAbsent(task.id(), task);
        }

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            adjacency.put(id, new LinkedHashSet<>());
            reverse.put(id, new LinkedHashSet<>());
        }

        int edges = 0;
        for (var task : nodes.values()) {
            for (String dep : task.dependsOn()) {
                if (!nodes.containsKey(dep)) {
                    log.debug("  {}: dependency {} is closed or unknown, ignoring", task.id(), dep);
                    continue;
                }
                adjacency.get(task.id()).add(dep);
                reverse.get(dep).add(task.id());
                edges++;
            }
        }

        log.debug("Built dependency graph: {} nodes, {} edges", nodes.size(), edges);
        return new DependencyGraph(nodes, adjacency, reverse);
    }
}
