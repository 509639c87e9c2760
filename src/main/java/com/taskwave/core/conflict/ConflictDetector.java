package com.taskwave.core.conflict;

import com.taskwave.core.model.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds tasks that would touch the same resource if run together.
 */
@Service
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private final ResourceReferenceExtractor extractor;

    public ConflictDetector(ResourceReferenceExtractor extractor) {
        this.extractor = extractor;
    }

    /** Extracts references for every task in the graph once. */
    public ConflictIndex index(DependencyGraph graph) {
        var references = new LinkedHashMap<String, Set<String>>();
        for (String id : graph.nodes()) {
            var refs = extractor.extract(graph.task(id));
            if (!refs.isEmpty()) {
                log.debug("  {} references {}", id, refs);
                references.put(id, refs);
            }
        }
        return new ConflictIndex(references);
    }

    /**
     * Conflict graph among the given tasks: task ID to the IDs it conflicts with.
     * Every given ID has an entry.
     */
    public Map<String, Set<String>> conflictGraph(List<String> taskIds, ConflictIndex index) {
        var graph = new LinkedHashMap<String, Set<String>>();
        for (String id : taskIds) {
            graph.put(id, new LinkedHashSet<>());
        }
        for (int i = 0; i < taskIds.size(); i++) {
            for (int j = i + 1; j < taskIds.size(); j++) {
                String a = taskIds.get(i);
                String b = taskIds.get(j);
                var shared = index.sharedReferences(a, b);
                if (!shared.isEmpty()) {
                    log.debug("Conflict: {} and {} both reference {}", a, b, shared);
                    graph.get(a).add(b);
                    graph.get(b).add(a);
                }
            }
        }
        return graph;
    }
}
