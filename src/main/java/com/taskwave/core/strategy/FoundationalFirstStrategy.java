package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls foundational tasks (schema, setup, infrastructure...) as early as their
 * dependencies allow.
 * <p>
 * While foundational work remains: ready foundational tasks go first; if none is ready,
 * only the ready prerequisites of pending foundational tasks are emitted. Afterwards
 * the rest follows in plain dependency layers.
 */
@Component
public class FoundationalFirstStrategy implements OrderingStrategy {

    private static final Logger log = LoggerFactory.getLogger(FoundationalFirstStrategy.class);

    @Override
    public StrategyType type() {
        return StrategyType.FOUNDATIONAL_FIRST;
    }

    @Override
    public List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context) {
        DependencyGraph graph = context.graph();
        var all = readySets.stream().flatMap(s -> s.taskIds().stream()).toList();
        var foundational = new LinkedHashSet<String>();
        for (String id : all) {
            if (context.foundational().isFoundational(graph.task(id))) {
                foundational.add(id);
            }
        }
        log.debug("Foundational tasks: {}", foundational);

        var tracker = new ReadyTracker(graph, all);
        var result = new ArrayList<ReadySet>();
        while (tracker.hasRemaining()) {
            var ready = tracker.ready();
            var pendingFoundational = tracker.remaining().stream().filter(foundational::contains).toList();

            List<String> batch;
            GroupReason reason;
            if (pendingFoundational.isEmpty()) {
                batch = ready;
                reason = GroupReason.DEPENDENCIES_SATISFIED;
            } else {
                var readyFoundational = ready.stream().filter(foundational::contains).toList();
                if (!readyFoundational.isEmpty()) {
                    batch = readyFoundational;
                    reason = GroupReason.FOUNDATIONAL;
                } else {
                    var prerequisites = ancestors(graph, pendingFoundational);
                    batch = ready.stream().filter(prerequisites::contains).toList();
                    reason = GroupReason.FOUNDATIONAL_PREREQUISITE;
                }
            }
            if (batch.isEmpty()) {
                throw new IllegalStateException("No schedulable task among " + tracker.remaining());
            }
            tracker.emit(batch);
            result.add(new ReadySet(batch, reason));
        }
        return result;
    }

    private Set<String> ancestors(DependencyGraph graph, List<String> roots) {
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            for (String dep : graph.dependenciesOf(queue.poll())) {
                if (seen.add(dep)) {
                    queue.add(dep);
                }
            }
        }
        return seen;
    }
}
