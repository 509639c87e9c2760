package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Maximizes concurrency.
 * <p>
 * Adjacent batches are merged whenever no member of the later batch depends on a member
 * of the earlier one (and, after conflict splitting, no pair conflicts). Inside a batch,
 * tasks heading the longest chain of dependents come first so that an executor with a
 * concurrency cap starts the critical path early.
 */
@Component
public class ParallelMaximizingStrategy implements OrderingStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelMaximizingStrategy.class);

    @Override
    public StrategyType type() {
        return StrategyType.PARALLEL_MAXIMIZING;
    }

    @Override
    public List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context) {
        var merged = merge(readySets, context.graph(), (a, b) -> false);
        var depth = new HashMap<String, Integer>();
        var result = new ArrayList<ReadySet>();
        for (var set : merged) {
            var ordered = set.taskIds().stream()
                    .sorted(Comparator.comparingInt((String id) -> -chainLength(context.graph(), id, depth))
                            .thenComparingInt(context.graph()::orderOf))
                    .toList();
            result.add(new ReadySet(ordered, set.reason()));
        }
        return result;
    }

    @Override
    public List<ReadySet> consolidate(List<ReadySet> batches, StrategyContext context,
                                      BiPredicate<String, String> conflicts) {
        return merge(batches, context.graph(), conflicts);
    }

    private List<ReadySet> merge(List<ReadySet> batches, DependencyGraph graph,
                                 BiPredicate<String, String> conflicts) {
        var result = new ArrayList<ReadySet>();
        ReadySet current = null;
        for (var next : batches) {
            if (current != null && independent(current, next, graph, conflicts)) {
                var members = new ArrayList<>(current.taskIds());
                members.addAll(next.taskIds());
                log.debug("  merging {} into {}", next.taskIds(), current.taskIds());
                current = new ReadySet(members, GroupReason.MERGED_INDEPENDENT);
                continue;
            }
            if (current != null) {
                result.add(current);
            }
            current = next;
        }
        if (current != null) {
            result.add(current);
        }
        return result;
    }

    private boolean independent(ReadySet earlier, ReadySet later, DependencyGraph graph,
                                BiPredicate<String, String> conflicts) {
        for (String id : later.taskIds()) {
            for (String other : earlier.taskIds()) {
                if (graph.dependenciesOf(id).contains(other) || conflicts.test(id, other)) {
                    return false;
                }
            }
        }
        return true;
    }

    /** Number of tasks on the longest chain of dependents starting at {@code id}. */
    private int chainLength(DependencyGraph graph, String id, Map<String, Integer> memo) {
        Integer cached = memo.get(id);
        if (cached != null) {
            return cached;
        }
        int longest = 0;
        for (String dependent : graph.dependentsOf(id)) {
            longest = Math.max(longest, chainLength(graph, dependent, memo));
        }
        memo.put(id, longest + 1);
        return longest + 1;
    }
}
