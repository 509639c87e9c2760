package com.taskwave.core.strategy;

import com.taskwave.core.model.ReadySet;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Reorders the dependency layers produced by the topological sorter.
 * <p>
 * Implementations may reorder members, re-split or merge sets, but every task must
 * appear exactly once and strictly after its dependencies; {@link StrategySelector}
 * verifies this after each call.
 */
public interface OrderingStrategy {

    StrategyType type();

    List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context);

    /**
     * Second pass over the conflict-split batches. The default keeps them as they are.
     *
     * @param batches   conflict-free batches in plan order
     * @param context   strategy inputs
     * @param conflicts true when two task IDs must not share a batch
     */
    default List<ReadySet> consolidate(List<ReadySet> batches, StrategyContext context,
                                       BiPredicate<String, String> conflicts) {
        return batches;
    }
}
