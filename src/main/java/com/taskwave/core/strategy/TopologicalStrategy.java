package com.taskwave.core.strategy;

import com.taskwave.core.model.ReadySet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Dependency order only: the sorter's layers pass through unchanged.
 */
@Component
public class TopologicalStrategy implements OrderingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.TOPOLOGICAL;
    }

    @Override
    public List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context) {
        return readySets;
    }
}
