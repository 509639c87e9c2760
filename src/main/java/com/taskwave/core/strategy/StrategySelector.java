package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.ReadySet;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Resolves strategies by name and runs them, checking the dependency order of
 * whatever they return.
 */
@Service
public class StrategySelector {

    private final Map<StrategyType, OrderingStrategy> strategies = new EnumMap<>(StrategyType.class);

    public StrategySelector(List<OrderingStrategy> available) {
        for (var strategy : available) {
            strategies.put(strategy.type(), strategy);
        }
        for (var type : StrategyType.values()) {
            if (!strategies.containsKey(type)) {
                throw new IllegalStateException("No implementation registered for strategy " + type.wireName());
            }
        }
    }

    /** All four built-in strategies, for use outside a Spring context. */
    public static StrategySelector defaults() {
        return new StrategySelector(List.of(new TopologicalStrategy(), new RiskFirstStrategy(),
                new FoundationalFirstStrategy(), new ParallelMaximizingStrategy()));
    }

    /**
     * @throws com.taskwave.core.config.ConfigurationException for an unknown name
     */
    public OrderingStrategy resolve(String name) {
        return strategies.get(StrategyType.fromName(name));
    }

    public List<ReadySet> reorder(OrderingStrategy strategy, List<ReadySet> readySets, StrategyContext context) {
        var result = strategy.reorder(readySets, context);
        verifyOrder(strategy, context.graph(), result);
        return result;
    }

    public List<ReadySet> consolidate(OrderingStrategy strategy, List<ReadySet> batches, StrategyContext context,
                                      BiPredicate<String, String> conflicts) {
        var result = strategy.consolidate(batches, context, conflicts);
        verifyOrder(strategy, context.graph(), result);
        return result;
    }

    /**
     * Every node appears exactly once, and strictly after all of its dependencies.
     */
    static void verifyOrder(OrderingStrategy strategy, DependencyGraph graph, List<ReadySet> batches) {
        var scheduled = new HashSet<String>();
        for (var batch : batches) {
            for (String id : batch.taskIds()) {
                for (String dep : graph.dependenciesOf(id)) {
                    if (!scheduled.contains(dep)) {
                        throw new IllegalStateException("Strategy " + strategy.type().wireName()
                                + " scheduled " + id + " before its dependency " + dep);
                    }
                }
            }
            for (String id : batch.taskIds()) {
                if (!scheduled.add(id)) {
                    throw new IllegalStateException("Strategy " + strategy.type().wireName()
                            + " scheduled " + id + " twice");
                }
            }
        }
        if (scheduled.size() != graph.size()) {
            throw new IllegalStateException("Strategy " + strategy.type().wireName() + " scheduled "
                    + scheduled.size() + " of " + graph.size() + " tasks");
        }
    }
}
