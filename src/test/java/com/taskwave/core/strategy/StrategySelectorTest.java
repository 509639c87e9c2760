package com.taskwave.core.strategy;

import com.taskwave.core.config.ConfigurationException;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import com.taskwave.core.model.TestTasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.taskwave.core.strategy.StrategyTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class StrategySelectorTest {

    private final StrategySelector selector = StrategySelector.defaults();

    @Test
    @DisplayName("Resolves every strategy by name")
    void resolvesByName() {
        assertInstanceOf(TopologicalStrategy.class, selector.resolve("topological"));
        assertInstanceOf(RiskFirstStrategy.class, selector.resolve("risk_first"));
        assertInstanceOf(FoundationalFirstStrategy.class, selector.resolve("foundational-first"));
        assertInstanceOf(ParallelMaximizingStrategy.class, selector.resolve("parallel_maximizing"));
    }

    @Test
    @DisplayName("Unknown strategy is a configuration error")
    void unknownStrategy() {
        assertThrows(ConfigurationException.class, () -> selector.resolve("random"));
    }

    @Test
    @DisplayName("Missing implementation fails at construction")
    void missingImplementation() {
        assertThrows(IllegalStateException.class,
                () -> new StrategySelector(List.of(new TopologicalStrategy())));
    }

    @Test
    @DisplayName("Every built-in strategy keeps dependency order on a mixed graph")
    void builtInsKeepOrder() {
        var ctx = context(new KeywordFoundationalHeuristic(List.of("schema")),
                titled("a", "Add API"), titled("b", "Users schema", "a"), titled("c", "UI", "b"),
                titled("d", "Docs"), titled("e", "Tests", "c", "d"));
        for (var type : StrategyType.values()) {
            var strategy = selector.resolve(type.wireName());
            var result = selector.reorder(strategy, layers(ctx), ctx);
            assertEquals(5, result.stream().mapToInt(ReadySet::size).sum(), type.wireName());
        }
    }

    @Test
    @DisplayName("A strategy that breaks dependency order is rejected")
    void rejectsReversedOrder() {
        OrderingStrategy reversing = new TopologicalStrategy() {
            @Override
            public List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context) {
                var copy = new ArrayList<>(readySets);
                Collections.reverse(copy);
                return copy;
            }
        };
        var ctx = context(NOTHING_FOUNDATIONAL, TestTasks.open("A", 2), TestTasks.open("B", 2, "A"));

        var ex = assertThrows(IllegalStateException.class, () -> selector.reorder(reversing, layers(ctx), ctx));
        assertTrue(ex.getMessage().contains("before its dependency A"));
    }

    @Test
    @DisplayName("Dropped or duplicated tasks are rejected")
    void rejectsLostOrDuplicatedTasks() {
        var ctx = context(NOTHING_FOUNDATIONAL, TestTasks.open("A", 2), TestTasks.open("B", 2));
        var strategy = new TopologicalStrategy();

        assertThrows(IllegalStateException.class, () -> StrategySelector.verifyOrder(strategy, ctx.graph(),
                List.of(new ReadySet(List.of("A"), GroupReason.DEPENDENCIES_SATISFIED))));
        assertThrows(IllegalStateException.class, () -> StrategySelector.verifyOrder(strategy, ctx.graph(),
                List.of(new ReadySet(List.of("A", "B"), GroupReason.DEPENDENCIES_SATISFIED),
                        new ReadySet(List.of("A"), GroupReason.DEPENDENCIES_SATISFIED))));
    }
}
