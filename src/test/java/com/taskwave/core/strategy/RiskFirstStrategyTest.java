package com.taskwave.core.strategy;

import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.Task;
import com.taskwave.core.model.TestTasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.taskwave.core.strategy.StrategyTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class RiskFirstStrategyTest {

    private final RiskFirstStrategy strategy = new RiskFirstStrategy();

    private List<List<String>> order(Task... tasks) {
        var ctx = context(NOTHING_FOUNDATIONAL, tasks);
        var result = strategy.reorder(layers(ctx), ctx);
        StrategySelector.verifyOrder(strategy, ctx.graph(), result);
        return ids(result);
    }

    @Test
    @DisplayName("Independent P0 runs before P2")
    void criticalFirst() {
        assertEquals(List.of(List.of("A"), List.of("B")),
                order(TestTasks.open("B", 2), TestTasks.open("A", 0)));
    }

    @Test
    @DisplayName("Tasks of the same priority class stay together")
    void samePriorityGrouped() {
        assertEquals(List.of(List.of("A", "B"), List.of("C")),
                order(TestTasks.open("A", 1), TestTasks.open("C", 3), TestTasks.open("B", 1)));
    }

    @Test
    @DisplayName("Newly unblocked P0 jumps ahead of an earlier P2")
    void unblockedUrgentJumpsAhead() {
        assertEquals(List.of(List.of("A"), List.of("C"), List.of("B")),
                order(TestTasks.open("A", 0), TestTasks.open("B", 2), TestTasks.open("C", 0, "A")));
    }

    @Test
    @DisplayName("Blocked P0 still waits for its P2 dependency")
    void dependenciesWinOverPriority() {
        assertEquals(List.of(List.of("Z"), List.of("Y"), List.of("X")),
                order(TestTasks.open("X", 0, "Y"), TestTasks.open("Y", 2), TestTasks.open("Z", 1)));
    }

    @Test
    @DisplayName("Batches are tagged with the priority-class reason")
    void reasonIsPriorityClass() {
        var ctx = context(NOTHING_FOUNDATIONAL, TestTasks.open("A", 0), TestTasks.open("B", 1));
        strategy.reorder(layers(ctx), ctx)
                .forEach(set -> assertEquals(GroupReason.PRIORITY_CLASS, set.reason()));
    }
}
