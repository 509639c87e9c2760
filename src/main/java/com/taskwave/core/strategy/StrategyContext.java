package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;

/**
 * Read-only inputs a strategy may consult besides the ready sets.
 *
 * @param graph        dependency graph with the task metadata (priority, title, type)
 * @param foundational heuristic used by foundational-first ordering
 */
public record StrategyContext(DependencyGraph graph, FoundationalHeuristic foundational) {
}
