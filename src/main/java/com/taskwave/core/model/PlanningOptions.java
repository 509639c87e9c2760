package com.taskwave.core.model;

/**
 * Per-call planning configuration.
 *
 * @param strategy        strategy name (topological, risk_first, foundational_first, parallel_maximizing)
 * @param detectConflicts when false, ready sets are emitted without conflict splitting
 */
public record PlanningOptions(String strategy, boolean detectConflicts) {

    public static PlanningOptions of(String strategy) {
        return new PlanningOptions(strategy, true);
    }
}
