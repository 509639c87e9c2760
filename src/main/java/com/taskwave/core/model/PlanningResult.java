package com.taskwave.core.model;

import java.util.List;

/**
 * Plan plus the ingestion warnings collected while building it.
 *
 * @param plan          the execution plan for the valid, open tasks
 * @param skipped       malformed or duplicate records that were ignored
 * @param closedRecords number of closed records filtered out
 */
public record PlanningResult(ExecutionPlan plan, List<SkippedRecord> skipped, int closedRecords) {

    public PlanningResult {
        skipped = List.copyOf(skipped);
    }

    public boolean hasWarnings() {
        return !skipped.isEmpty();
    }
}
