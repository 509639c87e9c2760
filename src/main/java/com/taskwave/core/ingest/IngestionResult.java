package com.taskwave.core.ingest;

import com.taskwave.core.model.SkippedRecord;
import com.taskwave.core.model.Task;

import java.util.List;

/**
 * @param tasks         valid open tasks, in supply order
 * @param skipped       records rejected as malformed or duplicate
 * @param closedRecords valid records dropped because they are closed
 */
public record IngestionResult(List<Task> tasks, List<SkippedRecord> skipped, int closedRecords) {

    public IngestionResult {
        tasks = List.copyOf(tasks);
        skipped = List.copyOf(skipped);
    }
}
