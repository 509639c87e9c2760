package com.taskwave.core.ingest;

import com.taskwave.core.model.Priority;
import com.taskwave.core.model.SkippedRecord;
import com.taskwave.core.model.Task;
import com.taskwave.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates raw tracker records and converts them into {@link Task} snapshots.
 * <p>
 * A record without an ID, or repeating an ID already seen, is skipped with a warning
 * instead of failing the run. Missing optional fields get neutral defaults: empty
 * title and description, type "task", lowest priority, no dependencies.
 */
@Service
public class TaskIngestor {

    private static final Logger log = LoggerFactory.getLogger(TaskIngestor.class);

    static final String DEFAULT_TYPE = "task";

    public IngestionResult ingest(List<TaskRecord> records) {
        var tasks = new ArrayList<Task>();
        var skipped = new ArrayList<SkippedRecord>();
        Set<String> seen = new HashSet<>();
        int closed = 0;

        for (int i = 0; i < records.size(); i++) {
            TaskRecord record = records.get(i);
            if (record == null) {
                skipped.add(warn(new SkippedRecord(i, null, "record is null or malformed")));
                continue;
            }
            String id = record.id() == null ? null : record.id().trim();
            if (id == null || id.isEmpty()) {
                skipped.add(warn(new SkippedRecord(i, null, "missing required field 'id'")));
                continue;
            }
            if (!seen.add(id)) {
                skipped.add(warn(new SkippedRecord(i, id, "duplicate id, first occurrence kept")));
                continue;
            }

            var task = toTask(id, record);
            if (task.isClosed()) {
                log.debug("  {}: closed, excluded from planning", id);
                closed++;
                continue;
            }
            tasks.add(task);
        }

        log.info("Ingested {} records: {} open tasks, {} closed, {} skipped",
                records.size(), tasks.size(), closed, skipped.size());
        return new IngestionResult(tasks, skipped, closed);
    }

    private Task toTask(String id, TaskRecord record) {
        var deps = new LinkedHashSet<String>();
        if (record.dependsOn() != null) {
            for (String dep : record.dependsOn()) {
                if (dep != null && !dep.isBlank()) {
                    deps.add(dep.trim());
                }
            }
        }
        return new Task(
                id,
                record.title() != null ? record.title() : "",
                TaskStatus.fromWire(record.status()),
                record.type() != null && !record.type().isBlank() ? record.type() : DEFAULT_TYPE,
                record.priority() != null ? record.priority() : Priority.LOWEST,
                record.description() != null ? record.description() : "",
                deps
        );
    }

    private static SkippedRecord warn(SkippedRecord skipped) {
        log.warn("Skipping malformed task {}", skipped);
        return skipped;
    }
}
