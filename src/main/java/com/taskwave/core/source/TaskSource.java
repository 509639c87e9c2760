package com.taskwave.core.source;

import com.taskwave.core.ingest.TaskRecord;

import java.util.List;

/**
 * Supplies a fully materialized snapshot of tracker records before planning starts.
 */
public interface TaskSource {

    /**
     * @throws TaskSourceException if the records cannot be read
     */
    List<TaskRecord> load();

    /** Short human-readable description for logs, e.g. the file path. */
    String describe();
}
