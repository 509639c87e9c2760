package com.taskwave.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.ingest.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads task records from a JSON file holding either an array of records or an
 * object with a {@code tasks} array.
 */
public class JsonFileTaskSource implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskSource.class);

    private final ObjectMapper objectMapper;
    private final Path path;

    public JsonFileTaskSource(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public List<TaskRecord> load() {
        if (!Files.isRegularFile(path)) {
            throw new TaskSourceException("Task file not found: " + path);
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            JsonNode records = root != null && root.isObject() ? root.get("tasks") : root;
            if (records == null || !records.isArray()) {
                throw new TaskSourceException("Expected a JSON array of tasks or an object with a 'tasks' array in "
                        + path);
            }
            var result = new ArrayList<TaskRecord>();
            for (JsonNode element : records) {
                result.add(convert(element, result.size()));
            }
            log.info("Loaded {} task records from {}", result.size(), path);
            return result;
        } catch (IOException e) {
            throw new TaskSourceException("Failed to read tasks from " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts one element. An element that cannot be read as a record becomes
     * {@code null}, which {@link com.taskwave.core.ingest.TaskIngestor} reports as skipped.
     */
    private TaskRecord convert(JsonNode element, int index) {
        try {
            return objectMapper.convertValue(element, TaskRecord.class);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed task record #{} in {}: {}", index, path, e.getMessage());
            return null;
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
