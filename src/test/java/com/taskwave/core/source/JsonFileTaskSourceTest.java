package com.taskwave.core.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.ingest.TaskRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTaskSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    @DisplayName("Reads a top-level array of records")
    void readsArray() throws Exception {
        Path file = dir.resolve("tasks.json");
        Files.writeString(file, """
                [
                  {"id": "A", "title": "Schema", "priority": 0, "issue_type": "task"},
                  {"id": "B", "title": "API", "depends_on": ["A"], "labels": ["backend"]}
                ]
                """);

        var records = new JsonFileTaskSource(mapper, file).load();

        assertEquals(2, records.size());
        assertEquals(Integer.valueOf(0), records.get(0).priority());
        assertEquals("task", records.get(0).type());
        assertEquals(List.of("A"), records.get(1).dependsOn());
    }

    @Test
    @DisplayName("Reads an object with a tasks array")
    void readsWrappedArray() throws Exception {
        Path file = dir.resolve("wrapped.json");
        Files.writeString(file, "{\"tasks\": [{\"id\": \"A\"}], \"generated\": \"today\"}");

        List<TaskRecord> records = new JsonFileTaskSource(mapper, file).load();
        assertEquals("A", records.get(0).id());
    }

    @Test
    @DisplayName("Object without a tasks array is rejected")
    void rejectsWrongShape() throws Exception {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"items\": []}");

        var ex = assertThrows(TaskSourceException.class, () -> new JsonFileTaskSource(mapper, file).load());
        assertTrue(ex.getMessage().contains("'tasks'"));
    }

    @Test
    @DisplayName("Invalid JSON and missing files raise TaskSourceException")
    void readFailures() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "[{\"id\": ");

        assertThrows(TaskSourceException.class, () -> new JsonFileTaskSource(mapper, file).load());
        assertThrows(TaskSourceException.class,
                () -> new JsonFileTaskSource(mapper, dir.resolve("missing.json")).load());
    }

    @Test
    @DisplayName("A malformed element is handed on as null while its neighbours still load")
    void malformedElementsDoNotFailTheFile() throws Exception {
        Path file = dir.resolve("mixed.json");
        Files.writeString(file, """
                [
                  {"id": "A"},
                  {"id": "B", "priority": "high"},
                  "garbage",
                  {"id": "C", "depends_on": ["A"]}
                ]
                """);

        List<TaskRecord> records = new JsonFileTaskSource(mapper, file).load();

        assertEquals(4, records.size());
        assertEquals("A", records.get(0).id());
        assertNull(records.get(1));
        assertNull(records.get(2));
        assertEquals(List.of("A"), records.get(3).dependsOn());
    }
}
