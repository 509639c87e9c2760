package com.taskwave.core.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.model.Priority;
import com.taskwave.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskIngestorTest {

    private final TaskIngestor ingestor = new TaskIngestor();

    private static TaskRecord record(String id, String status, String... deps) {
        return new TaskRecord(id, "Title " + id, status, "feature", 1, "desc", List.of(deps));
    }

    @Test
    @DisplayName("Valid open records become tasks in supply order")
    void validRecords() {
        var result = ingestor.ingest(List.of(record("A", "open"), record("B", "in_progress", "A")));

        assertEquals(List.of("A", "B"), result.tasks().stream().map(Task::id).toList());
        assertEquals(Set.of("A"), result.tasks().get(1).dependsOn());
        assertTrue(result.skipped().isEmpty());
        assertEquals(0, result.closedRecords());
    }

    @Test
    @DisplayName("Missing id, blank id and null records are skipped with warnings")
    void malformedRecords() {
        var records = Arrays.asList(
                record("A", "open"),
                record(null, "open"),
                record("  ", "open"),
                null);
        var result = ingestor.ingest(records);

        assertEquals(1, result.tasks().size());
        assertEquals(3, result.skipped().size());
        assertEquals(List.of(1, 2, 3), result.skipped().stream().map(s -> s.index()).toList());
        assertTrue(result.skipped().get(0).reason().contains("'id'"));
        assertTrue(result.skipped().get(2).reason().contains("malformed"));
    }

    @Test
    @DisplayName("Duplicate id keeps the first occurrence")
    void duplicateIds() {
        var first = new TaskRecord("A", "First", "open", null, 0, null, null);
        var second = new TaskRecord("A", "Second", "open", null, 3, null, null);
        var result = ingestor.ingest(List.of(first, second));

        assertEquals(1, result.tasks().size());
        assertEquals("First", result.tasks().get(0).title());
        assertEquals("A", result.skipped().get(0).id());
        assertEquals(1, result.skipped().get(0).index());
    }

    @Test
    @DisplayName("Closed records are counted and excluded")
    void closedRecords() {
        var result = ingestor.ingest(List.of(record("A", "CLOSED"), record("B", "open", "A")));

        assertEquals(List.of("B"), result.tasks().stream().map(Task::id).toList());
        assertEquals(1, result.closedRecords());
    }

    @Test
    @DisplayName("Missing optional fields take neutral defaults")
    void defaults() {
        var result = ingestor.ingest(List.of(new TaskRecord("D", null, null, null, null, null, null)));
        var task = result.tasks().get(0);

        assertEquals("", task.title());
        assertEquals("", task.description());
        assertEquals(TaskIngestor.DEFAULT_TYPE, task.type());
        assertEquals(Priority.LOWEST, task.priority());
        assertTrue(task.dependsOn().isEmpty());
        assertFalse(task.isClosed());
    }

    @Test
    @DisplayName("Dependency ids are trimmed and blanks dropped")
    void cleansDependencies() {
        var result = ingestor.ingest(List.of(new TaskRecord("A", "t", "open", "task", 2, "",
                Arrays.asList(" B ", "", null, "C"))));
        assertEquals(List.of("B", "C"), List.copyOf(result.tasks().get(0).dependsOn()));
    }

    @Test
    @DisplayName("Tracker field names and aliases are both accepted")
    void jsonAliases() throws Exception {
        var mapper = new ObjectMapper();
        var snake = mapper.readValue(
                "{\"id\":\"x\",\"issue_type\":\"bug\",\"depends_on\":[\"y\"],\"assignee\":\"bob\"}", TaskRecord.class);
        var camel = mapper.readValue("{\"id\":\"x\",\"type\":\"bug\",\"dependsOn\":[\"y\"]}", TaskRecord.class);

        assertEquals(snake, camel);
        assertEquals("bug", snake.type());
        assertEquals(List.of("y"), snake.dependsOn());
    }
}
