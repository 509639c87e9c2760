package com.taskwave.core.graph;

import com.taskwave.core.model.Task;
import com.taskwave.core.model.TaskStatus;
import com.taskwave.core.model.TestTasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Test
    @DisplayName("Builds forward and reverse adjacency")
    void buildsAdjacency() {
        var graph = builder.build(List.of(TestTasks.open("A", 2), TestTasks.open("B", 2, "A"), TestTasks.open("C", 2, "A", "B")));

        assertEquals(List.of("A", "B", "C"), List.copyOf(graph.nodes()));
        assertEquals(Set.of(), graph.dependenciesOf("A"));
        assertEquals(Set.of("A", "B"), graph.dependenciesOf("C"));
        assertEquals(Set.of("B", "C"), graph.dependentsOf("A"));
        assertEquals(Set.of(), graph.dependentsOf("C"));
    }

    @Test
    @DisplayName("Every node has an adjacency entry, even without dependencies")
    void everyNodeHasEntry() {
        var graph = builder.build(List.of(TestTasks.open("A", 2), TestTasks.open("B", 2)));
        assertTrue(graph.adjacency().containsKey("A"));
        assertTrue(graph.adjacency().get("A").isEmpty());
        assertTrue(graph.reverseAdjacency().containsKey("B"));
    }

    @Test
    @DisplayName("Closed tasks are excluded and dependencies on them dropped")
    void closedTasksExcluded() {
        var closed = new Task("A", "Done already", TaskStatus.CLOSED, "task", 1, "", Set.of());
        var graph = builder.build(List.of(closed, TestTasks.open("B", 2, "A")));

        assertFalse(graph.nodes().contains("A"));
        assertEquals(Set.of(), graph.dependenciesOf("B"));
    }

    @Test
    @DisplayName("Unknown dependency ids are dropped")
    void danglingDependenciesDropped() {
        var graph = builder.build(List.of(TestTasks.open("B", 2, "missing-1", "missing-2")));
        assertEquals(1, graph.size());
        assertEquals(Set.of(), graph.dependenciesOf("B"));
    }

    @Test
    @DisplayName("Empty input -> empty graph")
    void emptyInput() {
        var graph = builder.build(List.of());
        assertTrue(graph.isEmpty());
        assertEquals(0, graph.size());
    }
}
