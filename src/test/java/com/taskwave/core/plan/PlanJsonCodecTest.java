package com.taskwave.core.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.graph.DependencyGraphBuilder;
import com.taskwave.core.model.ExecutionPlan;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import com.taskwave.core.model.TestTasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonCodecTest {

    private final PlanJsonCodec codec = new PlanJsonCodec();

    private static ExecutionPlan samplePlan() {
        var graph = new DependencyGraphBuilder().build(List.of(
                TestTasks.open("A", 0), TestTasks.open("B", 1, "A"), TestTasks.open("C", 1, "A")));
        return new PlanAssembler().assemble("topological", true, List.of(
                new ReadySet(List.of("A"), GroupReason.DEPENDENCIES_SATISFIED),
                new ReadySet(List.of("B", "C"), GroupReason.DEPENDENCIES_SATISFIED)), graph);
    }

    @Test
    @DisplayName("Written document carries every plan field")
    void writesAllFields() throws Exception {
        var json = new ObjectMapper().readTree(codec.write(samplePlan()));

        assertEquals("topological", json.get("strategy").asText());
        assertTrue(json.get("detectConflicts").asBoolean());
        assertEquals(3, json.get("totalTasks").asInt());
        assertEquals(2, json.get("totalGroups").asInt());
        assertEquals(1, json.get("parallelizableGroups").asInt());
        assertEquals(2, json.get("criticalPathLength").asInt());
        assertEquals("B", json.get("sequence").get(1).get(0).asText());
        assertEquals("parallel", json.get("groups").get(1).get("kind").asText());
        assertEquals(2, json.get("groups").get(1).get("index").asInt());
        assertFalse(json.get("groups").get(1).has("parallel"));
        assertTrue(json.get("rationale").asText().startsWith("Strategy: topological"));
    }

    @Test
    @DisplayName("Reading back gives an equal plan")
    void readsBack() {
        var plan = samplePlan();
        assertEquals(plan, codec.read(codec.write(plan)));
    }

    @Test
    @DisplayName("Same plan serializes to identical bytes")
    void deterministic() {
        assertEquals(codec.write(samplePlan()), codec.write(samplePlan()));
    }

    @Test
    @DisplayName("Malformed document is rejected")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> codec.read("{ not json"));
    }
}
