package com.taskwave.core.model;

import java.util.Arrays;
import java.util.LinkedHashSet;

/**
 * Task builders for tests that only care about the graph shape.
 */
public final class TestTasks {

    private TestTasks() {}

    /** Open task of type "task" whose title is its ID. */
    public static Task open(String id, int priority, String... dependsOn) {
        return new Task(id, id, TaskStatus.OPEN, "task", priority, "",
                new LinkedHashSet<>(Arrays.asList(dependsOn)));
    }
}
