package com.taskwave.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable snapshot of a tracker task, as seen by the planner.
 *
 * @param id          unique identifier (e.g. "bd-42")
 * @param title       short summary
 * @param status      OPEN or CLOSED; closed tasks never reach the graph
 * @param type        tracker issue type ("task", "bug", "feature", ...)
 * @param priority    priority class, lower is more urgent (0 = critical)
 * @param description free text; may mention files the task touches
 * @param dependsOn   IDs of tasks that must finish first, in declaration order
 */
public record Task(
    String id,
    String title,
    TaskStatus status,
    String type,
    int priority,
    String description,
    Set<String> dependsOn
) {

    public Task {
        dependsOn = dependsOn == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    public boolean isClosed() {
        return status == TaskStatus.CLOSED;
    }
}
