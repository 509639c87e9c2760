package com.taskwave.core.strategy;

import com.taskwave.core.model.Task;

/**
 * Decides whether a task is foundational, i.e. likely to unblock or simplify many others.
 * Implementations must be deterministic.
 */
@FunctionalInterface
public interface FoundationalHeuristic {

    boolean isFoundational(Task task);
}
