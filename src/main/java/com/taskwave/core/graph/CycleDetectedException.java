package com.taskwave.core.graph;

import com.taskwave.core.model.PlanningException;

import java.util.Set;

/**
 * Thrown when the dependency graph cannot be fully ordered.
 * <p>
 * {@link #cycleNodes()} holds the tasks on (or between) cycles; {@link #unresolvedNodes()}
 * additionally includes tasks that are only blocked because they depend on a cycle.
 */
public class CycleDetectedException extends PlanningException {

    private final Set<String> cycleNodes;
    private final Set<String> unresolvedNodes;

    public CycleDetectedException(Set<String> cycleNodes, Set<String> unresolvedNodes) {
        super("Dependency cycle detected among tasks " + cycleNodes
                + (unresolvedNodes.size() > cycleNodes.size()
                        ? " (" + unresolvedNodes.size() + " tasks blocked in total: " + unresolvedNodes + ")"
                        : ""));
        this.cycleNodes = Set.copyOf(cycleNodes);
        this.unresolvedNodes = Set.copyOf(unresolvedNodes);
    }

    public Set<String> cycleNodes() {
        return cycleNodes;
    }

    public Set<String> unresolvedNodes() {
        return unresolvedNodes;
    }
}
