package com.taskwave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Final, immutable output of a planning call, consumed by the executor.
 * <p>
 * {@code sequence} is derived from {@code groups} and only written, never read back.
 *
 * @param strategy             strategy name that produced the order
 * @param detectConflicts      whether groups were split on shared resources
 * @param totalTasks           number of tasks across all groups
 * @param totalGroups          number of groups
 * @param parallelizableGroups groups with more than one member
 * @param criticalPathLength   number of synchronization points, i.e. groups
 * @param groups               ordered execution groups
 * @param rationale            human-readable explanation of the order
 */
@JsonPropertyOrder({"strategy", "detectConflicts", "totalTasks", "totalGroups",
        "parallelizableGroups", "criticalPathLength", "sequence", "groups", "rationale"})
@JsonIgnoreProperties(value = {"sequence"}, allowGetters = true)
public record ExecutionPlan(
    String strategy,
    boolean detectConflicts,
    int totalTasks,
    int totalGroups,
    int parallelizableGroups,
    int criticalPathLength,
    List<ExecutionGroup> groups,
    String rationale
) {

    public ExecutionPlan {
        groups = List.copyOf(groups);
    }

    @JsonProperty("sequence")
    public List<List<String>> sequence() {
        return groups.stream().map(ExecutionGroup::taskIds).toList();
    }

    /**
     * The next group to dispatch given what has already finished: the first group
     * with an incomplete member, restricted to its incomplete members.
     *
     * @param completedIds IDs of finished tasks
     * @return the group to run next, or empty when every task is complete
     */
    public Optional<ExecutionGroup> nextGroup(Set<String> completedIds) {
        for (var group : groups) {
            var pending = new ArrayList<String>();
            for (String id : group.taskIds()) {
                if (!completedIds.contains(id)) {
                    pending.add(id);
                }
            }
            if (!pending.isEmpty()) {
                return Optional.of(new ExecutionGroup(group.index(), GroupKind.forSize(pending.size()),
                        pending, group.reason()));
            }
        }
        return Optional.empty();
    }
}
