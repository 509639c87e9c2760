package com.taskwave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * One synchronization point of the plan: every member may be dispatched together.
 *
 * @param index   1-based position in the plan
 * @param kind    SEQUENTIAL for one member, PARALLEL otherwise
 * @param taskIds members in dispatch preference order
 * @param reason  why the group formed
 */
public record ExecutionGroup(
    int index,
    GroupKind kind,
    List<String> taskIds,
    GroupReason reason
) {

    public ExecutionGroup {
        taskIds = List.copyOf(taskIds);
    }

    public int size() {
        return taskIds.size();
    }

    @JsonIgnore
    public boolean isParallel() {
        return kind == GroupKind.PARALLEL;
    }

    /** The {@code [P:Group-N]} marker executors use for parallel groups. */
    public String marker() {
        return isParallel() ? "[P:Group-" + index + "]" : "[Group-" + index + "]";
    }
}
