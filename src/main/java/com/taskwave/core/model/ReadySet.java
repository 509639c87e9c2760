package com.taskwave.core.model;

import java.util.List;

/**
 * Tasks whose dependencies are all scheduled at a given point of the order.
 *
 * @param taskIds members in dispatch preference order
 * @param reason  why this set was formed
 */
public record ReadySet(List<String> taskIds, GroupReason reason) {

    public ReadySet {
        taskIds = List.copyOf(taskIds);
        if (taskIds.isEmpty()) {
            throw new IllegalArgumentException("A ready set cannot be empty");
        }
    }

    public int size() {
        return taskIds.size();
    }
}
