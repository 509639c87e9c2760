package com.taskwave.core.model;

/**
 * Tracker-side status of a task. Only OPEN tasks take part in planning.
 */
public enum TaskStatus {
    OPEN,
    CLOSED;

    /**
     * Maps a raw tracker status to a {@link TaskStatus}. Only "closed" (any case)
     * is CLOSED; anything else, including a missing value, counts as OPEN.
     */
    public static TaskStatus fromWire(String raw) {
        if (raw != null && raw.trim().equalsIgnoreCase("closed")) {
            return CLOSED;
        }
        return OPEN;
    }
}
