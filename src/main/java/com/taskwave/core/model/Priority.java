package com.taskwave.core.model;

/**
 * Priority class helpers. Trackers use 0 (critical) to 4 (lowest).
 */
public final class Priority {

    public static final int LOWEST = 4;

    private Priority() {}

    /** Label used in rationale and console output, e.g. "P0". */
    public static String label(int priority) {
        return "P" + priority;
    }
}
