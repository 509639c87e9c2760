package com.taskwave.core.source;

/**
 * Thrown when a {@link TaskSource} cannot read or parse its records.
 */
public class TaskSourceException extends RuntimeException {

    public TaskSourceException(String message) {
        super(message);
    }

    public TaskSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
