package com.taskwave.core.model;

/**
 * Warning for an inbound record that was left out of planning.
 *
 * @param index  position of the record in the supplied list
 * @param id     the record's ID, or null when it had none
 * @param reason why it was skipped
 */
public record SkippedRecord(int index, String id, String reason) {

    @Override
    public String toString() {
        return "record #" + index + (id != null ? " (" + id + ")" : "") + ": " + reason;
    }
}
