package com.taskwave.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SEQUENTIAL groups hold exactly one task; PARALLEL groups hold several.
 */
public enum GroupKind {
    SEQUENTIAL,
    PARALLEL;

    public static GroupKind forSize(int size) {
        return size > 1 ? PARALLEL : SEQUENTIAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
