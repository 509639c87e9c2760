package com.taskwave.core.model;

/**
 * Why a ready set or execution group was formed. Feeds the plan rationale only.
 */
public enum GroupReason {
    DEPENDENCIES_SATISFIED("dependencies satisfied"),
    PRIORITY_CLASS("most urgent priority class ready"),
    FOUNDATIONAL("foundational work first"),
    FOUNDATIONAL_PREREQUISITE("unblocks pending foundational work"),
    MERGED_INDEPENDENT("merged independent batches"),
    CONFLICT_SPLIT("split to avoid shared resources");

    private final String description;

    GroupReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
