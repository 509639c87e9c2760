package com.taskwave.core.ingest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw task record as supplied by the issue tracker. Every field may be missing;
 * {@link TaskIngestor} validates and fills in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRecord(
    String id,
    String title,
    String status,
    @JsonAlias("issue_type") String type,
    Integer priority,
    String description,
    @JsonProperty("depends_on") @JsonAlias("dependsOn") List<String> dependsOn
) {
}
