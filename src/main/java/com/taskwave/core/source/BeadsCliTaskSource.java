package com.taskwave.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.config.BeadsProperties;
import com.taskwave.core.ingest.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads open issues from the {@code bd} (beads) issue tracker CLI.
 * <p>
 * {@code bd list --json} supplies the issues; dependency links come from
 * {@code bd show --json <id>} for each issue that is not closed. Parent-child links
 * describe epics, not ordering, and are ignored.
 */
@Component
public class BeadsCliTaskSource implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(BeadsCliTaskSource.class);
    static final String PARENT_CHILD = "parent-child";

    private final BeadsProperties properties;
    private final ObjectMapper objectMapper;
    private final CommandRunner runner;

    public BeadsCliTaskSource(BeadsProperties properties, ObjectMapper objectMapper, CommandRunner runner) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.runner = runner;
    }

    @Override
    public List<TaskRecord> load() {
        JsonNode issues = parse(run("list", "--json"), "bd list");
        if (!issues.isArray()) {
            throw new TaskSourceException("Unexpected 'bd list --json' output: expected an array");
        }

        var records = new ArrayList<TaskRecord>();
        for (JsonNode issue : issues) {
            String id = text(issue, "id");
            String status = text(issue, "status");
            if ("closed".equalsIgnoreCase(status)) {
                continue;
            }
            List<String> deps = List.of();
            if (id != null && !id.isBlank()) {
                JsonNode details = parse(run("show", "--json", id), "bd show " + id);
                if (details.isArray()) {
                    details = details.size() > 0 ? details.get(0) : objectMapper.createObjectNode();
                }
                deps = dependencies(details);
            }
            records.add(new TaskRecord(
                    id,
                    text(issue, "title"),
                    status,
                    text(issue, "issue_type"),
                    priority(issue),
                    text(issue, "description"),
                    deps));
        }
        log.info("Loaded {} open issues from beads", records.size());
        return records;
    }

    @Override
    public String describe() {
        return "beads (" + properties.getCommand() + ")";
    }

    static List<String> dependencies(JsonNode details) {
        var deps = new ArrayList<String>();
        JsonNode links = details.get("dependencies");
        if (links == null || !links.isArray()) {
            return deps;
        }
        for (JsonNode link : links) {
            if (link.isTextual()) {
                deps.add(link.asText());
                continue;
            }
            String depId = text(link, "id");
            if (depId != null && !PARENT_CHILD.equals(text(link, "dependency_type"))) {
                deps.add(depId);
            }
        }
        return deps;
    }

    private String run(String... args) {
        var command = new ArrayList<String>();
        command.add(properties.getCommand());
        command.addAll(List.of(args));
        return runner.run(command, properties.getTimeout());
    }

    private JsonNode parse(String output, String what) {
        try {
            JsonNode node = objectMapper.readTree(output);
            if (node == null || node.isMissingNode()) {
                throw new TaskSourceException("Empty output from " + what);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new TaskSourceException("Invalid JSON from " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Numeric priority, or null (lowest urgency downstream) when missing or not a number. */
    static Integer priority(JsonNode issue) {
        JsonNode value = issue.get("priority");
        if (value == null || !value.isNumber() || !value.canConvertToInt()) {
            if (value != null && !value.isNull()) {
                log.warn("Ignoring non-numeric priority {} of issue {}", value, text(issue, "id"));
            }
            return null;
        }
        return value.asInt();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
