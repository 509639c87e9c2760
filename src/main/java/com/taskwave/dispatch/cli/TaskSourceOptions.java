package com.taskwave.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.source.BeadsCliTaskSource;
import com.taskwave.core.source.JsonFileTaskSource;
import com.taskwave.core.source.TaskSource;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Mutually exclusive task input options shared by the planning commands.
 */
public class TaskSourceOptions {

    @Option(names = {"--input", "-i"}, required = true,
            description = "JSON file with task records (array, or object with a 'tasks' array)")
    Path input;

    @Option(names = "--beads", required = true,
            description = "Read open issues from the bd issue tracker CLI")
    boolean beads;

    TaskSource resolve(ObjectMapper objectMapper, BeadsCliTaskSource beadsSource) {
        if (beads) {
            return beadsSource;
        }
        return new JsonFileTaskSource(objectMapper, input);
    }
}
