package com.taskwave.core.source;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external command and returns its standard output.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws TaskSourceException if the command cannot start, times out, or exits non-zero
     */
    String run(List<String> command, Duration timeout);
}
