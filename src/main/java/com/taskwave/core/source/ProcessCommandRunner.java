package com.taskwave.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Standard error is logged at debug.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public String run(List<String> command, Duration timeout) {
        log.debug("Running: {}", String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new TaskSourceException("Failed to start command: " + String.join(" ", command), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process, false));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process, true));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TaskSourceException("Command timed out after " + timeout.toSeconds() + "s: "
                        + String.join(" ", command));
            }
            String errors = stderr.get();
            if (!errors.isBlank()) {
                log.debug("{} stderr: {}", command.get(0), errors);
            }
            if (process.exitValue() != 0) {
                throw new TaskSourceException("Command exited with code " + process.exitValue() + ": "
                        + String.join(" ", command) + (errors.isBlank() ? "" : " (" + errors.trim() + ")"));
            }
            return stdout.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new TaskSourceException("Interrupted while running " + String.join(" ", command), e);
        } catch (ExecutionException e) {
            throw new TaskSourceException("Failed to read output of " + String.join(" ", command), e.getCause());
        }
    }

    private static String drain(Process process, boolean errorStream) {
        var stream = errorStream ? process.getErrorStream() : process.getInputStream();
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new TaskSourceException("Failed to read process output", e);
        }
    }
}
