package com.taskwave.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.config.ConfigurationException;
import com.taskwave.core.config.PlannerProperties;
import com.taskwave.core.engine.PlanningEngine;
import com.taskwave.core.graph.CycleDetectedException;
import com.taskwave.core.model.PlanningOptions;
import com.taskwave.core.model.PlanningResult;
import com.taskwave.core.plan.PlanJsonCodec;
import com.taskwave.core.source.BeadsCliTaskSource;
import com.taskwave.core.source.TaskSourceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: taskwave plan --input tasks.json [--strategy risk_first] [--no-conflicts]
 * <p>
 * Computes the execution plan and prints it as JSON (default) or as text.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Compute an execution plan")
@Component
public class PlanCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    TaskSourceOptions source;

    @Option(names = {"--strategy", "-s"},
            description = "Ordering strategy: topological, risk_first, foundational_first, parallel_maximizing")
    String strategy;

    @Option(names = "--no-conflicts", description = "Skip resource conflict detection")
    boolean noConflicts;

    @Option(names = {"--format", "-f"}, defaultValue = "json", description = "Output format: json or text")
    String format;

    private final PlanningEngine engine;
    private final PlanJsonCodec codec;
    private final PlannerProperties properties;
    private final ObjectMapper objectMapper;
    private final BeadsCliTaskSource beadsSource;

    public PlanCommand(PlanningEngine engine, PlanJsonCodec codec, PlannerProperties properties,
                       ObjectMapper objectMapper, BeadsCliTaskSource beadsSource) {
        this.engine = engine;
        this.codec = codec;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.beadsSource = beadsSource;
    }

    @Override
    public Integer call() {
        if (!"json".equalsIgnoreCase(format) && !"text".equalsIgnoreCase(format)) {
            ConsoleOutput.error("Invalid format: " + format + ". Valid formats: json, text");
            return ExitCodes.CONFIGURATION_ERROR;
        }

        PlanningResult result;
        try {
            result = engine.plan(source.resolve(objectMapper, beadsSource), options(strategy, noConflicts, properties));
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (CycleDetectedException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CYCLE_DETECTED;
        } catch (TaskSourceException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.SOURCE_ERROR;
        }

        if (result.hasWarnings()) {
            ConsoleOutput.warnings(result.skipped());
        }
        if (result.plan().totalTasks() == 0) {
            ConsoleOutput.error("No open tasks found.");
            return ExitCodes.NO_TASKS;
        }

        if ("text".equalsIgnoreCase(format)) {
            ConsoleOutput.plan(result.plan());
        } else {
            System.out.println(codec.write(result.plan()));
        }
        return ExitCodes.OK;
    }

    static PlanningOptions options(String strategy, boolean noConflicts, PlannerProperties properties) {
        String name = strategy != null ? strategy : properties.getDefaultStrategy();
        return new PlanningOptions(name, !noConflicts && properties.isDetectConflicts());
    }
}
