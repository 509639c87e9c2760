package com.taskwave.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwave.core.config.ConfigurationException;
import com.taskwave.core.config.PlannerProperties;
import com.taskwave.core.engine.PlanningEngine;
import com.taskwave.core.graph.CycleDetectedException;
import com.taskwave.core.model.PlanningResult;
import com.taskwave.core.source.BeadsCliTaskSource;
import com.taskwave.core.source.TaskSourceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskwave next --input tasks.json --completed A,B
 * <p>
 * Plans the tasks and prints the group to dispatch next, leaving out completed tasks.
 */
@Command(name = "next", mixinStandardHelpOptions = true, description = "Show the next group to dispatch")
@Component
public class NextCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    TaskSourceOptions source;

    @Option(names = {"--strategy", "-s"},
            description = "Ordering strategy: topological, risk_first, foundational_first, parallel_maximizing")
    String strategy;

    @Option(names = "--no-conflicts", description = "Skip resource conflict detection")
    boolean noConflicts;

    @Option(names = {"--completed", "-c"}, split = ",", description = "IDs of tasks already completed")
    List<String> completed = List.of();

    private final PlanningEngine engine;
    private final PlannerProperties properties;
    private final ObjectMapper objectMapper;
    private final BeadsCliTaskSource beadsSource;

    public NextCommand(PlanningEngine engine, PlannerProperties properties,
                       ObjectMapper objectMapper, BeadsCliTaskSource beadsSource) {
        this.engine = engine;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.beadsSource = beadsSource;
    }

    @Override
    public Integer call() {
        PlanningResult result;
        try {
            result = engine.plan(source.resolve(objectMapper, beadsSource),
                    PlanCommand.options(strategy, noConflicts, properties));
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
        var next = result.plan().nextGroup(new LinkedHashSet<>(completed));
        if (next.isEmpty()) {
            ConsoleOutput.success("All tasks complete.");
            return ExitCodes.OK;
        }
        ConsoleOutput.group(next.get());
        return ExitCodes.OK;
    }
}
