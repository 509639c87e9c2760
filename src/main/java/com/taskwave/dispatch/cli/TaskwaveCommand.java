package com.taskwave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskwave.
 * Routes to subcommands: plan, next.
 */
@Command(
        name = "taskwave",
        mixinStandardHelpOptions = true,
        version = "Taskwave 0.1.0",
        description = "Dependency and conflict aware execution planner for tracker tasks",
        subcommands = {
                PlanCommand.class,
                NextCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskwaveCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
