package com.taskwave.dispatch.cli;

import com.taskwave.core.model.ExecutionGroup;
import com.taskwave.core.model.ExecutionPlan;
import com.taskwave.core.model.SkippedRecord;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Taskwave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    /** Errors go to stderr so stdout stays machine-readable. */
    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warnings(List<SkippedRecord> skipped) {
        for (var record : skipped) {
            System.err.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) ! skipped|@ " + record));
        }
    }

    public static void plan(ExecutionPlan plan) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Execution Plan: " + plan.strategy().toUpperCase() + " strategy|@"));
        System.out.println("──────────────────────────────────");
        System.out.println("  Total tasks:           " + plan.totalTasks());
        System.out.println("  Total groups:          " + plan.totalGroups());
        System.out.println("  Parallelizable groups: " + plan.parallelizableGroups());
        System.out.println("  Critical path length:  " + plan.criticalPathLength());
        System.out.println("──────────────────────────────────");
        System.out.println(plan.rationale());
    }

    public static void group(ExecutionGroup group) {
        String header = group.isParallel()
                ? "@|bold,fg(yellow) " + group.marker() + "|@ " + group.size() + " parallel tasks"
                : "@|bold,fg(yellow) " + group.marker() + "|@ sequential task";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(header));
        for (String id : group.taskIds()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(blue) -|@ " + id));
        }
    }
}
