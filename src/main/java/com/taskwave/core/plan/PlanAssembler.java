package com.taskwave.core.plan;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.ExecutionGroup;
import com.taskwave.core.model.ExecutionPlan;
import com.taskwave.core.model.GroupKind;
import com.taskwave.core.model.Priority;
import com.taskwave.core.model.ReadySet;
import com.taskwave.core.model.Task;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the final batches into an {@link ExecutionPlan} with statistics and rationale.
 * <p>
 * Each group is one synchronization point, so the critical path length is the number
 * of groups.
 */
@Service
public class PlanAssembler {

    public ExecutionPlan assemble(String strategy, boolean detectConflicts,
                                  List<ReadySet> batches, DependencyGraph graph) {
        var groups = new ArrayList<ExecutionGroup>();
        for (var batch : batches) {
            groups.add(new ExecutionGroup(groups.size() + 1, GroupKind.forSize(batch.size()),
                    batch.taskIds(), batch.reason()));
        }

        int totalTasks = groups.stream().mapToInt(ExecutionGroup::size).sum();
        int parallel = (int) groups.stream().filter(ExecutionGroup::isParallel).count();
        String rationale = rationale(strategy, detectConflicts, groups, graph);

        return new ExecutionPlan(strategy, detectConflicts, totalTasks, groups.size(), parallel,
                groups.size(), groups, rationale);
    }

    String rationale(String strategy, boolean detectConflicts, List<ExecutionGroup> groups,
                     DependencyGraph graph) {
        var lines = new ArrayList<String>();
        lines.add("Strategy: " + strategy);
        lines.add("Conflict detection: " + (detectConflicts ? "enabled" : "disabled"));
        lines.add("");

        if (groups.isEmpty()) {
            lines.add("No open tasks to schedule.");
            return String.join("\n", lines);
        }

        for (var group : groups) {
            String why = group.reason().description();
            if (group.isParallel()) {
                lines.add("Group " + group.index() + ": " + group.marker() + " " + group.size()
                        + " parallel tasks - " + why);
                for (String id : group.taskIds()) {
                    lines.add("  - " + describe(graph.task(id)));
                }
            } else {
                lines.add("Group " + group.index() + ": " + describe(graph.task(group.taskIds().get(0)))
                        + " - sequential, " + why);
            }
        }
        return String.join("\n", lines);
    }

    private static String describe(Task task) {
        return "[" + task.id() + "] " + task.title() + " (" + Priority.label(task.priority()) + ")";
    }
}
