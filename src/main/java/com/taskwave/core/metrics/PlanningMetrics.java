package com.taskwave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning runs.
 */
@Service
public class PlanningMetrics {

    private final MeterRegistry registry;

    public PlanningMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(String strategy, long ms) {
        Timer.builder("taskwave.planning.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "planned", "cycle" or "configuration_error"
     */
    public void recordPlanOutcome(String strategy, String outcome) {
        Counter.builder("taskwave.plans.total")
                .tag("strategy", strategy)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSkippedRecords(int count) {
        if (count <= 0) return;
        Counter.builder("taskwave.ingest.skipped_records")
                .description("Tracker records skipped as malformed or duplicate")
                .register(registry)
                .increment(count);
    }

    /**
     * Records a ready set that had to be split because members share a resource.
     *
     * @param extraGroups synchronization points added by the split
     */
    public void recordConflictSplit(int extraGroups) {
        Counter.builder("taskwave.conflicts.splits")
                .description("Ready sets split on shared resources")
                .register(registry)
                .increment();
        DistributionSummary.builder("taskwave.conflicts.extra_groups")
                .description("Groups added per conflict split")
                .register(registry)
                .record(extraGroups);
    }

    public void recordGroupSize(int size) {
        DistributionSummary.builder("taskwave.plan.group_size")
                .description("Number of tasks per execution group")
                .register(registry)
                .record(size);
    }
}
