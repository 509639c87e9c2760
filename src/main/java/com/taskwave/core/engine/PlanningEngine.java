package com.taskwave.core.engine;

import com.taskwave.core.config.ConfigurationException;
import com.taskwave.core.conflict.ConflictDetector;
import com.taskwave.core.conflict.ConflictIndex;
import com.taskwave.core.conflict.GroupSplitter;
import com.taskwave.core.graph.CycleDetectedException;
import com.taskwave.core.graph.DependencyGraphBuilder;
import com.taskwave.core.graph.TopologicalSorter;
import com.taskwave.core.ingest.TaskIngestor;
import com.taskwave.core.ingest.TaskRecord;
import com.taskwave.core.logging.MdcContext;
import com.taskwave.core.metrics.PlanningMetrics;
import com.taskwave.core.model.ExecutionPlan;
import com.taskwave.core.model.PlanningOptions;
import com.taskwave.core.model.PlanningResult;
import com.taskwave.core.model.ReadySet;
import com.taskwave.core.plan.PlanAssembler;
import com.taskwave.core.source.TaskSource;
import com.taskwave.core.strategy.FoundationalHeuristic;
import com.taskwave.core.strategy.OrderingStrategy;
import com.taskwave.core.strategy.StrategyContext;
import com.taskwave.core.strategy.StrategySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the planning pipeline: ingest, build graph, layer, reorder, split, assemble.
 * <p>
 * Each call owns its graph, ready sets and plan; nothing is shared between calls, and
 * identical input yields an identical plan. The strategy name is validated before any
 * record is looked at.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);
    private static final AtomicInteger PLAN_COUNTER = new AtomicInteger(0);

    private final TaskIngestor ingestor;
    private final DependencyGraphBuilder graphBuilder;
    private final TopologicalSorter sorter;
    private final StrategySelector strategies;
    private final FoundationalHeuristic foundational;
    private final ConflictDetector conflictDetector;
    private final GroupSplitter splitter;
    private final PlanAssembler assembler;
    private final PlanningMetrics metrics;

    public PlanningEngine(TaskIngestor ingestor,
                          DependencyGraphBuilder graphBuilder,
                          TopologicalSorter sorter,
                          StrategySelector strategies,
                          FoundationalHeuristic foundational,
                          ConflictDetector conflictDetector,
                          GroupSplitter splitter,
                          PlanAssembler assembler,
                          PlanningMetrics metrics) {
        this.ingestor = ingestor;
        this.graphBuilder = graphBuilder;
        this.sorter = sorter;
        this.strategies = strategies;
        this.foundational = foundational;
        this.conflictDetector = conflictDetector;
        this.splitter = splitter;
        this.assembler = assembler;
        this.metrics = metrics;
    }

    public PlanningResult plan(TaskSource source, PlanningOptions options) {
        // Reject a bad strategy before touching the tracker.
        strategies.resolve(options.strategy());
        log.info("Loading tasks from {}", source.describe());
        return plan(source.load(), options);
    }

    /**
     * Computes an execution plan for the given tracker records.
     *
     * @throws ConfigurationException if the strategy name is unknown
     * @throws CycleDetectedException if the open tasks contain a dependency cycle
     */
    public PlanningResult plan(List<TaskRecord> records, PlanningOptions options) {
        String planId = "PLAN-" + PLAN_COUNTER.incrementAndGet();
        String strategyName = options.strategy() == null ? "" : options.strategy();
        long start = System.currentTimeMillis();
        MdcContext.setPlan(planId, strategyName);
        try {
            OrderingStrategy strategy;
            try {
                strategy = strategies.resolve(strategyName);
            } catch (ConfigurationException e) {
                metrics.recordPlanOutcome(strategyName, "configuration_error");
                throw e;
            }
            String wireName = strategy.type().wireName();

            var ingested = ingestor.ingest(records);
            metrics.recordSkippedRecords(ingested.skipped().size());

            var graph = graphBuilder.build(ingested.tasks());
            List<ReadySet> layers;
            try {
                layers = sorter.sort(graph);
            } catch (CycleDetectedException e) {
                metrics.recordPlanOutcome(wireName, "cycle");
                throw e;
            }
            log.debug("Topological layers: {}", layers.size());

            var context = new StrategyContext(graph, foundational);
            var ordered = strategies.reorder(strategy, layers, context);

            List<ReadySet> batches = ordered;
            if (options.detectConflicts()) {
                ConflictIndex index = conflictDetector.index(graph);
                batches = new ArrayList<>();
                for (var set : ordered) {
                    var split = splitter.split(set, index);
                    if (split.size() > 1) {
                        metrics.recordConflictSplit(split.size() - 1);
                    }
                    batches.addAll(split);
                }
                batches = strategies.consolidate(strategy, batches, context, index);
            } else {
                batches = strategies.consolidate(strategy, batches, context, ConflictIndex.none());
            }

            ExecutionPlan plan = assembler.assemble(wireName, options.detectConflicts(), batches, graph);
            plan.groups().forEach(g -> metrics.recordGroupSize(g.size()));
            metrics.recordPlanOutcome(wireName, "planned");

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordPlanningDuration(wireName, elapsed);
            log.info("Planned {} tasks into {} groups ({} parallel) with strategy {} in {}ms",
                    plan.totalTasks(), plan.totalGroups(), plan.parallelizableGroups(), wireName, elapsed);
            return new PlanningResult(plan, ingested.skipped(), ingested.closedRecords());
        } finally {
            MdcContext.clear();
        }
    }
}
