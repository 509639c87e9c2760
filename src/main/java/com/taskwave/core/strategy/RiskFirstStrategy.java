package com.taskwave.core.strategy;

import com.taskwave.core.model.DependencyGraph;
import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Schedules the most urgent priority class first.
 * <p>
 * At every step only the ready tasks of the lowest priority number are emitted; less
 * urgent ready tasks wait for the next step, where urgent tasks unblocked in the
 * meantime compete with them again. Dependencies always win over priority: a P0 task
 * behind a P2 task still waits for it.
 */
@Component
public class RiskFirstStrategy implements OrderingStrategy {

    private static final Logger log = LoggerFactory.getLogger(RiskFirstStrategy.class);

    @Override
    public StrategyType type() {
        return StrategyType.RISK_FIRST;
    }

    @Override
    public List<ReadySet> reorder(List<ReadySet> readySets, StrategyContext context) {
        DependencyGraph graph = context.graph();
        var tracker = new ReadyTracker(graph, readySets.stream().flatMap(s -> s.taskIds().stream()).toList());
        var result = new ArrayList<ReadySet>();

        while (tracker.hasRemaining()) {
            var ready = tracker.ready();
            int urgent = ready.stream().mapToInt(id -> graph.task(id).priority()).min()
                    .orElseThrow(() -> new IllegalStateException("No ready task among " + tracker.remaining()));
            var batch = ready.stream().filter(id -> graph.task(id).priority() == urgent).toList();
            log.debug("  P{} batch: {} (deferred: {})", urgent, batch, ready.size() - batch.size());
            tracker.emit(batch);
            result.add(new ReadySet(batch, GroupReason.PRIORITY_CLASS));
        }
        return result;
    }
}
