package com.taskwave.core.conflict;

import com.taskwave.core.model.GroupReason;
import com.taskwave.core.model.ReadySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Splits a ready set into conflict-free batches by greedy graph coloring.
 * <p>
 * Tasks are colored in the set's order with the lowest color not used by a
 * conflicting neighbour; each color becomes one batch, in color order. The result
 * is not necessarily minimal, but no two conflicting tasks ever share a batch.
 */
@Service
public class GroupSplitter {

    private static final Logger log = LoggerFactory.getLogger(GroupSplitter.class);

    private final ConflictDetector detector;

    public GroupSplitter(ConflictDetector detector) {
        this.detector = detector;
    }

    public List<ReadySet> split(ReadySet set, ConflictIndex index) {
        if (set.size() < 2) {
            return List.of(set);
        }
        var conflicts = detector.conflictGraph(set.taskIds(), index);
        if (conflicts.values().stream().allMatch(java.util.Set::isEmpty)) {
            return List.of(set);
        }

        Map<String, Integer> colors = new HashMap<>();
        var buckets = new ArrayList<List<String>>();
        for (String id : set.taskIds()) {
            var used = new HashSet<Integer>();
            for (String neighbour : conflicts.get(id)) {
                Integer c = colors.get(neighbour);
                if (c != null) used.add(c);
            }
            int color = 0;
            while (used.contains(color)) color++;
            colors.put(id, color);
            if (color == buckets.size()) {
                buckets.add(new ArrayList<>());
            }
            buckets.get(color).add(id);
        }

        log.info("Conflict split: {} tasks into {} groups {}", set.size(), buckets.size(), buckets);
        return buckets.stream()
                .map(bucket -> new ReadySet(bucket, GroupReason.CONFLICT_SPLIT))
                .toList();
    }
}
