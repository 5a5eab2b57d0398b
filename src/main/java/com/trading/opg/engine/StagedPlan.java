package com.trading.opg.engine;

import com.trading.opg.graph.GraphSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution order derived from a {@link GraphSnapshot}: a sequence of stages,
 * each a list of node ids with no dependency among them.
 *
 * Every predecessor of a node sits in an earlier stage. Immutable; built by
 * {@link DependencyResolver} for a single execution.
 */
public final class StagedPlan {
    private final GraphSnapshot snapshot;
    private final List<List<String>> stages;
    private final Map<String, Integer> stageIndex;

    StagedPlan(GraphSnapshot snapshot, List<List<String>> stages) {
        this.snapshot = snapshot;
        List<List<String>> frozen = new ArrayList<>(stages.size());
        Map<String, Integer> index = new HashMap<>(snapshot.nodeCount() * 2);
        for (int s = 0; s < stages.size(); s++) {
            frozen.add(List.copyOf(stages.get(s)));
            for (String id : stages.get(s))
                index.put(id, s);
        }
        this.stages = Collections.unmodifiableList(frozen);
        this.stageIndex = Collections.unmodifiableMap(index);
    }

    public GraphSnapshot snapshot() {
        return snapshot;
    }

    public List<List<String>> stages() {
        return stages;
    }

    public List<String> stage(int i) {
        return stages.get(i);
    }

    public int stageCount() {
        return stages.size();
    }

    public int nodeCount() {
        return stageIndex.size();
    }

    /**
     * @throws IllegalArgumentException if the node is not part of the plan
     */
    public int stageOf(String nodeId) {
        Integer s = stageIndex.get(nodeId);
        if (s == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return s;
    }

    @Override
    public String toString() {
        return "StagedPlan" + stages;
    }
}
