package com.trading.opg.engine;

import com.trading.opg.api.NodeOutcome;
import com.trading.opg.api.NodeState;

import java.util.List;
import java.util.Map;

/**
 * Result of a run that was not aborted.
 *
 * @param runId         identifier of the run
 * @param stages        the plan that was executed
 * @param outcomes      per-node outcome, in stage order
 * @param cancelled     {@code true} if the cancellation signal stopped the run
 *                      early; nodes that never started are {@code PENDING}
 * @param durationNanos wall time of the run
 */
public record ExecutionSummary(long runId, List<List<String>> stages, Map<String, NodeOutcome> outcomes,
        boolean cancelled, long durationNanos) {

    public NodeOutcome outcome(String nodeId) {
        NodeOutcome o = outcomes.get(nodeId);
        if (o == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return o;
    }

    /** Output series of a succeeded node, or {@code null}. */
    public double[] result(String nodeId) {
        return outcome(nodeId).result();
    }

    public long count(NodeState state) {
        return outcomes.values().stream().filter(o -> o.state() == state).count();
    }

    /** {@code true} if every node succeeded. */
    public boolean isComplete() {
        return count(NodeState.SUCCEEDED) == outcomes.size();
    }
}
