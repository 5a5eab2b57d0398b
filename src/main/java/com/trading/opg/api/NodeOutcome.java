package com.trading.opg.api;

/**
 * What a run recorded for one node.
 *
 * @param nodeId    the node
 * @param state     final state; {@code PENDING} if the node never started
 * @param attempts  attempts actually made
 * @param result    output series on success, otherwise {@code null}; copied
 *                  on the way in and out
 * @param lastError error of the last failed attempt, or {@code null}
 */
public record NodeOutcome(String nodeId, NodeState state, int attempts, double[] result, Throwable lastError) {

    public NodeOutcome {
        result = result == null ? null : result.clone();
    }

    @Override
    public double[] result() {
        return result == null ? null : result.clone();
    }

    public boolean succeeded() {
        return state == NodeState.SUCCEEDED;
    }
}
