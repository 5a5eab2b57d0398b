package com.trading.opg.engine;

import com.trading.opg.api.NodeOutcome;
import com.trading.opg.api.NodeState;
import com.trading.opg.graph.OperationNode;

/**
 * Retry bookkeeping of one node within one run.
 *
 * <pre>
 * PENDING -> RUNNING -> SUCCEEDED
 *                    -> FAILED
 *                    -> PENDING   (failure with attempts left, resubmitted)
 * </pre>
 *
 * Confined to the coordinating thread of {@link PlanExecutor}; workers never
 * see it.
 */
final class NodeRun {
    private final OperationNode node;
    private int attemptsRemaining;
    private int attempts;
    private NodeState state = NodeState.PENDING;
    private double[] result;
    private Throwable lastError;

    NodeRun(OperationNode node, int budget) {
        this.node = node;
        this.attemptsRemaining = budget;
    }

    OperationNode node() {
        return node;
    }

    /** PENDING -> RUNNING; consumes one attempt. */
    int start() {
        if (state != NodeState.PENDING)
            throw new IllegalStateException("Node " + node.id() + " cannot start from " + state);
        if (attemptsRemaining <= 0)
            throw new IllegalStateException("Node " + node.id() + " has no attempts left");
        state = NodeState.RUNNING;
        attemptsRemaining--;
        return ++attempts;
    }

    void succeed(double[] output) {
        expectRunning();
        state = NodeState.SUCCEEDED;
        result = output;
        lastError = null;
    }

    /**
     * RUNNING -> PENDING if {@code retry} and attempts remain, else FAILED.
     *
     * @return {@code true} if the node went back to PENDING
     */
    boolean fail(Throwable error, boolean retry) {
        expectRunning();
        lastError = error;
        if (retry && attemptsRemaining > 0) {
            state = NodeState.PENDING;
            return true;
        }
        state = NodeState.FAILED;
        return false;
    }

    boolean hasAttemptsLeft() {
        return attemptsRemaining > 0;
    }

    int attempts() {
        return attempts;
    }

    int attemptsRemaining() {
        return attemptsRemaining;
    }

    NodeState state() {
        return state;
    }

    NodeOutcome toOutcome() {
        return new NodeOutcome(node.id(), state, attempts, result, lastError);
    }

    private void expectRunning() {
        if (state != NodeState.RUNNING)
            throw new IllegalStateException("Node " + node.id() + " is " + state + ", expected RUNNING");
    }
}
