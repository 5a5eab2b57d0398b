package com.trading.opg.api;

import java.util.Map;

/**
 * A run was aborted because a node exhausted its retry budget. Outcomes of
 * nodes that completed before the abort are kept in {@link #outcomes()};
 * nothing is rolled back.
 */
public final class FatalExecutionException extends GraphException {
    private final long runId;
    private final String nodeId;
    private final Map<String, NodeOutcome> outcomes;

    public FatalExecutionException(long runId, String nodeId, NodeExecutionException cause,
            Map<String, NodeOutcome> outcomes) {
        super("Execution " + runId + " aborted: " + cause.getMessage(), cause);
        this.runId = runId;
        this.nodeId = nodeId;
        this.outcomes = outcomes;
    }

    public long runId() {
        return runId;
    }

    /** The node whose retry budget ran out. */
    public String nodeId() {
        return nodeId;
    }

    public Map<String, NodeOutcome> outcomes() {
        return outcomes;
    }

    @Override
    public synchronized NodeExecutionException getCause() {
        return (NodeExecutionException) super.getCause();
    }
}
