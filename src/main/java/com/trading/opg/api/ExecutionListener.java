package com.trading.opg.api;

import java.util.List;

/**
 * Observability hook for plan execution.
 *
 * <p>
 * All callbacks are made from the thread coordinating the run, never from a
 * worker, so implementations need no synchronization of their own against the
 * executor. They should still be cheap: a slow listener delays the barrier
 * between stages.
 */
public interface ExecutionListener {

    /** Called once before the first stage. */
    default void onExecutionStart(long runId, int stageCount, int nodeCount) {
    }

    /** Called before any node of the stage is submitted. */
    default void onStageStart(long runId, int stageIndex, List<String> nodeIds) {
    }

    /** Called when an attempt is handed to the worker pool. */
    default void onAttemptStart(long runId, String nodeId, int attempt) {
    }

    default void onNodeSucceeded(long runId, String nodeId, int attempt, long durationNanos) {
    }

    /**
     * @param willRetry {@code true} if the node has been resubmitted
     */
    default void onNodeFailed(long runId, String nodeId, int attempt, Throwable error, boolean willRetry) {
    }

    /**
     * Called once when the run ends, on every exit path.
     *
     * @param succeeded number of nodes that reached {@code SUCCEEDED}
     * @param aborted   {@code true} if a node exhausted its retry budget
     * @param cancelled {@code true} if the cancellation signal stopped the run
     */
    default void onExecutionEnd(long runId, int succeeded, boolean aborted, boolean cancelled) {
    }
}
