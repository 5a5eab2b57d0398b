package com.trading.opg.wiring;

import com.trading.opg.api.CancellationSignal;
import com.trading.opg.api.ColumnFrame;
import com.trading.opg.engine.ExecutionSummary;

import java.util.concurrent.CompletableFuture;

/**
 * Ticket for one execution handed to the {@link ExecutionDispatcher}.
 * <p>
 * The status is written only by the dispatcher's consumer thread (and by
 * {@link ExecutionDispatcher#cancel} while the run is still queued); callers
 * read it or wait on {@link #future()}.
 */
public final class ExecutionRun {
    private final long runId;
    private final ColumnFrame inputs;
    private final long submittedAtMillis;
    private final CancellationSignal cancellation = CancellationSignal.create();
    private final CompletableFuture<ExecutionSummary> future = new CompletableFuture<>();

    private volatile ExecutionStatus status = ExecutionStatus.QUEUED;
    private volatile String error;
    private volatile String failedNode;
    private volatile long finishedAtMillis;

    ExecutionRun(long runId, ColumnFrame inputs) {
        this.runId = runId;
        this.inputs = inputs;
        this.submittedAtMillis = System.currentTimeMillis();
    }

    public long runId() {
        return runId;
    }

    public ExecutionStatus status() {
        return status;
    }

    /** Message of the error that ended the run, or {@code null}. */
    public String error() {
        return error;
    }

    /** Node whose retry budget ran out, or {@code null}. */
    public String failedNode() {
        return failedNode;
    }

    public long submittedAtMillis() {
        return submittedAtMillis;
    }

    /** Zero until the run reaches a terminal status. */
    public long finishedAtMillis() {
        return finishedAtMillis;
    }

    /**
     * Completes with the summary, or exceptionally with the error that aborted
     * the run.
     */
    public CompletableFuture<ExecutionSummary> future() {
        return future;
    }

    ColumnFrame inputs() {
        return inputs;
    }

    CancellationSignal cancellation() {
        return cancellation;
    }

    void markRunning() {
        status = ExecutionStatus.RUNNING;
    }

    void complete(ExecutionSummary summary) {
        finishedAtMillis = System.currentTimeMillis();
        status = summary.cancelled() ? ExecutionStatus.CANCELLED : ExecutionStatus.SUCCEEDED;
        future.complete(summary);
    }

    void fail(String nodeId, Throwable t) {
        finishedAtMillis = System.currentTimeMillis();
        failedNode = nodeId;
        error = t.getMessage();
        status = ExecutionStatus.FAILED;
        future.completeExceptionally(t);
    }

    void cancelQueued() {
        finishedAtMillis = System.currentTimeMillis();
        status = ExecutionStatus.CANCELLED;
        future.cancel(false);
    }

    @Override
    public String toString() {
        return "ExecutionRun[" + runId + ", " + status + "]";
    }
}
