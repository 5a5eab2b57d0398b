package com.trading.opg.util;

import com.trading.opg.api.ExecutionListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans every callback out to the registered listeners, in registration order.
 * Listeners may be added while runs are in progress.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public void addForComposite(ExecutionListener listener) {
        listeners.add(listener);
    }

    public void removeFromComposite(ExecutionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onExecutionStart(long runId, int stageCount, int nodeCount) {
        for (ExecutionListener l : listeners)
            l.onExecutionStart(runId, stageCount, nodeCount);
    }

    @Override
    public void onStageStart(long runId, int stageIndex, List<String> nodeIds) {
        for (ExecutionListener l : listeners)
            l.onStageStart(runId, stageIndex, nodeIds);
    }

    @Override
    public void onAttemptStart(long runId, String nodeId, int attempt) {
        for (ExecutionListener l : listeners)
            l.onAttemptStart(runId, nodeId, attempt);
    }

    @Override
    public void onNodeSucceeded(long runId, String nodeId, int attempt, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeSucceeded(runId, nodeId, attempt, durationNanos);
    }

    @Override
    public void onNodeFailed(long runId, String nodeId, int attempt, Throwable error, boolean willRetry) {
        for (ExecutionListener l : listeners)
            l.onNodeFailed(runId, nodeId, attempt, error, willRetry);
    }

    @Override
    public void onExecutionEnd(long runId, int succeeded, boolean aborted, boolean cancelled) {
        for (ExecutionListener l : listeners)
            l.onExecutionEnd(runId, succeeded, aborted, cancelled);
    }
}
