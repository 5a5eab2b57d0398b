package com.trading.opg.util;

import com.trading.opg.api.ExecutionListener;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates attempt counts and timings per node across runs. */
public class NodeProfileListener implements ExecutionListener {

    public static class NodeStats {
        public final String nodeId;
        public long successes;
        public long failures;
        public long retries;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        public NodeStats(String nodeId) {
            this.nodeId = nodeId;
        }

        synchronized void success(long duration) {
            successes++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void failure(boolean retried) {
            failures++;
            if (retried)
                retries++;
        }

        public synchronized double avgMicros() {
            return successes == 0 ? 0 : totalDurationNanos / (double) successes / 1000.0;
        }
    }

    private final Map<String, NodeStats> stats = new ConcurrentHashMap<>();

    /** Live view keyed by node id. */
    public Map<String, NodeStats> stats() {
        return stats;
    }

    @Override
    public void onNodeSucceeded(long runId, String nodeId, int attempt, long durationNanos) {
        stats.computeIfAbsent(nodeId, NodeStats::new).success(durationNanos);
    }

    @Override
    public void onNodeFailed(long runId, String nodeId, int attempt, Throwable error, boolean willRetry) {
        stats.computeIfAbsent(nodeId, NodeStats::new).failure(willRetry);
    }

    public void reset() {
        stats.clear();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder(256);
        sb.append(String.format("%-20s %8s %8s %8s %12s%n", "node", "ok", "failed", "retried", "avg(us)"));
        stats.values().stream()
                .sorted((a, b) -> a.nodeId.compareTo(b.nodeId))
                .forEach(s -> sb.append(String.format("%-20s %8d %8d %8d %12.1f%n",
                        s.nodeId, s.successes, s.failures, s.retries, s.avgMicros())));
        return sb.toString();
    }
}
