package com.trading.opg.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.opg.OpGraph;
import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.FatalExecutionException;
import com.trading.opg.engine.ExecutionSummary;
import com.trading.opg.engine.PlanExecutor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs executions in the background, one at a time, in submission order.
 * <p>
 * Producers (HTTP handlers, tests) publish {@link ExecutionRequestEvent}s into
 * a Disruptor ring buffer; a single daemon consumer thread takes them off and
 * drives {@link OpGraph#execute}. Since there is one consumer, two runs never
 * overlap and the worker pool of one run is never shared with another.
 * <p>
 * The most recent {@code historyLimit} runs stay queryable by id.
 */
public final class ExecutionDispatcher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ExecutionDispatcher.class);

    private final OpGraph graph;
    private final int historyLimit;
    private final Disruptor<ExecutionRequestEvent> disruptor;
    private final RingBuffer<ExecutionRequestEvent> ringBuffer;
    private final ConcurrentNavigableMap<Long, ExecutionRun> runs = new ConcurrentSkipListMap<>();

    public ExecutionDispatcher(OpGraph graph, int ringBufferSize, int historyLimit) {
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("Ring buffer size must be a power of 2: " + ringBufferSize);
        if (historyLimit < 1)
            throw new IllegalArgumentException("History limit must be >= 1: " + historyLimit);
        this.graph = graph;
        this.historyLimit = historyLimit;

        this.disruptor = new Disruptor<>(
                ExecutionRequestEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new RequestHandler());
        this.ringBuffer = disruptor.start();
        log.info("Execution dispatcher started (ring buffer {}, history {})", ringBufferSize, historyLimit);
    }

    public ExecutionDispatcher(OpGraph graph) {
        this(graph, 1024, 256);
    }

    /** Queues an execution with no input columns. */
    public ExecutionRun submit() {
        return submit(ColumnFrame.empty());
    }

    /**
     * Queues an execution. Blocks only if the ring buffer is full.
     */
    public ExecutionRun submit(ColumnFrame inputs) {
        ExecutionRun run = new ExecutionRun(PlanExecutor.nextRunId(), inputs.copy());
        runs.put(run.runId(), run);
        trimHistory();

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(run);
        } finally {
            ringBuffer.publish(sequence);
        }
        log.info("Execution {} queued", run.runId());
        return run;
    }

    /** The run with this id, or {@code null} if unknown or evicted. */
    public ExecutionRun status(long runId) {
        return runs.get(runId);
    }

    /**
     * Requests cancellation. A queued run is cancelled outright; a running one
     * stops after its current stage.
     *
     * @return {@code false} if the run is unknown or already finished
     */
    public boolean cancel(long runId) {
        ExecutionRun run = runs.get(runId);
        if (run == null)
            return false;
        synchronized (run) {
            if (run.status().isTerminal())
                return false;
            run.cancellation().cancel();
            if (run.status() == ExecutionStatus.QUEUED)
                run.cancelQueued();
        }
        log.info("Execution {} cancellation requested", runId);
        return true;
    }

    /** Read-only view of the retained runs, oldest first. */
    public Map<Long, ExecutionRun> history() {
        return Collections.unmodifiableMap(runs);
    }

    private void trimHistory() {
        while (runs.size() > historyLimit) {
            Map.Entry<Long, ExecutionRun> oldest = runs.firstEntry();
            if (oldest == null || !oldest.getValue().status().isTerminal())
                break;
            runs.remove(oldest.getKey());
        }
    }

    /**
     * Cancels whatever is pending, then waits for the consumer to drain.
     */
    @Override
    public void close() {
        for (ExecutionRun run : runs.values())
            cancel(run.runId());
        try {
            disruptor.shutdown(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Execution dispatcher did not drain in time, halting", e);
            disruptor.halt();
        }
        log.info("Execution dispatcher stopped");
    }

    /** Consumer side; runs on the single dispatcher thread. */
    private final class RequestHandler implements EventHandler<ExecutionRequestEvent> {
        @Override
        public void onEvent(ExecutionRequestEvent event, long sequence, boolean endOfBatch) {
            ExecutionRun run = event.run();
            event.clear();
            if (run == null)
                return;

            synchronized (run) {
                if (run.status() != ExecutionStatus.QUEUED) {
                    log.debug("Execution {} skipped, status {}", run.runId(), run.status());
                    return;
                }
                run.markRunning();
            }

            try {
                ExecutionSummary summary = graph.execute(run.runId(), run.inputs(), run.cancellation());
                run.complete(summary);
            } catch (FatalExecutionException e) {
                run.fail(e.nodeId(), e);
            } catch (CancellationException e) {
                log.warn("Execution {} interrupted", run.runId());
                run.fail(null, e);
            } catch (RuntimeException e) {
                // resolver or snapshot errors; the consumer thread must survive them
                log.error("Execution {} failed before any node ran", run.runId(), e);
                run.fail(null, e);
            }
        }
    }
}
