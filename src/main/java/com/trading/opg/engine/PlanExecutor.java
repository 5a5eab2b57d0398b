package com.trading.opg.engine;

import com.trading.opg.api.CancellationSignal;
import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.ExecutionListener;
import com.trading.opg.api.FatalExecutionException;
import com.trading.opg.api.NodeExecutionException;
import com.trading.opg.api.NodeOutcome;
import com.trading.opg.api.NodeState;
import com.trading.opg.graph.OperationNode;
import com.trading.opg.registry.OperationRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a {@link StagedPlan} on a bounded worker pool.
 *
 * <h3>Barrier</h3>
 * Stages run strictly in plan order. All nodes of a stage are submitted at
 * once; the next stage starts only when every attempt of the current one,
 * retries included, has reached an outcome.
 *
 * <h3>Retry</h3>
 * Each node gets {@link ExecutionConfig#getRetryBudget()} attempts. A failed
 * attempt with budget left is resubmitted inside the same stage. The first
 * node to run out of attempts aborts the run: in-flight siblings finish but are
 * not retried, no later stage starts, and {@link FatalExecutionException} is
 * thrown once the stage has drained. Nothing already succeeded is rolled back.
 *
 * <h3>Cancellation</h3>
 * A raised {@link CancellationSignal} stops new stages and new retries; the
 * run then returns normally with {@link ExecutionSummary#cancelled()} set.
 *
 * <h3>Data</h3>
 * Each attempt gets the run's {@link ColumnFrame}. A successful node's output
 * is published under its id, so later stages can reference it as a column.
 *
 * <p>
 * All bookkeeping happens on the calling thread; workers only evaluate units.
 */
public final class PlanExecutor {
    private static final Logger log = LogManager.getLogger(PlanExecutor.class);
    private static final AtomicLong RUN_IDS = new AtomicLong();

    private final OperationRegistry registry;
    private final ExecutionConfig config;
    private final ExecutionListener listener;

    public PlanExecutor(OperationRegistry registry, ExecutionConfig config, ExecutionListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener != null ? listener : new ExecutionListener() {
        };
    }

    public PlanExecutor(OperationRegistry registry, ExecutionConfig config) {
        this(registry, config, null);
    }

    /** Allocates a process-wide run id. */
    public static long nextRunId() {
        return RUN_IDS.incrementAndGet();
    }

    public ExecutionSummary run(StagedPlan plan, ColumnFrame inputs) {
        return run(nextRunId(), plan, inputs, CancellationSignal.create());
    }

    /**
     * Executes the plan.
     *
     * @throws FatalExecutionException if a node exhausted its retry budget
     * @throws CancellationException   if the calling thread is interrupted
     */
    public ExecutionSummary run(long runId, StagedPlan plan, ColumnFrame inputs, CancellationSignal cancellation) {
        long start = System.nanoTime();
        ColumnFrame frame = inputs.copy();
        Map<String, NodeRun> runs = new LinkedHashMap<>(plan.nodeCount() * 2);
        for (List<String> stage : plan.stages())
            for (String id : stage)
                runs.put(id, new NodeRun(plan.snapshot().node(id), config.getRetryBudget()));

        log.info("Execution {} started: {} node(s) in {} stage(s), {} worker(s), budget {}",
                runId, runs.size(), plan.stageCount(), config.getConcurrency(), config.getRetryBudget());
        listener.onExecutionStart(runId, plan.stageCount(), runs.size());

        StageRun failure = null;
        boolean cancelled = false;
        try (WorkerPool<Attempt> pool = new WorkerPool<>(config.getConcurrency())) {
            for (int s = 0; s < plan.stageCount(); s++) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    log.info("Execution {} cancelled before stage {}", runId, s);
                    break;
                }
                List<String> stage = plan.stage(s);
                listener.onStageStart(runId, s, stage);
                StageRun result = runStage(runId, stage, runs, frame, pool, cancellation);
                if (result.fatalNode != null) {
                    failure = result;
                    break;
                }
                if (result.cancelled) {
                    cancelled = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            listener.onExecutionEnd(runId, countSucceeded(runs), false, true);
            throw new CancellationException("Execution " + runId + " interrupted");
        }

        Map<String, NodeOutcome> outcomes = outcomes(runs);
        int succeeded = countSucceeded(runs);
        long elapsed = System.nanoTime() - start;

        if (failure != null) {
            log.error("Execution {} aborted after {} ms: node {} exhausted {} attempt(s)",
                    runId, elapsed / 1_000_000, failure.fatalNode, config.getRetryBudget(), failure.fatalError);
            listener.onExecutionEnd(runId, succeeded, true, cancelled);
            throw new FatalExecutionException(runId, failure.fatalNode, failure.fatalError, outcomes);
        }

        log.info("Execution {} {} in {} ms: {}/{} node(s) succeeded",
                runId, cancelled ? "cancelled" : "completed", elapsed / 1_000_000, succeeded, runs.size());
        listener.onExecutionEnd(runId, succeeded, false, cancelled);
        return new ExecutionSummary(runId, plan.stages(), outcomes, cancelled, elapsed);
    }

    /**
     * Submits every node of the stage and drains completions until nothing is
     * in flight.
     */
    private StageRun runStage(long runId, List<String> stage, Map<String, NodeRun> runs, ColumnFrame frame,
            WorkerPool<Attempt> pool, CancellationSignal cancellation) throws InterruptedException {
        StageRun result = new StageRun();
        int inFlight = 0;
        for (String id : stage) {
            submit(runId, runs.get(id), frame, pool);
            inFlight++;
        }

        while (inFlight > 0) {
            Attempt a = pool.take();
            inFlight--;
            NodeRun run = runs.get(a.nodeId);

            if (a.error == null) {
                run.succeed(a.output);
                frame.put(a.nodeId, a.output);
                log.debug("Node {} succeeded on attempt {} in {} us", a.nodeId, a.attempt, a.durationNanos / 1000);
                listener.onNodeSucceeded(runId, a.nodeId, a.attempt, a.durationNanos);
                continue;
            }

            NodeExecutionException err = new NodeExecutionException(a.nodeId, a.attempt, a.error);
            boolean stopping = result.fatalNode != null || cancellation.isCancelled();
            boolean retry = run.fail(err, !stopping);
            listener.onNodeFailed(runId, a.nodeId, a.attempt, err, retry);

            if (retry) {
                log.warn("Node {} failed on attempt {}, {} attempt(s) left: {}",
                        a.nodeId, a.attempt, run.attemptsRemaining(), err.getCause().toString());
                submit(runId, run, frame, pool);
                inFlight++;
            } else if (!run.hasAttemptsLeft() && result.fatalNode == null) {
                log.error("Node {} failed on its last attempt ({})", a.nodeId, a.attempt, a.error);
                result.fatalNode = a.nodeId;
                result.fatalError = err;
            } else {
                log.warn("Node {} failed on attempt {} and will not be retried (run stopping): {}",
                        a.nodeId, a.attempt, err.getCause().toString());
            }
        }
        result.cancelled = cancellation.isCancelled();
        return result;
    }

    private void submit(long runId, NodeRun run, ColumnFrame frame, WorkerPool<Attempt> pool) {
        int attempt = run.start();
        OperationNode node = run.node();
        listener.onAttemptStart(runId, node.id(), attempt);
        pool.submit(() -> invoke(node, attempt, frame));
    }

    /**
     * Runs on a worker. Never throws; any failure, {@link Error}s included,
     * travels back in the attempt.
     */
    private Attempt invoke(OperationNode node, int attempt, ColumnFrame frame) {
        long t0 = System.nanoTime();
        try {
            OperationRegistry.Entry entry = registry.lookup(node.kind());
            registry.validate(node.kind(), node.parameters());
            double[] out = entry.unit().execute(node.parameters(), frame);
            if (out == null)
                throw new IllegalStateException("Operation " + node.kind() + " returned no result");
            return new Attempt(node.id(), attempt, out, null, System.nanoTime() - t0);
        } catch (Throwable t) {
            return new Attempt(node.id(), attempt, null, t, System.nanoTime() - t0);
        }
    }

    private static Map<String, NodeOutcome> outcomes(Map<String, NodeRun> runs) {
        Map<String, NodeOutcome> out = new LinkedHashMap<>(runs.size() * 2);
        runs.forEach((id, r) -> out.put(id, r.toOutcome()));
        return Collections.unmodifiableMap(out);
    }

    private static int countSucceeded(Map<String, NodeRun> runs) {
        int n = 0;
        for (NodeRun r : runs.values())
            if (r.state() == NodeState.SUCCEEDED)
                n++;
        return n;
    }

    public ExecutionConfig config() {
        return config;
    }

    /** Completion of one attempt, carried back from a worker. */
    private static final class Attempt {
        final String nodeId;
        final int attempt;
        final double[] output;
        final Throwable error;
        final long durationNanos;

        Attempt(String nodeId, int attempt, double[] output, Throwable error, long durationNanos) {
            this.nodeId = nodeId;
            this.attempt = attempt;
            this.output = output;
            this.error = error;
            this.durationNanos = durationNanos;
        }
    }

    /** How a stage ended. */
    private static final class StageRun {
        String fatalNode;
        NodeExecutionException fatalError;
        boolean cancelled;
    }
}
