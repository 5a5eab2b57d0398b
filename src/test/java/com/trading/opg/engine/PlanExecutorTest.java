package com.trading.opg.engine;

import com.trading.opg.api.CancellationSignal;
import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.ExecutionListener;
import com.trading.opg.api.FatalExecutionException;
import com.trading.opg.api.NodeState;
import com.trading.opg.api.OperationKind;
import com.trading.opg.api.OperationUnit;
import com.trading.opg.api.Parameters;
import com.trading.opg.graph.GraphStore;
import com.trading.opg.registry.OperationRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.junit.Assert.*;

public class PlanExecutorTest {

    /** Fails the first {@code failures.get(key)} calls per key, keyed by first column. */
    private static final class ScriptedUnit implements OperationUnit {
        final Map<String, Integer> failures = new ConcurrentHashMap<>();
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        @Override
        public double[] execute(Parameters parameters, ColumnFrame frame) {
            String key = parameters.columns().get(0);
            int n = calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            if (n <= failures.getOrDefault(key, 0))
                throw new IllegalStateException(key + " failure #" + n);
            return new double[] { n };
        }

        int calls(String key) {
            AtomicInteger c = calls.get(key);
            return c == null ? 0 : c.get();
        }
    }

    /** Counts listener callbacks per node. */
    private static final class CountingListener implements ExecutionListener {
        final Map<String, AtomicInteger> successes = new ConcurrentHashMap<>();
        final List<Boolean> retries = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onNodeSucceeded(long runId, String nodeId, int attempt, long durationNanos) {
            successes.computeIfAbsent(nodeId, k -> new AtomicInteger()).incrementAndGet();
        }

        @Override
        public void onNodeFailed(long runId, String nodeId, int attempt, Throwable error, boolean willRetry) {
            retries.add(willRetry);
        }
    }

    private static OperationRegistry registryWith(OperationUnit unit) {
        return OperationRegistry.builder()
                .register(OperationKind.ADD, unit, Parameters.COLUMNS, Parameters.VALUE)
                .build();
    }

    private static StagedPlan plan(OperationRegistry registry, String[] nodes, String... edges) {
        GraphStore store = new GraphStore(registry);
        for (String id : nodes)
            store.addNode(id, OperationKind.ADD, Parameters.of(0, id));
        for (String e : edges) {
            String[] parts = e.split("->");
            store.addEdge(parts[0], parts[1]);
        }
        return new DependencyResolver().resolve(store.snapshot());
    }

    private static ExecutionConfig config(int concurrency, int budget) {
        return ExecutionConfig.builder().concurrency(concurrency).retryBudget(budget).build();
    }

    @Test
    public void testFlakyNodeSucceedsOnceWithinBudget() {
        ScriptedUnit unit = new ScriptedUnit();
        unit.failures.put("A", 2);
        OperationRegistry registry = registryWith(unit);
        CountingListener listener = new CountingListener();

        ExecutionSummary summary = new PlanExecutor(registry, config(2, 3), listener)
                .run(plan(registry, new String[] { "A", "B" }, "A->B"), ColumnFrame.empty());

        assertTrue(summary.isComplete());
        assertEquals(NodeState.SUCCEEDED, summary.outcome("A").state());
        assertEquals(3, summary.outcome("A").attempts());
        assertEquals(1, listener.successes.get("A").get());
        assertEquals(List.of(true, true), listener.retries);
        assertEquals(3.0, summary.result("A")[0], 0.0);
        assertEquals(1, unit.calls("B"));
    }

    @Test
    public void testExhaustedBudgetAbortsNamingTheNode() {
        ScriptedUnit unit = new ScriptedUnit();
        unit.failures.put("A", 3);
        OperationRegistry registry = registryWith(unit);

        try {
            new PlanExecutor(registry, config(2, 3))
                    .run(plan(registry, new String[] { "A", "B", "C" }, "A->C", "B->C"), ColumnFrame.empty());
            fail("Should have thrown");
        } catch (FatalExecutionException e) {
            assertEquals("A", e.nodeId());
            assertEquals("A", e.getCause().nodeId());
            assertEquals(3, e.getCause().attempt());
            assertTrue(e.getCause().getCause() instanceof IllegalStateException);

            assertEquals(NodeState.FAILED, e.outcomes().get("A").state());
            assertEquals(3, e.outcomes().get("A").attempts());
            assertEquals(NodeState.SUCCEEDED, e.outcomes().get("B").state());
            assertEquals(NodeState.PENDING, e.outcomes().get("C").state());
        }
        assertEquals(3, unit.calls("A"));
        assertEquals("Later stage must not start", 0, unit.calls("C"));
    }

    @Test
    public void testBudgetOfOneMeansNoRetry() {
        ScriptedUnit unit = new ScriptedUnit();
        unit.failures.put("A", 1);
        OperationRegistry registry = registryWith(unit);
        try {
            new PlanExecutor(registry, config(1, 1)).run(plan(registry, new String[] { "A" }), ColumnFrame.empty());
            fail("Should have thrown");
        } catch (FatalExecutionException e) {
            assertEquals(1, unit.calls("A"));
        }
    }

    @Test
    public void testCancelledBeforeStartLeavesEverythingPending() {
        ScriptedUnit unit = new ScriptedUnit();
        OperationRegistry registry = registryWith(unit);
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        ExecutionSummary summary = new PlanExecutor(registry, config(2, 3))
                .run(7L, plan(registry, new String[] { "A", "B" }, "A->B"), ColumnFrame.empty(), signal);

        assertTrue(summary.cancelled());
        assertEquals(7L, summary.runId());
        assertEquals(2, summary.count(NodeState.PENDING));
        assertEquals(0, unit.calls("A"));
    }

    @Test
    public void testCancellationStopsAfterCurrentStage() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger laterCalls = new AtomicInteger();
        OperationRegistry registry = registryWith((params, frame) -> {
            if (params.columns().get(0).equals("A"))
                signal.cancel();
            else
                laterCalls.incrementAndGet();
            return new double[] { 1 };
        });

        ExecutionSummary summary = new PlanExecutor(registry, config(1, 3))
                .run(PlanExecutor.nextRunId(), plan(registry, new String[] { "A", "B" }, "A->B"),
                        ColumnFrame.empty(), signal);

        assertTrue(summary.cancelled());
        assertEquals(NodeState.SUCCEEDED, summary.outcome("A").state());
        assertEquals(NodeState.PENDING, summary.outcome("B").state());
        assertEquals(0, laterCalls.get());
        assertFalse(summary.isComplete());
    }

    @Test
    public void testStageBarrier() {
        AtomicInteger clock = new AtomicInteger();
        Map<String, int[]> spans = new ConcurrentHashMap<>();
        OperationRegistry registry = registryWith((params, frame) -> {
            int start = clock.incrementAndGet();
            Thread.sleep(params.columns().get(0).startsWith("slow") ? 50 : 1);
            spans.put(params.columns().get(0), new int[] { start, clock.incrementAndGet() });
            return new double[0];
        });

        StagedPlan plan = plan(registry, new String[] { "slow1", "fast1", "slow2", "next" },
                "fast1->next", "slow1->slow2");
        ExecutionSummary summary = new PlanExecutor(registry, config(4, 1)).run(plan, ColumnFrame.empty());
        assertTrue(summary.isComplete());

        int lastEndOfStage0 = 0;
        for (String id : plan.stage(0))
            lastEndOfStage0 = Math.max(lastEndOfStage0, spans.get(id)[1]);
        for (String id : plan.stage(1))
            assertTrue(id + " started before stage 0 drained", spans.get(id)[0] > lastEndOfStage0);
    }

    @Test
    public void testStageRunsInParallel() {
        CountDownLatch allStarted = new CountDownLatch(4);
        OperationRegistry registry = registryWith((params, frame) -> {
            allStarted.countDown();
            if (!allStarted.await(5, TimeUnit.SECONDS))
                throw new IllegalStateException("Siblings did not run concurrently");
            return new double[0];
        });

        ExecutionSummary summary = new PlanExecutor(registry, config(4, 1))
                .run(plan(registry, new String[] { "a", "b", "c", "d" }), ColumnFrame.empty());
        assertTrue(summary.isComplete());
    }

    @Test
    public void testOutputsFlowToLaterStages() {
        OperationRegistry registry = OperationRegistry.defaults();
        GraphStore store = new GraphStore(registry);
        store.addNode("A", OperationKind.ADD, Parameters.of(1, "x"));
        store.addNode("B", OperationKind.SMA, Parameters.of(2, "A"));
        store.addNode("C", OperationKind.ADD, Parameters.of(0, "A", "B"));
        store.addEdge("A", "B");
        store.addEdge("A", "C");
        store.addEdge("B", "C");

        ColumnFrame inputs = ColumnFrame.empty().put("x", new double[] { 1, 2, 3 });
        ExecutionSummary summary = new PlanExecutor(registry, ExecutionConfig.defaults())
                .run(new DependencyResolver().resolve(store.snapshot()), inputs);

        assertArrayEquals(new double[] { 2, 3, 4 }, summary.result("A"), 1e-12);
        assertTrue(Double.isNaN(summary.result("B")[0]));
        assertEquals(2.5, summary.result("B")[1], 1e-12);
        assertEquals(5.5, summary.result("C")[1], 1e-12);
        assertTrue(Double.isNaN(summary.result("C")[0]));
        assertFalse("Caller's frame is untouched", inputs.hasColumn("A"));
    }

    @Test
    public void testMissingInputColumnIsRetriedThenFatal() {
        OperationRegistry registry = OperationRegistry.defaults();
        GraphStore store = new GraphStore(registry);
        store.addNode("C", OperationKind.ADD, Parameters.of(5, "x"));
        try {
            new PlanExecutor(registry, config(1, 2))
                    .run(new DependencyResolver().resolve(store.snapshot()), ColumnFrame.empty());
            fail("Should have thrown");
        } catch (FatalExecutionException e) {
            assertEquals("C", e.nodeId());
            assertEquals(2, e.outcomes().get("C").attempts());
            assertTrue(e.getCause().getCause().getMessage().contains("Unknown column: x"));
        }
    }

    @Test
    public void testErrorFromUnitIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        OperationRegistry registry = registryWith((params, frame) -> {
            if (calls.incrementAndGet() == 1)
                throw new AssertionError("transient");
            return new double[] { 7 };
        });
        CountingListener listener = new CountingListener();

        ExecutionSummary summary = new PlanExecutor(registry, config(1, 3), listener)
                .run(plan(registry, new String[] { "A" }), ColumnFrame.empty());

        assertTrue(summary.isComplete());
        assertEquals(NodeState.SUCCEEDED, summary.outcome("A").state());
        assertEquals(2, summary.outcome("A").attempts());
        assertEquals(2, calls.get());
        assertEquals(List.of(true), listener.retries);
        assertEquals(7.0, summary.result("A")[0], 0.0);
    }

    @Test
    public void testPersistentErrorIsFatalNamingTheNode() {
        AtomicInteger calls = new AtomicInteger();
        OperationRegistry registry = registryWith((params, frame) -> {
            calls.incrementAndGet();
            throw new AssertionError("broken");
        });
        AtomicInteger ended = new AtomicInteger();
        ExecutionListener listener = new ExecutionListener() {
            @Override
            public void onExecutionEnd(long runId, int succeeded, boolean aborted, boolean cancelled) {
                if (aborted)
                    ended.incrementAndGet();
            }
        };

        try {
            new PlanExecutor(registry, config(1, 2), listener)
                    .run(plan(registry, new String[] { "A" }), ColumnFrame.empty());
            fail("Should have thrown");
        } catch (FatalExecutionException e) {
            assertEquals("A", e.nodeId());
            assertEquals(NodeState.FAILED, e.outcomes().get("A").state());
            assertTrue(e.getCause().getCause() instanceof AssertionError);
        }
        assertEquals(2, calls.get());
        assertEquals(1, ended.get());
    }

    @Test
    public void testConcurrencyLimitRespected() {
        AtomicInteger live = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        OperationRegistry registry = registryWith((params, frame) -> {
            int now = live.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } finally {
                live.decrementAndGet();
            }
            return new double[0];
        });

        ExecutionSummary summary = new PlanExecutor(registry, config(2, 1))
                .run(plan(registry, new String[] { "a", "b", "c", "d", "e", "f" }), ColumnFrame.empty());

        assertTrue(summary.isComplete());
        assertTrue("peak " + peak.get(), peak.get() <= 2);
        assertEquals(2, peak.get());
    }

    @Test
    public void testSiblingNotRetriedAfterFatal() {
        CountDownLatch fatalAttemptsMade = new CountDownLatch(2);
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        OperationRegistry registry = registryWith((params, frame) -> {
            String id = params.columns().get(0);
            calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            if (id.equals("A")) {
                fatalAttemptsMade.countDown();
                throw new IllegalStateException("A always fails");
            }
            if (id.equals("B")) {
                // let the coordinator record A as fatal before B fails
                assertTrue(fatalAttemptsMade.await(5, TimeUnit.SECONDS));
                Thread.sleep(200);
                throw new IllegalStateException("B fails late");
            }
            return new double[0];
        });

        try {
            new PlanExecutor(registry, config(2, 2))
                    .run(plan(registry, new String[] { "A", "B", "C" }, "A->C", "B->C"), ColumnFrame.empty());
            fail("Should have thrown");
        } catch (FatalExecutionException e) {
            assertEquals("A", e.nodeId());
            assertEquals(2, calls.get("A").get());
            assertEquals(1, calls.get("B").get());
            assertEquals(NodeState.FAILED, e.outcomes().get("B").state());
            assertEquals(1, e.outcomes().get("B").attempts());
            assertEquals(NodeState.PENDING, e.outcomes().get("C").state());
            assertNull(calls.get("C"));
        }
    }

    @Test
    public void testRecordedResultIsNotShared() {
        ScriptedUnit unit = new ScriptedUnit();
        OperationRegistry registry = registryWith(unit);

        ExecutionSummary summary = new PlanExecutor(registry, config(1, 1))
                .run(plan(registry, new String[] { "A" }), ColumnFrame.empty());

        summary.result("A")[0] = -1;
        summary.outcome("A").result()[0] = -2;
        assertEquals(1.0, summary.result("A")[0], 0.0);
        assertEquals(1.0, summary.outcome("A").result()[0], 0.0);
    }
}
