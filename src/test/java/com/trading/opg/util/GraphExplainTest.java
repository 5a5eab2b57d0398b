package com.trading.opg.util;

import com.trading.opg.api.OperationKind;
import com.trading.opg.api.Parameters;
import com.trading.opg.engine.DependencyResolver;
import com.trading.opg.engine.StagedPlan;
import com.trading.opg.graph.GraphStore;
import com.trading.opg.registry.OperationRegistry;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class GraphExplainTest {

    private GraphExplain explain;

    @Before
    public void setUp() {
        GraphStore store = new GraphStore(OperationRegistry.defaults());
        store.addNode("px", OperationKind.ADD, Parameters.of(0.5, "bid", "ask"));
        store.addNode("px.sma", OperationKind.SMA, Parameters.of(20, "px"));
        store.addEdge("px", "px.sma");
        StagedPlan plan = new DependencyResolver().resolve(store.snapshot());
        explain = new GraphExplain(plan);
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode("px.sma");
        assertTrue(text, text.contains("Kind: SMA"));
        assertTrue(text, text.contains("Stage: 1"));
        assertTrue(text, text.contains("Depends on: px"));
    }

    @Test
    public void testDumpStages() {
        String text = explain.dumpStages();
        assertTrue(text, text.contains("2 nodes, 2 stages"));
        assertTrue(text, text.contains("[0] px (ADD)"));
        assertTrue(text, text.contains("[1] px.sma (SMA)"));
    }

    @Test
    public void testMermaidSanitizesIds() {
        String mermaid = explain.toMermaid();
        assertTrue(mermaid, mermaid.contains("n_px --> n_px_sma;"));
        assertTrue(mermaid, mermaid.contains("bid, ask, =0.5"));
    }

    @Test
    public void testMermaidKeepsCollidingIdsApart() {
        GraphStore store = new GraphStore(OperationRegistry.defaults());
        store.addNode("a-b", OperationKind.ADD, Parameters.of(1, "x"));
        store.addNode("a_b", OperationKind.ADD, Parameters.of(2, "x"));
        store.addEdge("a-b", "a_b");
        String mermaid = new GraphExplain(new DependencyResolver().resolve(store.snapshot())).toMermaid();

        assertTrue(mermaid, mermaid.contains("n_a_b[\"a-b"));
        assertTrue(mermaid, mermaid.contains("n_a_b_2[\"a_b"));
        assertTrue(mermaid, mermaid.contains("n_a_b --> n_a_b_2;"));
    }
}
