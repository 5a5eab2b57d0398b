package com.trading.opg.graph;

import com.trading.opg.api.CycleException;
import com.trading.opg.api.DuplicateNodeException;
import com.trading.opg.api.InvalidParameterException;
import com.trading.opg.api.MissingParameterException;
import com.trading.opg.api.NodeNotFoundException;
import com.trading.opg.api.OperationKind;
import com.trading.opg.api.ParameterEntry;
import com.trading.opg.api.Parameters;
import com.trading.opg.api.UnknownKindException;
import com.trading.opg.registry.OperationRegistry;

import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class GraphStoreTest {

    private GraphStore store;

    @Before
    public void setUp() {
        store = new GraphStore(OperationRegistry.defaults());
    }

    private void add(String id) {
        store.addNode(id, OperationKind.ADD, Parameters.of(1, "x"));
    }

    @Test
    public void testAddNodeFromWireForm() {
        OperationNode node = store.addNode("C", "ADD",
                List.of(ParameterEntry.column("x"), ParameterEntry.value(5)));
        assertEquals(OperationKind.ADD, node.kind());
        assertEquals(List.of("x"), node.parameters().columns());
        assertTrue(store.contains("C"));
        assertEquals(1, store.size());
    }

    @Test
    public void testDuplicateIdRejectedAndOriginalKept() {
        add("A");
        try {
            store.addNode("A", OperationKind.SMA, Parameters.of(3, "y"));
            fail("Should have thrown");
        } catch (DuplicateNodeException e) {
            assertEquals("A", e.nodeId());
        }
        assertEquals(OperationKind.ADD, store.snapshot().node("A").kind());
    }

    @Test
    public void testRejectedNodesLeaveGraphEmpty() {
        try {
            store.addNode("A", "EMA", List.of(ParameterEntry.column("x"), ParameterEntry.value(1)));
            fail("Unknown kind accepted");
        } catch (UnknownKindException expected) {
        }
        try {
            store.addNode("A", "SMA", List.of(ParameterEntry.column("x")));
            fail("Missing value accepted");
        } catch (MissingParameterException expected) {
        }
        try {
            store.addNode("A", "SMA", List.of(new ParameterEntry()));
            fail("Malformed entry accepted");
        } catch (InvalidParameterException expected) {
        }
        assertEquals(0, store.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankIdRejected() {
        store.addNode(" ", OperationKind.ADD, Parameters.of(1, "x"));
    }

    @Test
    public void testAddEdgeUpdatesAdjacency() {
        add("A");
        add("B");
        store.addEdge("A", "B");
        assertEquals(List.of("B"), store.successors("A"));
        assertEquals(1, store.inDegree("B"));
        assertEquals(0, store.inDegree("A"));
        assertEquals(1, store.outDegree("A"));
    }

    @Test
    public void testDuplicateEdgeIsNoOp() {
        add("A");
        add("B");
        store.addEdge("A", "B");
        store.addEdge("A", "B");
        assertEquals(1, store.edgeCount());
    }

    @Test
    public void testEdgeToMissingNode() {
        add("A");
        try {
            store.addEdge("A", "Z");
            fail("Should have thrown");
        } catch (NodeNotFoundException e) {
            assertEquals("Z", e.nodeId());
        }
        assertEquals(0, store.edgeCount());
    }

    @Test
    public void testCycleRejectedAndGraphUnchanged() {
        add("A");
        add("B");
        add("C");
        store.addEdge("A", "B");
        store.addEdge("B", "C");
        GraphSnapshot before = store.snapshot();

        try {
            store.addEdge("C", "A");
            fail("Should have thrown");
        } catch (CycleException e) {
            assertEquals("C", e.source());
            assertEquals("A", e.target());
            assertEquals(List.of("C", "A", "B", "C"), e.path());
        }

        GraphSnapshot after = store.snapshot();
        assertEquals(before.edges(), after.edges());
        assertEquals(before.nodeIds(), after.nodeIds());
        assertFalse(after.hasEdge("C", "A"));
    }

    @Test(expected = CycleException.class)
    public void testSelfEdgeIsCycle() {
        add("A");
        store.addEdge("A", "A");
    }

    @Test
    public void testRemoveNodeDropsIncidentEdges() {
        add("A");
        add("B");
        add("C");
        store.addEdge("A", "B");
        store.addEdge("B", "C");
        store.addEdge("A", "C");

        assertTrue(store.removeNode("B"));
        assertFalse(store.contains("B"));
        assertEquals(1, store.edgeCount());
        assertEquals(List.of("C"), store.successors("A"));
        assertEquals(1, store.inDegree("C"));
    }

    @Test
    public void testRemoveIsIdempotent() {
        add("A");
        add("B");
        store.addEdge("A", "B");
        assertTrue(store.removeEdge("A", "B"));
        assertFalse(store.removeEdge("A", "B"));
        assertFalse(store.removeEdge(null, "B"));
        assertTrue(store.removeNode("A"));
        assertFalse(store.removeNode("A"));
        assertFalse(store.removeNode("never-existed"));
    }

    @Test
    public void testRemovedEdgeCanBeReversed() {
        add("A");
        add("B");
        store.addEdge("A", "B");
        store.removeEdge("A", "B");
        store.addEdge("B", "A");
        assertTrue(store.snapshot().hasEdge("B", "A"));
    }

    @Test
    public void testSnapshotIsDetached() {
        add("A");
        GraphSnapshot snap = store.snapshot();
        add("B");
        assertEquals(1, snap.nodeCount());
        assertEquals(2, store.size());
    }

    @Test
    public void testReplaceWith() {
        add("A");
        GraphStore other = new GraphStore(OperationRegistry.defaults());
        other.addNode("X", OperationKind.SMA, Parameters.of(2, "p"));
        other.addNode("Y", OperationKind.ADD, Parameters.of(0, "X"));
        other.addEdge("X", "Y");

        store.replaceWith(other.snapshot());
        assertFalse(store.contains("A"));
        assertEquals(2, store.size());
        assertEquals(List.of("Y"), store.successors("X"));
    }

    @Test(expected = NodeNotFoundException.class)
    public void testQueryUnknownNode() {
        store.successors("ghost");
    }
}
