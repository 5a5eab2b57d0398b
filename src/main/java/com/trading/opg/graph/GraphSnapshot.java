package com.trading.opg.graph;

import com.trading.opg.api.NodeNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Frozen copy of a graph's nodes and edges.
 *
 * Node iteration follows insertion order; edge iteration follows the order
 * edges were added. Successor and predecessor lists are precomputed, so all
 * queries are O(1) map lookups.
 *
 * A snapshot is a plain view and does not re-check acyclicity;
 * {@link GraphStore} guarantees it for every snapshot it hands out.
 */
public final class GraphSnapshot {
    private final Map<String, OperationNode> nodes;
    private final List<Edge> edges;
    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;

    private GraphSnapshot(Map<String, OperationNode> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);

        Map<String, List<String>> succ = new LinkedHashMap<>(nodes.size() * 2);
        Map<String, List<String>> pred = new LinkedHashMap<>(nodes.size() * 2);
        for (String id : nodes.keySet()) {
            succ.put(id, new ArrayList<>());
            pred.put(id, new ArrayList<>());
        }
        for (Edge e : this.edges) {
            List<String> out = succ.get(e.source());
            List<String> in = pred.get(e.target());
            if (out == null)
                throw new NodeNotFoundException(e.source());
            if (in == null)
                throw new NodeNotFoundException(e.target());
            out.add(e.target());
            in.add(e.source());
        }
        succ.replaceAll((k, v) -> List.copyOf(v));
        pred.replaceAll((k, v) -> List.copyOf(v));
        this.successors = Collections.unmodifiableMap(succ);
        this.predecessors = Collections.unmodifiableMap(pred);
    }

    /**
     * Builds a snapshot from explicit node and edge collections.
     *
     * @throws NodeNotFoundException    if an edge names an absent node
     * @throws IllegalArgumentException if two nodes share an id
     */
    public static GraphSnapshot of(Collection<OperationNode> nodes, Collection<Edge> edges) {
        Map<String, OperationNode> byId = new LinkedHashMap<>(nodes.size() * 2);
        for (OperationNode n : nodes) {
            if (byId.put(n.id(), n) != null)
                throw new IllegalArgumentException("Duplicate node id in snapshot: " + n.id());
        }
        return new GraphSnapshot(byId, new ArrayList<>(new LinkedHashSet<>(edges)));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Collection<OperationNode> nodes() {
        return nodes.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @throws NodeNotFoundException if the node is not in the snapshot
     */
    public OperationNode node(String id) {
        OperationNode n = nodes.get(id);
        if (n == null)
            throw new NodeNotFoundException(id);
        return n;
    }

    public List<Edge> edges() {
        return edges;
    }

    public boolean hasEdge(String source, String target) {
        List<String> out = successors.get(source);
        return out != null && out.contains(target);
    }

    public List<String> successors(String id) {
        node(id);
        return successors.get(id);
    }

    public List<String> predecessors(String id) {
        node(id);
        return predecessors.get(id);
    }

    public int inDegree(String id) {
        return predecessors(id).size();
    }

    public int outDegree(String id) {
        return successors(id).size();
    }
}
