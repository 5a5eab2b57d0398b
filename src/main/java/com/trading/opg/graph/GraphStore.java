package com.trading.opg.graph;

import com.trading.opg.api.CycleException;
import com.trading.opg.api.DuplicateNodeException;
import com.trading.opg.api.NodeNotFoundException;
import com.trading.opg.api.OperationKind;
import com.trading.opg.api.ParameterEntry;
import com.trading.opg.api.Parameters;
import com.trading.opg.registry.OperationRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of a mutable operation graph.
 *
 * <p>
 * Every mutation validates its input completely before touching state, so a
 * failed call leaves the graph exactly as it was. In particular
 * {@link #addEdge} runs its cycle check against the committed edge set and
 * inserts only once the edge is known to be safe.
 *
 * <p>
 * Thread safety: mutations take the write lock, {@link #snapshot()} and the
 * queries take the read lock. Execution never reads the store directly; it
 * works on a {@link GraphSnapshot}.
 */
public final class GraphStore {
    private static final Logger log = LogManager.getLogger(GraphStore.class);

    private final OperationRegistry registry;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // insertion ordered so exports are stable
    private final Map<String, OperationNode> nodes = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<String, Set<String>> successors = new HashMap<>();
    private final Map<String, Set<String>> predecessors = new HashMap<>();

    public GraphStore(OperationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public OperationRegistry registry() {
        return registry;
    }

    /**
     * Adds a node from its wire form.
     *
     * @throws com.trading.opg.api.UnknownKindException      if the kind is not registered
     * @throws com.trading.opg.api.InvalidParameterException if an entry is malformed
     * @throws com.trading.opg.api.MissingParameterException if a required name is absent
     * @throws DuplicateNodeException                        if the id is taken
     */
    public OperationNode addNode(String id, String kind, List<ParameterEntry> parameters) {
        OperationKind k = registry.lookup(kind).kind();
        return addNode(id, k, Parameters.fromEntries(parameters));
    }

    /**
     * Adds a node whose parameters are already in canonical form.
     *
     * @throws DuplicateNodeException if the id is taken
     */
    public OperationNode addNode(String id, OperationKind kind, Parameters parameters) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        registry.validate(kind, parameters);
        OperationNode node = new OperationNode(id, kind, parameters);

        lock.writeLock().lock();
        try {
            if (nodes.containsKey(id))
                throw new DuplicateNodeException(id);
            nodes.put(id, node);
            successors.put(id, new LinkedHashSet<>());
            predecessors.put(id, new LinkedHashSet<>());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Node {} ({}) added with {}", id, kind, parameters);
        return node;
    }

    /**
     * Removes a node and every edge touching it. Unknown ids are ignored.
     *
     * @return {@code true} if a node was removed
     */
    public boolean removeNode(String id) {
        int droppedEdges;
        lock.writeLock().lock();
        try {
            if (nodes.remove(id) == null) {
                log.debug("Node {} not found, nothing removed", id);
                return false;
            }
            Set<String> out = successors.remove(id);
            Set<String> in = predecessors.remove(id);
            for (String t : out) {
                predecessors.get(t).remove(id);
                edges.remove(new Edge(id, t));
            }
            for (String s : in) {
                successors.get(s).remove(id);
                edges.remove(new Edge(s, id));
            }
            droppedEdges = out.size() + in.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Node {} removed along with {} incident edge(s)", id, droppedEdges);
        return true;
    }

    /**
     * Adds the dependency {@code source -> target}. Adding an edge that already
     * exists is a no-op.
     *
     * @throws NodeNotFoundException if either endpoint is absent
     * @throws CycleException        if the edge would close a cycle; the graph is
     *                               unchanged
     */
    public void addEdge(String source, String target) {
        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(source))
                throw new NodeNotFoundException(source);
            if (!nodes.containsKey(target))
                throw new NodeNotFoundException(target);
            if (successors.get(source).contains(target))
                return;

            List<String> back = pathBetween(target, source);
            if (back != null) {
                List<String> cycle = new ArrayList<>(back.size() + 1);
                cycle.add(source);
                cycle.addAll(back);
                throw new CycleException(source, target, cycle);
            }

            successors.get(source).add(target);
            predecessors.get(target).add(source);
            edges.add(new Edge(source, target));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Edge {} -> {} added", source, target);
    }

    /**
     * Removes the edge if present.
     *
     * @return {@code true} if an edge was removed
     */
    public boolean removeEdge(String source, String target) {
        if (source == null || target == null)
            return false;
        lock.writeLock().lock();
        try {
            if (!edges.remove(new Edge(source, target))) {
                log.debug("Edge {} -> {} not found, nothing removed", source, target);
                return false;
            }
            successors.get(source).remove(target);
            predecessors.get(target).remove(source);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Edge {} -> {} removed", source, target);
        return true;
    }

    /** Frozen copy of the current nodes and edges. */
    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return GraphSnapshot.of(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole content with that of {@code other} in one step, so
     * readers see either the old graph or the new one.
     */
    public void replaceWith(GraphSnapshot other) {
        lock.writeLock().lock();
        try {
            clearUnlocked();
            for (OperationNode n : other.nodes()) {
                nodes.put(n.id(), n);
                successors.put(n.id(), new LinkedHashSet<>());
                predecessors.put(n.id(), new LinkedHashSet<>());
            }
            for (Edge e : other.edges()) {
                successors.get(e.source()).add(e.target());
                predecessors.get(e.target()).add(e.source());
                edges.add(e);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Graph replaced: {} node(s), {} edge(s)", other.nodeCount(), other.edgeCount());
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            clearUnlocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return nodes.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int edgeCount() {
        lock.readLock().lock();
        try {
            return edges.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> successors(String id) {
        lock.readLock().lock();
        try {
            Set<String> out = successors.get(id);
            if (out == null)
                throw new NodeNotFoundException(id);
            return List.copyOf(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int inDegree(String id) {
        lock.readLock().lock();
        try {
            Set<String> in = predecessors.get(id);
            if (in == null)
                throw new NodeNotFoundException(id);
            return in.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int outDegree(String id) {
        return successors(id).size();
    }

    private void clearUnlocked() {
        nodes.clear();
        edges.clear();
        successors.clear();
        predecessors.clear();
    }

    /**
     * Depth-first search from {@code from} over committed edges. Only the part
     * of the graph reachable from {@code from} is visited.
     *
     * @return the path {@code from .. to}, or {@code null} if unreachable
     */
    private List<String> pathBetween(String from, String to) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        parent.put(from, null);
        stack.push(from);
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            if (curr.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String p = curr; p != null; p = parent.get(p))
                    path.add(p);
                Collections.reverse(path);
                return path;
            }
            for (String next : successors.get(curr)) {
                if (!parent.containsKey(next)) {
                    parent.put(next, curr);
                    stack.push(next);
                }
            }
        }
        return null;
    }
}
