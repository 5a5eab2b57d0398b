package com.trading.opg;

import com.trading.opg.api.CancellationSignal;
import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.ExecutionListener;
import com.trading.opg.api.ParameterEntry;
import com.trading.opg.engine.DependencyResolver;
import com.trading.opg.engine.ExecutionConfig;
import com.trading.opg.engine.ExecutionSummary;
import com.trading.opg.engine.PlanExecutor;
import com.trading.opg.engine.StagedPlan;
import com.trading.opg.graph.GraphSnapshot;
import com.trading.opg.graph.GraphStore;
import com.trading.opg.graph.OperationNode;
import com.trading.opg.io.GraphDocument;
import com.trading.opg.io.GraphDocumentCodec;
import com.trading.opg.registry.OperationRegistry;
import com.trading.opg.util.CompositeExecutionListener;
import com.trading.opg.util.GraphExplain;
import com.trading.opg.util.LoggingExecutionListener;
import com.trading.opg.util.NodeProfileListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;

/**
 * Session facade over one operation graph.
 * <p>
 * This class wires together:
 * <ul>
 * <li>the {@link GraphStore} holding the nodes and edges being edited</li>
 * <li>the {@link DependencyResolver} that stages a snapshot</li>
 * <li>the {@link PlanExecutor} that runs the stages on a worker pool</li>
 * <li>the {@link GraphDocumentCodec} for export, save and load</li>
 * </ul>
 * Every execution works on a snapshot taken when it starts, so the graph may
 * be edited while a run is in progress without affecting it.
 */
public class OpGraph {
    private static final Logger log = LogManager.getLogger(OpGraph.class);

    private final OperationRegistry registry;
    private final GraphStore store;
    private final DependencyResolver resolver = new DependencyResolver();
    private final GraphDocumentCodec codec;
    private final CompositeExecutionListener compositeListener = new CompositeExecutionListener();
    private final PlanExecutor executor;

    public OpGraph() {
        this(OperationRegistry.defaults(), ExecutionConfig.defaults());
    }

    public OpGraph(OperationRegistry registry, ExecutionConfig config) {
        this(registry, config, new GraphDocumentCodec());
    }

    public OpGraph(OperationRegistry registry, ExecutionConfig config, GraphDocumentCodec codec) {
        this.registry = registry;
        this.store = new GraphStore(registry);
        this.codec = codec;
        this.compositeListener.addForComposite(new LoggingExecutionListener());
        this.executor = new PlanExecutor(registry, config, compositeListener);
        log.info("OpGraph session created with {} and kinds {}", config, registry.kinds());
    }

    // --- Editing ---

    public OperationNode addNode(String id, String kind, List<ParameterEntry> parameters) {
        return store.addNode(id, kind, parameters);
    }

    public boolean removeNode(String id) {
        return store.removeNode(id);
    }

    public void addEdge(String source, String target) {
        store.addEdge(source, target);
    }

    public boolean removeEdge(String source, String target) {
        return store.removeEdge(source, target);
    }

    // --- Planning & execution ---

    /** Stages the current graph. */
    public StagedPlan plan() {
        return resolver.resolve(store.snapshot());
    }

    public ExecutionSummary execute() {
        return execute(ColumnFrame.empty());
    }

    public ExecutionSummary execute(ColumnFrame inputs) {
        return execute(inputs, CancellationSignal.create());
    }

    public ExecutionSummary execute(ColumnFrame inputs, CancellationSignal cancellation) {
        return execute(PlanExecutor.nextRunId(), inputs, cancellation);
    }

    /**
     * Snapshots, resolves and runs the graph.
     *
     * @throws com.trading.opg.api.FatalExecutionException if a node exhausted its
     *                                                     retry budget
     */
    public ExecutionSummary execute(long runId, ColumnFrame inputs, CancellationSignal cancellation) {
        return executor.run(runId, plan(), inputs, cancellation);
    }

    // --- Persistence ---

    public GraphDocument exportGraph() {
        return codec.export(store.snapshot());
    }

    public void save(Path path) {
        codec.save(exportGraph(), path);
    }

    public void load(Path path) {
        loadDocument(codec.load(path));
    }

    /**
     * Replaces the current graph with the document's. The document is replayed
     * into a scratch store first; the session graph changes only if every node
     * and edge was accepted.
     */
    public void loadDocument(GraphDocument doc) {
        GraphStore fresh = codec.replay(doc, registry);
        store.replaceWith(fresh.snapshot());
    }

    // --- Diagnostics ---

    /** Mermaid flowchart of the current graph, one subgraph per stage. */
    public String explain() {
        return new GraphExplain(plan()).toMermaid();
    }

    /**
     * Registers a listener for execution events. Listeners accumulate; none
     * replaces another.
     */
    public void addListener(ExecutionListener listener) {
        compositeListener.addForComposite(listener);
    }

    /**
     * Enables per-node profiling across runs.
     * Use the returned listener to dump statistics.
     */
    public NodeProfileListener enableNodeProfiling() {
        NodeProfileListener profile = new NodeProfileListener();
        compositeListener.addForComposite(profile);
        return profile;
    }

    public GraphSnapshot snapshot() {
        return store.snapshot();
    }

    public GraphStore store() {
        return store;
    }

    public OperationRegistry registry() {
        return registry;
    }

    public GraphDocumentCodec codec() {
        return codec;
    }

    public ExecutionConfig config() {
        return executor.config();
    }
}
