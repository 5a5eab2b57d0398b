package com.trading.opg.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trading.opg.graph.Edge;
import com.trading.opg.graph.GraphSnapshot;
import com.trading.opg.graph.GraphStore;
import com.trading.opg.graph.OperationNode;
import com.trading.opg.registry.OperationRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between live graphs and {@link GraphDocument}s, and between
 * documents and JSON text.
 *
 * <p>
 * Loading never deserializes straight into a store: {@link #replay} feeds the
 * document through the ordinary {@code addNode}/{@code addEdge} calls, nodes
 * first, both in document order, so a document is subject to exactly the
 * checks a live caller is.
 */
public final class GraphDocumentCodec {
    private static final Logger log = LogManager.getLogger(GraphDocumentCodec.class);

    private final ObjectMapper mapper;

    public GraphDocumentCodec() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public GraphDocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Document view of a snapshot: nodes and edges in insertion order. */
    public GraphDocument export(GraphSnapshot snapshot) {
        GraphDocument doc = new GraphDocument();
        List<GraphDocument.NodeDef> nodes = new ArrayList<>(snapshot.nodeCount());
        for (OperationNode n : snapshot.nodes())
            nodes.add(new GraphDocument.NodeDef(n.id(), n.kind().name(), n.parameters().toEntries()));
        List<GraphDocument.EdgeDef> edges = new ArrayList<>(snapshot.edgeCount());
        for (Edge e : snapshot.edges())
            edges.add(new GraphDocument.EdgeDef(e.source(), e.target()));
        doc.setNodes(nodes);
        doc.setEdges(edges);
        return doc;
    }

    /**
     * Builds a fresh store from the document.
     *
     * @throws com.trading.opg.api.GraphException the first error any replayed
     *                                            call raises
     */
    public GraphStore replay(GraphDocument doc, OperationRegistry registry) {
        GraphStore store = new GraphStore(registry);
        if (doc.getNodes() != null) {
            for (GraphDocument.NodeDef nd : doc.getNodes())
                store.addNode(nd.getId(), nd.getType(), nd.getParameters());
        }
        if (doc.getEdges() != null) {
            for (GraphDocument.EdgeDef ed : doc.getEdges())
                store.addEdge(ed.getSource(), ed.getTarget());
        }
        return store;
    }

    public String write(GraphDocument doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph document", e);
        }
    }

    public GraphDocument read(String json) {
        try {
            return mapper.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse graph document", e);
        }
    }

    public void save(GraphDocument doc, Path path) {
        try {
            Files.writeString(path, write(doc));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save graph to " + path, e);
        }
        log.info("Graph saved to {} ({} node(s), {} edge(s))", path, doc.getNodes().size(), doc.getEdges().size());
    }

    public GraphDocument load(Path path) {
        try {
            return read(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph from " + path, e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
