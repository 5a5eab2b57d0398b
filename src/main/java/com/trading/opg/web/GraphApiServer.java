package com.trading.opg.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.opg.OpGraph;
import com.trading.opg.api.GraphException;
import com.trading.opg.wiring.ExecutionDispatcher;
import com.trading.opg.wiring.ExecutionRun;

import io.javalin.Javalin;
import io.javalin.http.Context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON over HTTP front end for one {@link OpGraph} session.
 * <p>
 * Graph edits run on the request thread; {@code /execute} only queues a run on
 * the {@link ExecutionDispatcher} and answers 202 with the run id, which
 * {@code /executions/{runId}} then reports on.
 */
public class GraphApiServer {
    private static final Logger log = LogManager.getLogger(GraphApiServer.class);

    private final OpGraph graph;
    private final ExecutionDispatcher dispatcher;
    private final ObjectMapper mapper;
    private Javalin app;

    public GraphApiServer(OpGraph graph, ExecutionDispatcher dispatcher) {
        this.graph = graph;
        this.dispatcher = dispatcher;
        this.mapper = graph.codec().mapper();
    }

    /**
     * Starts listening. Pass port 0 to bind an ephemeral port, then read it
     * back with {@link #port()}.
     */
    public void start(String host, int port) {
        log.info("Starting graph API server on {}:{}", host, port);
        app = Javalin.create(config -> config.showJavalinBanner = false);

        app.post("/add_node", this::addNode);
        app.delete("/remove_node/{id}", this::removeNode);
        app.post("/add_edge", this::addEdge);
        app.post("/remove_edge", this::removeEdge);
        app.get("/execute", this::execute);
        app.get("/executions/{runId}", this::executionStatus);
        app.post("/executions/{runId}/cancel", this::cancelExecution);
        app.get("/dag", this::dag);
        app.get("/dag/mermaid", ctx -> ctx.contentType("text/plain").result(graph.explain()));

        app.exception(GraphException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(IllegalArgumentException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(JsonProcessingException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, e);
        });

        app.start(host, port);
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private void addNode(Context ctx) throws JsonProcessingException {
        AddNodeRequest req = mapper.readValue(ctx.body(), AddNodeRequest.class);
        graph.addNode(req.getId(), req.getType(), req.getParameters());
        json(ctx, 200, Map.of("message", "Node " + req.getId() + " added"));
    }

    private void removeNode(Context ctx) throws JsonProcessingException {
        String id = ctx.pathParam("id");
        boolean removed = graph.removeNode(id);
        json(ctx, 200, Map.of("message", removed ? "Node " + id + " removed" : "Node " + id + " not present"));
    }

    private void addEdge(Context ctx) throws JsonProcessingException {
        EdgeRequest req = mapper.readValue(ctx.body(), EdgeRequest.class);
        graph.addEdge(req.getSource(), req.getTarget());
        json(ctx, 200, Map.of("message", "Edge " + req.getSource() + " -> " + req.getTarget() + " added"));
    }

    private void removeEdge(Context ctx) throws JsonProcessingException {
        EdgeRequest req = mapper.readValue(ctx.body(), EdgeRequest.class);
        boolean removed = graph.removeEdge(req.getSource(), req.getTarget());
        String edge = req.getSource() + " -> " + req.getTarget();
        json(ctx, 200, Map.of("message", removed ? "Edge " + edge + " removed" : "Edge " + edge + " not present"));
    }

    private void execute(Context ctx) throws JsonProcessingException {
        ExecutionRun run = dispatcher.submit();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Execution started");
        body.put("runId", run.runId());
        json(ctx, 202, body);
    }

    private void executionStatus(Context ctx) throws JsonProcessingException {
        long runId = parseRunId(ctx);
        ExecutionRun run = dispatcher.status(runId);
        if (run == null) {
            json(ctx, 404, Map.of("error", "Unknown run: " + runId));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", run.runId());
        body.put("status", run.status().name());
        body.put("submittedAt", run.submittedAtMillis());
        if (run.finishedAtMillis() > 0)
            body.put("finishedAt", run.finishedAtMillis());
        if (run.failedNode() != null)
            body.put("failedNode", run.failedNode());
        if (run.error() != null)
            body.put("error", run.error());
        json(ctx, 200, body);
    }

    private void cancelExecution(Context ctx) throws JsonProcessingException {
        long runId = parseRunId(ctx);
        if (dispatcher.status(runId) == null) {
            json(ctx, 404, Map.of("error", "Unknown run: " + runId));
            return;
        }
        boolean accepted = dispatcher.cancel(runId);
        json(ctx, 200, Map.of("message", accepted ? "Cancellation requested" : "Run already finished"));
    }

    private void dag(Context ctx) throws JsonProcessingException {
        json(ctx, 200, Map.of("dag", graph.exportGraph()));
    }

    private static long parseRunId(Context ctx) {
        String raw = ctx.pathParam("runId");
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid run id: " + raw, e);
        }
    }

    private void json(Context ctx, int status, Object body) throws JsonProcessingException {
        ctx.status(status).contentType("application/json").result(mapper.writeValueAsString(body));
    }

    private void error(Context ctx, int status, Exception e) {
        log.debug("{} {} -> {}: {}", ctx.method(), ctx.path(), status, e.getMessage());
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        try {
            json(ctx, status, Map.of("error", message));
        } catch (JsonProcessingException ser) {
            ctx.status(500).result("{\"error\":\"internal error\"}");
        }
    }
}
