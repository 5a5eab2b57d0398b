package com.trading.opg.web;

import com.trading.opg.OpGraph;
import com.trading.opg.registry.OperationRegistry;
import com.trading.opg.wiring.ExecutionDispatcher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Entry point: one graph session behind the HTTP API.
 * <p>
 * An optional first argument names a graph document to load at startup.
 */
public final class OpGraphServer {
    private static final Logger log = LogManager.getLogger(OpGraphServer.class);

    private OpGraphServer() {
    }

    public static void main(String[] args) {
        OpGraphSettings settings = OpGraphSettings.load();
        log.info("Starting OpGraph with {}", settings);

        OpGraph graph = new OpGraph(OperationRegistry.defaults(), settings.executionConfig());
        if (args.length > 0) {
            graph.load(Path.of(args[0]));
            log.info("Loaded graph from {}", args[0]);
        }

        ExecutionDispatcher dispatcher = new ExecutionDispatcher(graph, settings.getRingBufferSize(),
                settings.getHistoryLimit());
        GraphApiServer server = new GraphApiServer(graph, dispatcher);
        server.start(settings.getHost(), settings.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.stop();
            dispatcher.close();
        }, "opgraph-shutdown"));
    }
}
