package com.trading.opg.util;

import com.trading.opg.api.ParameterEntry;
import com.trading.opg.engine.StagedPlan;
import com.trading.opg.graph.Edge;
import com.trading.opg.graph.GraphSnapshot;
import com.trading.opg.graph.OperationNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic rendering of a graph and its staged plan.
 *
 * <p>
 * <b>Usage:</b> debugging, logging and the {@code /dag/mermaid} endpoint.
 * Allocates freely; keep it off any hot path.
 */
public final class GraphExplain {
    private final StagedPlan plan;
    private final GraphSnapshot snapshot;

    public GraphExplain(StagedPlan plan) {
        this.plan = plan;
        this.snapshot = plan.snapshot();
    }

    /**
     * Dumps a single node: kind, parameters, stage and neighbours.
     */
    public String explainNode(String nodeId) {
        OperationNode node = snapshot.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  Columns: ").append(node.parameters().columns()).append('\n')
                .append("  Value: ").append(node.parameters().value().isPresent()
                        ? node.parameters().value().getAsDouble()
                        : "-")
                .append('\n')
                .append("  Stage: ").append(plan.stageOf(nodeId)).append('\n')
                .append("  Depends on: ").append(String.join(", ", snapshot.predecessors(nodeId))).append('\n')
                .append("  Feeds: ").append(String.join(", ", snapshot.successors(nodeId))).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the plan stage by stage.
     */
    public String dumpStages() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Plan (").append(plan.nodeCount()).append(" nodes, ")
                .append(plan.stageCount()).append(" stages):\n");
        for (int s = 0; s < plan.stageCount(); s++) {
            sb.append("  [").append(s).append("] ");
            List<String> stage = plan.stage(s);
            for (int i = 0; i < stage.size(); i++) {
                OperationNode n = snapshot.node(stage.get(i));
                sb.append(n.id()).append(" (").append(n.kind()).append(')');
                if (i < stage.size() - 1)
                    sb.append(", ");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart with one subgraph per stage.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        Map<String, String> names = mermaidNames();

        for (int s = 0; s < plan.stageCount(); s++) {
            sb.append("  subgraph stage_").append(s).append("[\"Stage ").append(s).append("\"]\n");
            for (String id : plan.stage(s)) {
                OperationNode node = snapshot.node(id);
                sb.append("    ").append(names.get(id)).append("[\"").append(id)
                        .append("<br/>").append(node.kind())
                        .append("<br/>").append(describe(node.parameters().toEntries()))
                        .append("\"];\n");
            }
            sb.append("  end\n");
        }

        for (Edge e : snapshot.edges()) {
            sb.append("  ").append(names.get(e.source())).append(" --> ").append(names.get(e.target())).append(";\n");
        }
        return sb.toString();
    }

    private static String describe(List<ParameterEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (ParameterEntry e : entries) {
            if (sb.length() > 0)
                sb.append(", ");
            if (e.getColumn() != null)
                sb.append(e.getColumn());
            else
                sb.append('=').append(e.getValue());
        }
        return sb.toString().replace("\"", "'");
    }

    /**
     * Mermaid-safe names in stage order. Ids that sanitize to the same name
     * (e.g. {@code a-b} and {@code a_b}) get a numeric suffix.
     */
    private Map<String, String> mermaidNames() {
        Map<String, String> names = new HashMap<>();
        Set<String> taken = new HashSet<>();
        for (List<String> stage : plan.stages()) {
            for (String id : stage) {
                String base = sanitize(id);
                String name = base;
                for (int n = 2; !taken.add(name); n++)
                    name = base + "_" + n;
                names.put(id, name);
            }
        }
        return names;
    }

    private static String sanitize(String name) {
        return "n_" + name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
