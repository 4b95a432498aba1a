package com.flowauto.util;

import com.flowauto.engine.TopologyReport;
import com.flowauto.node.*;

/**
 * Diagnostic utility for inspecting a flow graph and its analysis.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging rejected graphs, or
 * embedding a diagram in documentation. Allocates freely.
 */
public final class GraphExplain {
    private final FlowGraph graph;
    private final TopologyReport report;

    public GraphExplain(FlowGraph graph) {
        this(graph, null);
    }

    public GraphExplain(FlowGraph graph, TopologyReport report) {
        this.graph = graph;
        this.report = report;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        FlowNode node = graph.node(nodeId);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Kind: ").append(node.kind().wireName()).append('\n')
                .append("  Alias: ").append(node.alias() == null ? "-" : node.alias()).append('\n')
                .append("  Position: ").append(node.position().x()).append(", ").append(node.position().y())
                .append('\n');
        if (report != null)
            sb.append("  Entry: ").append(report.entryNodes().contains(nodeId))
                    .append(", Exit: ").append(report.exitNodes().contains(nodeId)).append('\n');
        var out = graph.outgoing(nodeId);
        sb.append("  Successors (").append(out.size()).append("): ");
        for (int i = 0; i < out.size(); i++) {
            sb.append(out.get(i).target());
            if (out.get(i).isTagged())
                sb.append('[').append(out.get(i).branch().wireName()).append(']');
            if (i < out.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire graph in dot-like text format, followed by the topology
     * flags when a report is available.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.nodes().size()).append(" nodes):\n");
        for (int i = 0; i < graph.nodes().size(); i++) {
            FlowNode node = graph.nodes().get(i);
            sb.append("  [").append(i).append("] ").append(node.id()).append(" (").append(node.kind().wireName())
                    .append(')');
            var out = graph.outgoing(node.id());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    FlowEdge e = out.get(j);
                    sb.append(e.target());
                    if (e.isTagged())
                        sb.append('[').append(e.branch().wireName()).append(']');
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        if (report != null) {
            sb.append("Topology: tree=").append(report.isTree())
                    .append(", cycles=").append(report.hasCycles())
                    .append(", crossLinks=").append(report.hasCrossLinks())
                    .append(", convergingPaths=").append(report.hasConvergingPaths())
                    .append(", multipleEntries=").append(report.hasMultipleEntryPoints())
                    .append(", divergentTriggers=").append(report.hasDivergentTriggerPaths())
                    .append('\n')
                    .append("Recommended: ").append(report.recommendedStrategy()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS flowchart.
     * <p>
     * Conditions render as diamonds and triggers as stadiums; branch tags
     * become edge labels.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");

        for (FlowNode node : graph.nodes()) {
            String label = escape(node.alias() != null ? node.alias() : node.id());
            sb.append("  ").append(sanitize(node.id()));
            switch (node.kind()) {
                case TRIGGER -> sb.append("([\"").append(label).append("\"]);\n");
                case CONDITION -> sb.append("{\"").append(label).append("\"};\n");
                default -> sb.append("[\"").append(label).append("\"];\n");
            }
        }

        for (FlowEdge e : graph.edges()) {
            sb.append("  ").append(sanitize(e.source()));
            if (e.isTagged())
                sb.append(" -- \"").append(e.branch().wireName()).append("\" --> ");
            else
                sb.append(" --> ");
            sb.append(sanitize(e.target())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }
}
