package com.flowauto.node;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable flow graph: ordered nodes, edges, and the execution settings of
 * the generated automation.
 *
 * <p>
 * Node order carries no meaning for compilation but is kept so output diffs
 * stay stable.
 */
public record FlowGraph(String id, String name, String description, List<FlowNode> nodes,
        List<FlowEdge> edges, ExecutionSettings settings, int version) {

    public static final int SCHEMA_VERSION = 1;

    public FlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        if (settings == null)
            settings = ExecutionSettings.DEFAULT;
        if (description == null)
            description = "";
    }

    /** Returns the node with the given id, or null. */
    public FlowNode node(String nodeId) {
        for (FlowNode n : nodes)
            if (n.id().equals(nodeId))
                return n;
        return null;
    }

    public boolean contains(String nodeId) {
        return node(nodeId) != null;
    }

    public List<FlowEdge> outgoing(String nodeId) {
        List<FlowEdge> out = new ArrayList<>();
        for (FlowEdge e : edges)
            if (e.source().equals(nodeId))
                out.add(e);
        return out;
    }

    public List<FlowEdge> incoming(String nodeId) {
        List<FlowEdge> in = new ArrayList<>();
        for (FlowEdge e : edges)
            if (e.target().equals(nodeId))
                in.add(e);
        return in;
    }

    public List<TriggerNode> triggers() {
        List<TriggerNode> out = new ArrayList<>();
        for (FlowNode n : nodes)
            if (n instanceof TriggerNode t)
                out.add(t);
        return out;
    }

    public boolean hasConditions() {
        for (FlowNode n : nodes)
            if (n instanceof ConditionNode)
                return true;
        return false;
    }
}
