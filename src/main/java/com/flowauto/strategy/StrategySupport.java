package com.flowauto.strategy;

import com.flowauto.api.TranspilerStrategy;
import com.flowauto.engine.TopologyReport;
import com.flowauto.expr.ConditionCompiler;
import com.flowauto.node.*;
import com.flowauto.util.DataMaps;

import java.util.*;

/**
 * Shared pieces of the two backends: trigger rendering, step rendering and the
 * automation/script envelope.
 */
public abstract class StrategySupport implements TranspilerStrategy {

    protected final ConditionCompiler conditions;

    protected StrategySupport(ConditionCompiler conditions) {
        this.conditions = conditions;
    }

    // ── Triggers ─────────────────────────────────────────────────────

    protected List<Object> triggerList(FlowGraph graph) {
        List<Object> out = new ArrayList<>();
        for (TriggerNode t : graph.triggers())
            out.add(triggerStep(t));
        return out;
    }

    /**
     * Renders a trigger with {@code platform} first. A newer-style
     * {@code trigger} key is folded into {@code platform}.
     */
    public static Map<String, Object> triggerStep(TriggerNode trigger) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("platform", trigger.platform());
        boolean foldTriggerKey = DataMaps.string(trigger.data(), "platform") == null;
        for (Map.Entry<String, Object> e : DataMaps.withoutEmpty(trigger.data()).entrySet()) {
            if (e.getKey().equals("platform") || (foldTriggerKey && e.getKey().equals("trigger")))
                continue;
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    // ── Steps ────────────────────────────────────────────────────────

    /**
     * Renders an action, delay or wait node as a step: alias first, then
     * {@code service} for actions, then the remaining data in order.
     *
     * @param alias alias to write, or null for none
     */
    protected static Map<String, Object> nodeStep(FlowNode node, String alias) {
        Map<String, Object> data = DataMaps.withoutEmpty(node.data());
        Map<String, Object> out = new LinkedHashMap<>();
        if (alias != null)
            out.put("alias", alias);
        if (node instanceof ActionNode a)
            out.put("service", a.service());
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (!out.containsKey(e.getKey()))
                out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    // ── Envelope ─────────────────────────────────────────────────────

    /**
     * Wraps steps in an automation when the graph has triggers, otherwise in a
     * script.
     */
    protected static Map<String, Object> envelope(FlowGraph graph, List<Object> triggers, List<Object> steps) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("alias", graph.name());
        doc.put("description", graph.description());
        if (!triggers.isEmpty()) {
            doc.put("trigger", triggers);
            doc.put("action", steps);
        } else {
            doc.put("sequence", steps);
        }
        ExecutionSettings s = graph.settings();
        doc.put("mode", s.mode().wireName());
        if (s.max() != null)
            doc.put("max", s.max());
        if (s.maxExceeded() != null)
            doc.put("max_exceeded", s.maxExceeded().wireName());
        if (!triggers.isEmpty() && !s.initialState())
            doc.put("initial_state", false);
        return doc;
    }

    // ── Graph helpers ────────────────────────────────────────────────

    /**
     * First nodes to run: the successors of each trigger entry, and any
     * non-trigger entry itself. Duplicates are dropped, order kept.
     */
    protected static List<String> startNodes(FlowGraph graph, TopologyReport report) {
        Set<String> starts = new LinkedHashSet<>();
        for (String entry : report.entryNodes()) {
            if (graph.node(entry) instanceof TriggerNode) {
                for (FlowEdge e : graph.outgoing(entry))
                    starts.add(e.target());
            } else {
                starts.add(entry);
            }
        }
        return new ArrayList<>(starts);
    }

    /** Edges a condition follows when true: tagged {@code true} or untagged. */
    protected static List<FlowEdge> trueEdges(List<FlowEdge> edges) {
        List<FlowEdge> out = new ArrayList<>();
        for (FlowEdge e : edges)
            if (e.branch() != BranchTag.FALSE)
                out.add(e);
        return out;
    }

    protected static List<FlowEdge> falseEdges(List<FlowEdge> edges) {
        List<FlowEdge> out = new ArrayList<>();
        for (FlowEdge e : edges)
            if (e.branch() == BranchTag.FALSE)
                out.add(e);
        return out;
    }
}
