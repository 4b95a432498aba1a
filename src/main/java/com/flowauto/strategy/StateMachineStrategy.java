package com.flowauto.strategy;

import com.flowauto.engine.TopologyReport;
import com.flowauto.expr.ConditionCompiler;
import com.flowauto.node.*;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Encodes any graph as a dispatch loop over a program-counter variable.
 *
 * <p>
 * The output initializes {@value #PC} to the first node, then repeats a
 * {@code choose} dispatcher until the counter equals {@value #END}. Each
 * non-trigger node owns one dispatcher branch guarded by
 * {@code current_node == "<id>"}; the branch runs the node and writes the next
 * node id (or {@value #END}) to the counter. The default branch logs and writes
 * {@value #END}, so every branch assigns the counter and the loop can always
 * terminate.
 */
@Log4j2
public final class StateMachineStrategy extends StrategySupport {

    public static final String PC = "current_node";
    public static final String CONTEXT = "flow_context";
    public static final String END = "END";
    public static final String LOOP_ALIAS = "State Machine Loop";
    public static final String UNTIL = "{{ " + PC + " == \"" + END + "\" }}";

    public StateMachineStrategy() {
        this(new ConditionCompiler());
    }

    public StateMachineStrategy(ConditionCompiler conditions) {
        super(conditions);
    }

    @Override
    public String name() {
        return TopologyReport.STATE_MACHINE;
    }

    @Override
    public String description() {
        return "Generates a state-machine loop for flows with cycles, cross-links or converging paths";
    }

    @Override
    public boolean canHandle(TopologyReport report) {
        return true;
    }

    @Override
    public GeneratedDocument generate(FlowGraph graph, TopologyReport report) {
        List<String> warnings = new ArrayList<>();
        List<String> order = new ArrayList<>();
        for (FlowNode n : graph.nodes())
            order.add(n.id());
        List<Object> triggers = triggerList(graph);
        boolean script = triggers.isEmpty();

        String entry = findEntry(graph, report);
        if (entry == null) {
            warnings.add("No action nodes found after triggers");
            return new GeneratedDocument(envelope(graph, triggers, new ArrayList<>()), warnings, name(), order, script);
        }
        warnDivergentTriggers(graph, entry, warnings);

        List<Object> branches = new ArrayList<>();
        for (FlowNode node : graph.nodes()) {
            if (node instanceof TriggerNode)
                continue;
            branches.add(dispatchBranch(graph, node, warnings));
        }

        if (report.hasCycles())
            warnings.add(cycleWarning(graph));

        List<Object> steps = new ArrayList<>();
        steps.add(Map.of("variables", initialVariables(entry)));
        steps.add(loop(branches));

        log.debug("State-machine encoding of '{}': entry={}, {} branches", graph.name(), entry, branches.size());
        return new GeneratedDocument(envelope(graph, triggers, steps), warnings, name(), order, script);
    }

    /**
     * The node reached by the first entry's first edge. A non-trigger entry
     * (a graph without triggers) is itself the first node.
     */
    static String findEntry(FlowGraph graph, TopologyReport report) {
        for (String entryId : report.entryNodes()) {
            if (!(graph.node(entryId) instanceof TriggerNode))
                return entryId;
            List<FlowEdge> out = graph.outgoing(entryId);
            if (!out.isEmpty())
                return out.get(0).target();
        }
        return null;
    }

    private static void warnDivergentTriggers(FlowGraph graph, String entry, List<String> warnings) {
        for (TriggerNode t : graph.triggers()) {
            for (FlowEdge e : graph.outgoing(t.id())) {
                if (!e.target().equals(entry))
                    warnings.add("Trigger '" + t.id() + "' leads to '" + e.target()
                            + "' but every run starts at '" + entry + "'");
            }
        }
    }

    private static Map<String, Object> initialVariables(String entry) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put(PC, entry);
        vars.put(CONTEXT, new LinkedHashMap<>());
        return vars;
    }

    private static Map<String, Object> loop(List<Object> branches) {
        Map<String, Object> dispatcher = new LinkedHashMap<>();
        dispatcher.put("choose", branches);
        dispatcher.put("default", defaultBranch());

        Map<String, Object> repeat = new LinkedHashMap<>();
        repeat.put("until", UNTIL);
        repeat.put("sequence", List.of(dispatcher));

        Map<String, Object> loop = new LinkedHashMap<>();
        loop.put("alias", LOOP_ALIAS);
        loop.put("repeat", repeat);
        return loop;
    }

    private static List<Object> defaultBranch() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Flow: Unknown state \"{{ " + PC + " }}\", ending flow");
        data.put("level", "warning");
        Map<String, Object> logStep = new LinkedHashMap<>();
        logStep.put("service", "system_log.write");
        logStep.put("data", data);
        return List.of(logStep, assign(END));
    }

    // ── Dispatcher branches ──────────────────────────────────────────

    private Map<String, Object> dispatchBranch(FlowGraph graph, FlowNode node, List<String> warnings) {
        List<FlowEdge> out = graph.outgoing(node.id());
        List<Object> body = new ArrayList<>();
        if (node instanceof ConditionNode c) {
            String expr = conditions.toInline(c.condition(), warnings);
            String whenTrue = firstTarget(trueEdges(out));
            String whenFalse = firstTarget(falseEdges(out));
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("alias", NodeAliases.aliasOrDefault(node));
            step.put("variables", Map.of(PC, conditional(expr, whenTrue, whenFalse)));
            body.add(step);
        } else {
            if (out.size() > 1)
                warnings.add("Node '" + node.id() + "' has " + out.size()
                        + " outgoing edges; the state machine follows only the first");
            body.add(nodeStep(node, NodeAliases.aliasOrDefault(node)));
            body.add(assign(firstTarget(out)));
        }
        Map<String, Object> branch = new LinkedHashMap<>();
        branch.put("conditions", List.of(guard(node.id())));
        branch.put("sequence", body);
        return branch;
    }

    public static Map<String, Object> guard(String nodeId) {
        Map<String, Object> g = new LinkedHashMap<>();
        g.put("condition", "template");
        g.put("value_template", "{{ " + PC + " == \"" + nodeId + "\" }}");
        return g;
    }

    public static String conditional(String expr, String whenTrue, String whenFalse) {
        return "{% if " + expr + " %}\"" + whenTrue + "\"{% else %}\"" + whenFalse + "\"{% endif %}";
    }

    private static Map<String, Object> assign(String next) {
        return Map.of("variables", Map.of(PC, next));
    }

    private static String firstTarget(List<FlowEdge> edges) {
        return edges.isEmpty() ? END : edges.get(0).target();
    }

    private static String cycleWarning(FlowGraph graph) {
        if (!graph.hasConditions())
            return "Warning: This flow contains cycles but no conditions. "
                    + "This could result in an infinite loop. Consider adding a condition to break the cycle.";
        return "Note: This flow contains cycles. Ensure your conditions can eventually evaluate to "
                + "break the cycle, or the automation may run indefinitely.";
    }
}
