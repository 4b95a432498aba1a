package com.flowauto.validate;

import com.flowauto.node.*;
import com.flowauto.validate.ValidationError.Code;

import java.util.*;

/**
 * Schema and structural checks shared by compilation and decompilation.
 *
 * <p>
 * Both layers collect every problem they find rather than stopping at the
 * first one.
 */
public final class FlowValidator {

    /** Service names that are script steps rather than {@code domain.service} calls. */
    public static final Set<String> PSEUDO_SERVICES = Set.of(
            "variables", "delay", "wait", "wait_template", "wait_for_trigger", "stop", "repeat", "choose", "if");

    private final NodeDataSchema schema = new NodeDataSchema();

    public ValidationResult validate(FlowGraph graph) {
        ValidationResult schemaResult = validateSchema(graph);
        if (!schemaResult.isValid())
            return schemaResult;
        return validateStructure(graph);
    }

    public ValidationResult validateSchema(FlowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        if (graph.name() == null || graph.name().isEmpty())
            errors.add(new ValidationError(Code.REQUIRED, "name", "Graph name is required"));
        for (FlowNode node : graph.nodes()) {
            if (node.id() == null || node.id().isEmpty()) {
                errors.add(new ValidationError(Code.REQUIRED, "nodes", "Node id is required"));
                continue;
            }
            schema.check(node.kind(), node.data(), "nodes." + node.id() + ".data", errors);
        }
        return new ValidationResult(errors);
    }

    public ValidationResult validateStructure(FlowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        Map<String, FlowNode> byId = new HashMap<>();
        for (FlowNode node : graph.nodes()) {
            if (byId.putIfAbsent(node.id(), node) != null)
                errors.add(new ValidationError(Code.DUPLICATE_NODE_ID, "nodes." + node.id(),
                        "Duplicate node id \"" + node.id() + "\""));
        }

        for (FlowEdge edge : graph.edges()) {
            String path = "edges." + edge.id();
            FlowNode source = byId.get(edge.source());
            FlowNode target = byId.get(edge.target());
            if (source == null)
                errors.add(new ValidationError(Code.DANGLING_EDGE, path + ".source",
                        "Edge " + edge.id() + " references non-existent source node: " + edge.source()));
            if (target == null)
                errors.add(new ValidationError(Code.DANGLING_EDGE, path + ".target",
                        "Edge " + edge.id() + " references non-existent target node: " + edge.target()));
            if (target instanceof TriggerNode)
                errors.add(new ValidationError(Code.TRIGGER_HAS_INCOMING, path,
                        "Trigger node " + edge.target() + " should not have incoming edges"));
            if (source != null && !(source instanceof ConditionNode) && edge.isTagged())
                errors.add(new ValidationError(Code.BRANCH_ON_NON_CONDITION, path,
                        "Edge " + edge.id() + " carries branch '" + edge.branch().wireName()
                                + "' but its source is not a condition"));
        }

        for (FlowNode node : graph.nodes()) {
            if (node instanceof ConditionNode && graph.outgoing(node.id()).isEmpty())
                errors.add(new ValidationError(Code.CONDITION_NO_EDGES, "nodes." + node.id(),
                        "Condition node \"" + node.id() + "\" has no outgoing edges"));
            if (node instanceof ActionNode a && !isValidService(a.service()))
                errors.add(new ValidationError(Code.INVALID_SERVICE, "nodes." + node.id() + ".data.service",
                        "Action node \"" + node.id() + "\" has invalid service format: \"" + a.service()
                                + "\". Expected \"domain.service\""));
        }

        errors.addAll(orphans(graph, byId));
        return new ValidationResult(errors);
    }

    static boolean isValidService(String service) {
        if (service == null)
            return false;
        int dot = service.indexOf('.');
        if (dot > 0 && dot < service.length() - 1)
            return true;
        return PSEUDO_SERVICES.contains(service);
    }

    /**
     * Nodes not reachable from any trigger. A graph without triggers is measured
     * from its entry nodes instead.
     */
    private static List<ValidationError> orphans(FlowGraph graph, Map<String, FlowNode> byId) {
        Deque<String> queue = new ArrayDeque<>();
        for (TriggerNode t : graph.triggers())
            queue.add(t.id());
        if (queue.isEmpty()) {
            Set<String> targets = new HashSet<>();
            for (FlowEdge e : graph.edges())
                targets.add(e.target());
            for (FlowNode n : graph.nodes())
                if (!targets.contains(n.id()))
                    queue.add(n.id());
        }

        Set<String> reached = new HashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!reached.add(id))
                continue;
            for (FlowEdge e : graph.outgoing(id))
                if (byId.containsKey(e.target()) && !reached.contains(e.target()))
                    queue.add(e.target());
        }

        List<ValidationError> errors = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (FlowNode n : graph.nodes()) {
            if (n instanceof TriggerNode || reached.contains(n.id()) || !reported.add(n.id()))
                continue;
            errors.add(new ValidationError(Code.ORPHANED_NODE, "nodes." + n.id(),
                    "Node \"" + n.id() + "\" is not connected to any trigger"));
        }
        return errors;
    }
}
