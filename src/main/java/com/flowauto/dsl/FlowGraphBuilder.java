package com.flowauto.dsl;

import com.flowauto.node.*;

import java.util.*;

/**
 * Flow Builder -- fluent API for assembling graphs in code.
 *
 * Usage Pattern:
 * 1. Create a builder: FlowGraphBuilder g = FlowGraphBuilder.create("Porch light");
 * 2. Add nodes: g.stateTrigger("t1", "binary_sensor.motion", "on");
 * 3. Wire them: g.edge("t1", "a1");
 * 4. Build: FlowGraph graph = g.build();
 *
 * Node ids must be unique. Edge ids are derived from their endpoints so
 * graphs built twice compare equal.
 */
public final class FlowGraphBuilder {
    private final String name;
    private String id;
    private String description = "";
    private ExecutionSettings settings = ExecutionSettings.DEFAULT;
    private int version = FlowGraph.SCHEMA_VERSION;

    private final List<FlowNode> nodes = new ArrayList<>();
    private final Set<String> nodeIds = new HashSet<>();
    private final List<FlowEdge> edges = new ArrayList<>();

    // Flag to prevent modification after building
    private boolean built;

    private FlowGraphBuilder(String name) {
        this.name = name;
        this.id = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }

    public static FlowGraphBuilder create(String name) {
        return new FlowGraphBuilder(name);
    }

    public FlowGraphBuilder id(String id) {
        checkNotBuilt();
        this.id = id;
        return this;
    }

    public FlowGraphBuilder description(String description) {
        checkNotBuilt();
        this.description = description;
        return this;
    }

    public FlowGraphBuilder settings(ExecutionSettings settings) {
        checkNotBuilt();
        this.settings = settings;
        return this;
    }

    public FlowGraphBuilder version(int version) {
        checkNotBuilt();
        this.version = version;
        return this;
    }

    // ── Triggers ─────────────────────────────────────────────────

    /**
     * Adds a trigger of any platform.
     *
     * @param fields alternating key/value pairs, e.g. {@code "at", "07:00:00"}
     */
    public FlowGraphBuilder trigger(String nodeId, String platform, Object... fields) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("platform", platform);
        data.putAll(pairs(fields));
        return node(new TriggerNode(nodeId, Position.ORIGIN, data));
    }

    /** State-change trigger; {@code to} may be null for any change. */
    public FlowGraphBuilder stateTrigger(String nodeId, String entityId, String to) {
        return to == null
                ? trigger(nodeId, "state", "entity_id", entityId)
                : trigger(nodeId, "state", "entity_id", entityId, "to", to);
    }

    // ── Conditions ───────────────────────────────────────────────

    public FlowGraphBuilder condition(String nodeId, Condition condition) {
        return node(new ConditionNode(nodeId, Position.ORIGIN, condition));
    }

    public FlowGraphBuilder stateCondition(String nodeId, String entityId, String state) {
        return condition(nodeId, Condition.of(ConditionType.STATE, Map.of("entity_id", entityId, "state", state)));
    }

    public FlowGraphBuilder templateCondition(String nodeId, String template) {
        return condition(nodeId, Condition.of(ConditionType.TEMPLATE, Map.of("template", template)));
    }

    // ── Steps ────────────────────────────────────────────────────

    /** Service call aimed at a single entity; {@code entityId} may be null. */
    public FlowGraphBuilder action(String nodeId, String service, String entityId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("service", service);
        if (entityId != null)
            data.put("target", Map.of("entity_id", entityId));
        return node(new ActionNode(nodeId, Position.ORIGIN, data));
    }

    /** Service call from raw node data; {@code service} is required. */
    public FlowGraphBuilder action(String nodeId, Map<String, Object> data) {
        return node(new ActionNode(nodeId, Position.ORIGIN, data));
    }

    /** Delay with a duration string such as {@code 00:05:00}. */
    public FlowGraphBuilder delay(String nodeId, String duration) {
        return node(new DelayNode(nodeId, Position.ORIGIN, Map.of("delay", duration)));
    }

    public FlowGraphBuilder waitTemplate(String nodeId, String template, String timeout) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("wait_template", template);
        if (timeout != null)
            data.put("timeout", timeout);
        return node(new WaitNode(nodeId, Position.ORIGIN, data));
    }

    /** Adds a node built elsewhere, e.g. with a preset position. */
    public FlowGraphBuilder node(FlowNode node) {
        checkNotBuilt();
        if (!nodeIds.add(node.id()))
            throw new IllegalArgumentException("Duplicate node id: " + node.id());
        nodes.add(node);
        return this;
    }

    /** Places an already added node. */
    public FlowGraphBuilder at(String nodeId, double x, double y) {
        checkNotBuilt();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(nodeId)) {
                nodes.set(i, nodes.get(i).withPosition(new Position(x, y)));
                return this;
            }
        }
        throw new IllegalArgumentException("Unknown node: " + nodeId);
    }

    // ── Edges ────────────────────────────────────────────────────

    public FlowGraphBuilder edge(String source, String target) {
        return edge(source, target, null);
    }

    /** Adds an edge leaving {@code source} by the given branch; null for none. */
    public FlowGraphBuilder edge(String source, String target, BranchTag branch) {
        checkNotBuilt();
        String edgeId = "e-" + source + "-" + target + (branch == null ? "" : "-" + branch.wireName());
        edges.add(new FlowEdge(edgeId, source, target, branch));
        return this;
    }

    public FlowGraphBuilder whenTrue(String condition, String target) {
        return edge(condition, target, BranchTag.TRUE);
    }

    public FlowGraphBuilder whenFalse(String condition, String target) {
        return edge(condition, target, BranchTag.FALSE);
    }

    /** Chains nodes with untagged edges: {@code chain("a", "b", "c")}. */
    public FlowGraphBuilder chain(String... nodeIdsInOrder) {
        for (int i = 1; i < nodeIdsInOrder.length; i++)
            edge(nodeIdsInOrder[i - 1], nodeIdsInOrder[i]);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Freezes the graph. No structural validation happens here; graphs are
     * validated when compiled.
     */
    public FlowGraph build() {
        checkNotBuilt();
        built = true;
        return new FlowGraph(id, name, description, nodes, edges, settings, version);
    }

    private static Map<String, Object> pairs(Object[] fields) {
        if (fields.length % 2 != 0)
            throw new IllegalArgumentException("Fields must be key/value pairs");
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < fields.length; i += 2)
            out.put(String.valueOf(fields[i]), fields[i + 1]);
        return out;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}
