package com.flowauto.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flowauto.api.LayoutEngine;
import com.flowauto.engine.TopologyReport;
import com.flowauto.expr.ConditionCompiler;
import com.flowauto.expr.TemplatePatterns;
import com.flowauto.node.*;
import com.flowauto.strategy.NodeAliases;
import com.flowauto.strategy.StateMachineStrategy;
import com.flowauto.util.DataMaps;
import com.flowauto.validate.FlowValidator;
import com.flowauto.validate.ValidationResult;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Decompiles automation YAML back into a flow graph.
 *
 * <p>
 * Documents produced by the state-machine backend are recognized by their
 * initialization step and dispatch loop and rebuilt from the dispatcher
 * branches. Everything else is walked as native nested blocks. Round-trip
 * metadata, when present, restores node ids and positions; otherwise ids are
 * generated and the configured {@link LayoutEngine} places the nodes.
 *
 * <p>
 * Unrecognized steps never fail the parse. They become placeholder action
 * nodes that keep the original payload, and a warning is reported.
 */
@Log4j2
public final class FlowYamlParser {

    public static final String DEFAULT_NAME = "Imported Automation";
    public static final String UNKNOWN_SERVICE = "unknown.unknown";

    private static final Pattern GUARD = Pattern
            .compile("\\{\\{\\s*" + StateMachineStrategy.PC + "\\s*==\\s*[\"']([^\"']+)[\"']\\s*\\}\\}");
    private static final Pattern CONDITIONAL = Pattern.compile(
            "\\{%-?\\s*if\\s+(.+?)\\s*-?%\\}\\s*[\"']([^\"']*)[\"']\\s*\\{%-?\\s*else\\s*-?%\\}\\s*[\"']([^\"']*)[\"']\\s*\\{%-?\\s*endif\\s*-?%\\}",
            Pattern.DOTALL);

    private final YamlCodec yaml;
    private final LayoutEngine layout;
    private final ConditionCompiler conditions;
    private final TemplatePatterns patterns;
    private final FlowValidator validator;

    public FlowYamlParser() {
        this(new SequentialLayout());
    }

    public FlowYamlParser(LayoutEngine layout) {
        this(new YamlCodec(), layout, new ConditionCompiler(), new TemplatePatterns(), new FlowValidator());
    }

    public FlowYamlParser(YamlCodec yaml, LayoutEngine layout, ConditionCompiler conditions,
            TemplatePatterns patterns, FlowValidator validator) {
        this.yaml = yaml;
        this.layout = layout;
        this.conditions = conditions;
        this.patterns = patterns;
        this.validator = validator;
    }

    public ParseResult parse(String text) {
        List<String> warnings = new ArrayList<>();
        Object root;
        try {
            root = yaml.read(text);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable YAML: {}", e.getOriginalMessage());
            return ParseResult.failure(List.of("Invalid YAML: " + e.getOriginalMessage()), warnings, false, null);
        }
        Map<String, Object> rootMap = DataMaps.map(root);
        if (rootMap == null)
            return ParseResult.failure(List.of("Invalid YAML structure"), warnings, false, null);

        Map<String, Object> content = unwrapScript(rootMap);
        RoundTripMetadata metadata = RoundTripMetadata.extract(content);
        if (metadata == null && content != rootMap)
            metadata = RoundTripMetadata.extract(rootMap);
        boolean hadMetadata = metadata != null;
        if (!hadMetadata && hasMetadataKey(content))
            warnings.add("Ignoring malformed round-trip metadata");

        List<Object> steps = firstList(content, "action", "actions", "sequence");
        boolean stateMachine = isStateMachine(steps);
        String format = stateMachine ? TopologyReport.STATE_MACHINE : TopologyReport.NATIVE;
        log.debug("Decompiling {} document (metadata: {})", format, hadMetadata);

        Reconstruction r = new Reconstruction(metadata, warnings);
        List<Object> triggers = firstList(content, "trigger", "triggers");
        if (triggers.isEmpty() && !content.containsKey("sequence"))
            warnings.add("No triggers found in automation");
        if (stateMachine)
            r.stateMachine(triggers, steps);
        else
            r.nativeBlocks(triggers, firstList(content, "condition", "conditions"), steps);

        List<FlowNode> nodes = place(r.orderedNodes(), r.edges, metadata);
        FlowGraph graph = new FlowGraph(
                metadata != null && metadata.graphId() != null ? metadata.graphId() : derivedId(text),
                nonEmpty(DataMaps.string(content, "alias"), DEFAULT_NAME),
                nonEmpty(DataMaps.string(content, "description"), ""),
                nodes,
                r.edges,
                settings(content),
                metadata != null && metadata.graphVersion() != null ? metadata.graphVersion()
                        : FlowGraph.SCHEMA_VERSION);

        ValidationResult validation = validator.validate(graph);
        if (!validation.isValid()) {
            log.debug("Decompiled graph failed validation with {} errors", validation.errors().size());
            return ParseResult.failure(validation.messages(), warnings, hadMetadata, format);
        }
        return ParseResult.success(graph, warnings, hadMetadata, format);
    }

    // ── Document envelope ────────────────────────────────────────────

    /** Accepts {@code script: {name: {...}}} and {@code script: {...}} wrappers. */
    private static Map<String, Object> unwrapScript(Map<String, Object> root) {
        Map<String, Object> script = DataMaps.map(root.get("script"));
        if (script == null || root.containsKey("sequence") || root.containsKey("action"))
            return root;
        if (script.containsKey("sequence"))
            return script;
        for (Object v : script.values()) {
            Map<String, Object> m = DataMaps.map(v);
            if (m != null)
                return m;
        }
        return root;
    }

    private static boolean hasMetadataKey(Map<String, Object> content) {
        Map<String, Object> vars = DataMaps.map(content.get("variables"));
        return vars != null && (vars.containsKey(RoundTripMetadata.KEY) || vars.containsKey(RoundTripMetadata.LEGACY_KEY));
    }

    private static List<Object> firstList(Map<String, Object> content, String... keys) {
        for (String k : keys)
            if (content.containsKey(k) && content.get(k) != null)
                return DataMaps.asList(content.get(k));
        return List.of();
    }

    /**
     * The state-machine signature: a step initializing both the program counter
     * and the context map, plus a repeat loop whose body holds a dispatcher.
     */
    static boolean isStateMachine(List<Object> steps) {
        return initStep(steps) != null && dispatcher(steps) != null;
    }

    private static Map<String, Object> initStep(List<Object> steps) {
        for (Object s : steps) {
            Map<String, Object> vars = DataMaps.map(DataMaps.map(s) == null ? null : DataMaps.map(s).get("variables"));
            if (vars != null && vars.containsKey(StateMachineStrategy.PC) && vars.containsKey(StateMachineStrategy.CONTEXT))
                return vars;
        }
        return null;
    }

    private static Map<String, Object> dispatcher(List<Object> steps) {
        for (Object s : steps) {
            Map<String, Object> step = DataMaps.map(s);
            Map<String, Object> repeat = step == null ? null : DataMaps.map(step.get("repeat"));
            if (repeat == null)
                continue;
            for (Object inner : DataMaps.asList(repeat.get("sequence"))) {
                Map<String, Object> m = DataMaps.map(inner);
                if (m != null && m.get("choose") instanceof List)
                    return m;
            }
        }
        return null;
    }

    private static ExecutionSettings settings(Map<String, Object> content) {
        ExecutionMode mode = content.get("mode") instanceof String s ? ExecutionMode.fromWire(s) : null;
        Integer max = content.get("max") instanceof Number n ? n.intValue() : null;
        OverflowPolicy overflow = content.get("max_exceeded") instanceof String s ? OverflowPolicy.fromWire(s) : null;
        boolean initial = !Boolean.FALSE.equals(content.get("initial_state"));
        return new ExecutionSettings(mode, max, overflow, initial);
    }

    private static String derivedId(String text) {
        return UUID.nameUUIDFromBytes(text.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String nonEmpty(String value, String fallback) {
        return value == null ? fallback : value;
    }

    // ── Positions ────────────────────────────────────────────────────

    private List<FlowNode> place(List<FlowNode> nodes, List<FlowEdge> edges, RoundTripMetadata metadata) {
        List<FlowNode> unplaced = new ArrayList<>();
        for (FlowNode n : nodes)
            if (metadata == null || !metadata.nodes().containsKey(n.id()))
                unplaced.add(n);
        Map<String, Position> fallback = unplaced.isEmpty() ? Map.of() : layout.layout(unplaced, edges);
        if (!unplaced.isEmpty())
            log.debug("Fallback layout placed {} of {} nodes", unplaced.size(), nodes.size());

        List<FlowNode> out = new ArrayList<>(nodes.size());
        for (FlowNode n : nodes) {
            Position p = metadata != null ? metadata.nodes().get(n.id()) : null;
            if (p == null)
                p = fallback.getOrDefault(n.id(), Position.ORIGIN);
            out.add(n.withPosition(p));
        }
        return out;
    }

    // ── Reconstruction ───────────────────────────────────────────────

    /** Where the next step attaches: a node, and the branch it leaves by. */
    private record OpenEnd(String nodeId, BranchTag branch) {
    }

    /** Per-call reconstruction state. */
    private final class Reconstruction {
        private final RoundTripMetadata metadata;
        private final List<String> warnings;
        private final List<String> metadataIds;
        private final List<FlowNode> nodes = new ArrayList<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private final Set<String> usedIds = new HashSet<>();
        private int positional;
        private int generated;

        Reconstruction(RoundTripMetadata metadata, List<String> warnings) {
            this.metadata = metadata;
            this.warnings = warnings;
            this.metadataIds = metadata != null ? metadata.nodeIds() : List.of();
        }

        /**
         * Nodes in the recorded graph order when metadata carries one, else in
         * metadata position order, else in discovery order.
         */
        List<FlowNode> orderedNodes() {
            if (metadata == null)
                return nodes;
            List<String> order = metadata.nodeOrder() != null ? metadata.nodeOrder() : metadataIds;
            List<FlowNode> sorted = new ArrayList<>(nodes);
            sorted.sort(Comparator.comparingInt(n -> {
                int i = order.indexOf(n.id());
                return i < 0 ? Integer.MAX_VALUE : i;
            }));
            return sorted;
        }

        // ── ids and edges

        /** Next id: the next unused metadata id by position, else a generated one. */
        private String positionalId(NodeKind kind) {
            while (positional < metadataIds.size()) {
                String id = metadataIds.get(positional++);
                if (usedIds.add(id))
                    return id;
            }
            return generatedId(kind.wireName());
        }

        private String generatedId(String prefix) {
            String id;
            do {
                id = prefix + "_" + (++generated);
            } while (!usedIds.add(id));
            return id;
        }

        private void addEdge(String source, String target, BranchTag branch) {
            String id = "e-" + source + "-" + target + (branch == null ? "" : "-" + branch.wireName());
            String unique = id;
            for (int n = 2; containsEdgeId(unique); n++)
                unique = id + "-" + n;
            edges.add(new FlowEdge(unique, source, target, branch));
        }

        private boolean containsEdgeId(String id) {
            for (FlowEdge e : edges)
                if (e.id().equals(id))
                    return true;
            return false;
        }

        private void connect(List<OpenEnd> ends, String target) {
            for (OpenEnd end : ends)
                addEdge(end.nodeId(), target, end.branch());
        }

        // ── shared node builders

        private TriggerNode trigger(String id, Object raw) {
            Map<String, Object> m = DataMaps.map(raw);
            Map<String, Object> data = new LinkedHashMap<>();
            if (m == null) {
                warnings.add("Trigger '" + id + "' is not an object and was kept as a template trigger");
                data.put("platform", "template");
                data.put("value_template", String.valueOf(raw));
            } else {
                boolean fold = DataMaps.string(m, "platform") == null;
                for (Map.Entry<String, Object> e : m.entrySet()) {
                    if (fold && e.getKey().equals("trigger"))
                        data.put("platform", e.getValue());
                    else
                        data.put(e.getKey(), e.getValue());
                }
            }
            return new TriggerNode(id, Position.ORIGIN, data);
        }

        private ActionNode opaque(String id, Map<String, Object> raw) {
            Object label = raw.get("service") != null ? raw.get("service") : raw.get("platform");
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("alias", "Unknown: " + (label != null ? label : "Node"));
            data.put("service", UNKNOWN_SERVICE);
            data.put("data", new LinkedHashMap<>(raw));
            return new ActionNode(id, Position.ORIGIN, data);
        }

        /**
         * Builds one condition from a list of structured conditions: a single entry
         * as itself, several as an {@code and} group.
         */
        private Condition conditionFrom(List<Object> raw, String alias) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (Object o : raw) {
                if (o instanceof String template) {
                    Map<String, Object> t = new LinkedHashMap<>();
                    t.put("condition", "template");
                    t.put("value_template", template);
                    items.add(t);
                } else if (DataMaps.map(o) != null) {
                    items.add(DataMaps.map(o));
                }
            }
            Condition c;
            if (items.isEmpty()) {
                warnings.add("Empty condition list read as an always-true template");
                c = Condition.of(ConditionType.TEMPLATE, Map.of("template", "{{ true }}"));
            } else if (items.size() == 1) {
                c = conditions.fromStructured(items.get(0), warnings);
            } else {
                Map<String, Object> group = new LinkedHashMap<>();
                group.put("condition", "and");
                group.put("conditions", new ArrayList<Object>(items));
                c = conditions.fromStructured(group, warnings);
            }
            return alias == null ? c : withLeadingAlias(c, alias);
        }

        // ── native path

        void nativeBlocks(List<Object> rawTriggers, List<Object> rawConditions, List<Object> steps) {
            List<OpenEnd> ends = new ArrayList<>();
            for (Object t : rawTriggers) {
                TriggerNode node = trigger(positionalId(NodeKind.TRIGGER), t);
                nodes.add(node);
                ends.add(new OpenEnd(node.id(), null));
            }
            for (Object c : rawConditions) {
                String id = positionalId(NodeKind.CONDITION);
                nodes.add(new ConditionNode(id, Position.ORIGIN, conditionFrom(List.of(c), null)));
                connect(ends, id);
                ends = List.of(new OpenEnd(id, BranchTag.TRUE));
            }
            walk(steps, ends);
        }

        /** Lowers a step list attached to {@code ends}; returns the new open ends. */
        private List<OpenEnd> walk(List<Object> steps, List<OpenEnd> ends) {
            List<OpenEnd> current = ends;
            for (int i = 0; i < steps.size(); i++) {
                current = lower(ActionShapes.parse(steps.get(i)), i, current);
            }
            return current;
        }

        private List<OpenEnd> lower(ActionShape shape, int index, List<OpenEnd> ends) {
            if (shape instanceof ActionShape.Delay d)
                return simple(NodeKind.DELAY, d.data(), ends);
            if (shape instanceof ActionShape.Wait w)
                return simple(NodeKind.WAIT, w.data(), ends);
            if (shape instanceof ActionShape.ServiceCall s)
                return simple(NodeKind.ACTION, s.data(), ends);
            if (shape instanceof ActionShape.If b)
                return ifBlock(b, ends);
            if (shape instanceof ActionShape.Choose c)
                return chooseBlock(c, ends);
            if (shape instanceof ActionShape.Parallel p)
                return parallelBlock(p, ends);
            if (shape instanceof ActionShape.Transition t)
                return unknown(Map.of("variables", Map.of(StateMachineStrategy.PC, t.value())), index, ends);
            return unknown(((ActionShape.Unknown) shape).data(), index, ends);
        }

        private List<OpenEnd> simple(NodeKind kind, Map<String, Object> data, List<OpenEnd> ends) {
            String id = positionalId(kind);
            nodes.add(FlowNode.of(kind, id, Position.ORIGIN, data));
            connect(ends, id);
            return List.of(new OpenEnd(id, null));
        }

        private List<OpenEnd> unknown(Map<String, Object> raw, int index, List<OpenEnd> ends) {
            warnings.add("Unknown action type at index " + index);
            String id = positionalId(NodeKind.ACTION);
            nodes.add(opaque(id, raw));
            connect(ends, id);
            return List.of(new OpenEnd(id, null));
        }

        private List<OpenEnd> ifBlock(ActionShape.If block, List<OpenEnd> ends) {
            String id = positionalId(NodeKind.CONDITION);
            nodes.add(new ConditionNode(id, Position.ORIGIN, conditionFrom(block.conditions(), block.alias())));
            connect(ends, id);

            List<OpenEnd> out = new ArrayList<>(walk(block.thenSteps(), List.of(new OpenEnd(id, BranchTag.TRUE))));
            List<Object> elseSteps = block.elseSteps() == null ? List.of() : block.elseSteps();
            out.addAll(walk(elseSteps, List.of(new OpenEnd(id, BranchTag.FALSE))));
            return out;
        }

        /**
         * Options chain through their {@code false} edges: option i is tested when
         * option i-1 fails, and the default runs when the last one fails.
         */
        private List<OpenEnd> chooseBlock(ActionShape.Choose block, List<OpenEnd> ends) {
            List<Object> dflt = block.defaultSteps() == null ? List.of() : block.defaultSteps();
            if (block.options().isEmpty())
                return walk(dflt, ends);

            List<OpenEnd> out = new ArrayList<>();
            List<OpenEnd> incoming = ends;
            for (ActionShape.Option option : block.options()) {
                String alias = option.alias() != null ? option.alias() : block.alias();
                String id = positionalId(NodeKind.CONDITION);
                nodes.add(new ConditionNode(id, Position.ORIGIN, conditionFrom(option.conditions(), alias)));
                connect(incoming, id);
                out.addAll(walk(option.steps(), List.of(new OpenEnd(id, BranchTag.TRUE))));
                incoming = List.of(new OpenEnd(id, BranchTag.FALSE));
            }
            out.addAll(walk(dflt, incoming));
            return out;
        }

        private List<OpenEnd> parallelBlock(ActionShape.Parallel block, List<OpenEnd> ends) {
            if (block.branches().isEmpty())
                return ends;
            Set<OpenEnd> out = new LinkedHashSet<>();
            for (List<Object> branch : block.branches())
                out.addAll(walk(branch, ends));
            return new ArrayList<>(out);
        }

        // ── state-machine path

        void stateMachine(List<Object> rawTriggers, List<Object> steps) {
            Map<String, Object> init = initStep(steps);
            Object entryValue = init.get(StateMachineStrategy.PC);
            String entry = entryValue == null ? null : String.valueOf(entryValue);

            List<Dispatch> dispatches = new ArrayList<>();
            for (Object b : DataMaps.asList(dispatcher(steps).get("choose"))) {
                Dispatch d = dispatchBranch(DataMaps.map(b));
                if (d != null) {
                    usedIds.add(d.node().id());
                    dispatches.add(d);
                }
            }

            List<TriggerNode> triggers = new ArrayList<>();
            for (Object t : rawTriggers)
                triggers.add(trigger(positionalId(NodeKind.TRIGGER), t));
            nodes.addAll(triggers);
            for (Dispatch d : dispatches)
                nodes.add(d.node());

            if (entry != null && !StateMachineStrategy.END.equals(entry))
                for (TriggerNode t : triggers)
                    addEdge(t.id(), entry, null);
            for (Dispatch d : dispatches) {
                boolean condition = d.node() instanceof ConditionNode;
                if (d.whenTrue() != null && !StateMachineStrategy.END.equals(d.whenTrue()))
                    addEdge(d.node().id(), d.whenTrue(), condition ? BranchTag.TRUE : null);
                if (d.whenFalse() != null && !StateMachineStrategy.END.equals(d.whenFalse()))
                    addEdge(d.node().id(), d.whenFalse(), BranchTag.FALSE);
            }
        }

        /** One decoded dispatcher branch; {@code whenFalse} is set only for conditions. */
        private record Dispatch(FlowNode node, String whenTrue, String whenFalse) {
        }

        private Dispatch dispatchBranch(Map<String, Object> branch) {
            if (branch == null) {
                warnings.add("Skipping dispatcher branch that is not an object");
                return null;
            }
            String id = guardId(DataMaps.asList(branch.get("conditions")));
            if (id == null) {
                warnings.add("Skipping dispatcher branch without a recognizable node guard");
                return null;
            }

            ActionShape.Transition transition = null;
            List<ActionShape> work = new ArrayList<>();
            for (Object step : DataMaps.asList(branch.get("sequence"))) {
                ActionShape shape = ActionShapes.parse(step);
                if (shape instanceof ActionShape.Transition t)
                    transition = t;
                else
                    work.add(shape);
            }
            String next = transition != null ? transition.value() : StateMachineStrategy.END;

            if (work.isEmpty() && transition != null) {
                Matcher m = CONDITIONAL.matcher(transition.value().trim());
                if (m.matches()) {
                    Condition c = patterns.recognize(m.group(1));
                    if (!patterns.isRecognized(m.group(1)))
                        warnings.add("Condition of node '" + id + "' kept as template: " + m.group(1));
                    String alias = transition.alias();
                    if (alias != null && !NodeAliases.isDefault(alias, NodeKind.CONDITION, Map.of()))
                        c = withLeadingAlias(c, alias);
                    return new Dispatch(new ConditionNode(id, Position.ORIGIN, c), m.group(2), m.group(3));
                }
            }

            if (work.size() == 1) {
                FlowNode node = workNode(id, work.get(0));
                return new Dispatch(node, next, null);
            }

            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("sequence", DataMaps.asList(branch.get("sequence")));
            return new Dispatch(unrecognized(id, raw), next, null);
        }

        private FlowNode workNode(String id, ActionShape shape) {
            if (shape instanceof ActionShape.Delay d)
                return FlowNode.of(NodeKind.DELAY, id, Position.ORIGIN, withoutDefaultAlias(NodeKind.DELAY, d.data()));
            if (shape instanceof ActionShape.Wait w)
                return FlowNode.of(NodeKind.WAIT, id, Position.ORIGIN, withoutDefaultAlias(NodeKind.WAIT, w.data()));
            if (shape instanceof ActionShape.ServiceCall s)
                return FlowNode.of(NodeKind.ACTION, id, Position.ORIGIN, withoutDefaultAlias(NodeKind.ACTION, s.data()));
            if (shape instanceof ActionShape.Unknown u)
                return unrecognized(id, u.data());
            return unrecognized(id, Map.of("step", stepKind(shape)));
        }

        private ActionNode unrecognized(String id, Map<String, Object> raw) {
            warnings.add("Unrecognized dispatcher body for node '" + id + "' kept as placeholder action");
            return opaque(id, raw);
        }

        private String stepKind(ActionShape shape) {
            return shape.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        }

        private String guardId(List<Object> guards) {
            for (Object g : guards) {
                String template = g instanceof String s ? s : DataMaps.string(DataMaps.map(g) == null ? Map.of() : DataMaps.map(g), "value_template");
                if (template == null)
                    continue;
                Matcher m = GUARD.matcher(template.trim());
                if (m.matches())
                    return m.group(1);
            }
            return null;
        }
    }

    private static Map<String, Object> withoutDefaultAlias(NodeKind kind, Map<String, Object> data) {
        String alias = DataMaps.string(data, "alias");
        if (!NodeAliases.isDefault(alias, kind, data))
            return data;
        Map<String, Object> out = new LinkedHashMap<>(data);
        out.remove("alias");
        return out;
    }

    private static Condition withLeadingAlias(Condition c, String alias) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("alias", alias);
        for (Map.Entry<String, Object> e : c.fields().entrySet())
            if (!e.getKey().equals("alias"))
                fields.put(e.getKey(), e.getValue());
        return new Condition(c.type(), fields, c.conditions());
    }
}
