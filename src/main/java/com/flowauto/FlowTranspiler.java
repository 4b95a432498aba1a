package com.flowauto;

import com.flowauto.api.TranspilerStrategy;
import com.flowauto.engine.TopologyAnalyzer;
import com.flowauto.engine.TopologyReport;
import com.flowauto.io.FlowYamlParser;
import com.flowauto.io.GraphReader;
import com.flowauto.io.ParseResult;
import com.flowauto.io.RoundTripMetadata;
import com.flowauto.io.YamlCodec;
import com.flowauto.node.FlowGraph;
import com.flowauto.node.FlowNode;
import com.flowauto.node.Position;
import com.flowauto.strategy.GeneratedDocument;
import com.flowauto.strategy.NativeStrategy;
import com.flowauto.strategy.StateMachineStrategy;
import com.flowauto.validate.FlowValidator;
import com.flowauto.validate.ValidationError;
import com.flowauto.validate.ValidationResult;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point for compiling flow graphs to automation YAML and back.
 *
 * <p>
 * Compilation validates the graph, analyzes its topology, picks a backend
 * (or uses the forced one), and serializes the result with round-trip
 * metadata. Decompilation is delegated to {@link FlowYamlParser}.
 *
 * <p>
 * Instances hold no per-call state. Registering a strategy while other
 * threads compile is not supported.
 */
@Log4j2
public final class FlowTranspiler {

    private final List<TranspilerStrategy> strategies = new ArrayList<>();
    private final TopologyAnalyzer analyzer = new TopologyAnalyzer();
    private final FlowValidator validator = new FlowValidator();
    private final YamlCodec yaml = new YamlCodec();
    private final GraphReader reader = new GraphReader();
    private final FlowYamlParser parser;

    public FlowTranspiler() {
        this(new FlowYamlParser());
    }

    public FlowTranspiler(FlowYamlParser parser) {
        this.parser = parser;
        strategies.add(new NativeStrategy());
        strategies.add(new StateMachineStrategy());
    }

    // ── Compilation ──────────────────────────────────────────────

    public TranspileResult transpile(FlowGraph graph) {
        return transpile(graph, TranspilerOptions.defaults());
    }

    /**
     * Compiles a graph. User errors (invalid graph, unknown forced strategy)
     * are returned in the result, never thrown.
     */
    public TranspileResult transpile(FlowGraph graph, TranspilerOptions options) {
        ValidationResult validation = validator.validate(graph);
        if (!validation.isValid()) {
            log.debug("Graph {} failed validation with {} errors", graph.id(), validation.errors().size());
            return TranspileResult.failure(validation.errors(), null, List.of());
        }

        TopologyReport report = analyzer.analyze(graph);
        List<String> warnings = new ArrayList<>();
        TranspilerStrategy strategy;
        if (options.getForceStrategy() != null) {
            strategy = strategy(options.getForceStrategy());
            if (strategy == null) {
                return TranspileResult.failure(List.of(new ValidationError(ValidationError.Code.UNKNOWN_STRATEGY,
                        "forceStrategy", "Unknown strategy: " + options.getForceStrategy())), report, warnings);
            }
            if (!strategy.canHandle(report)) {
                String warning = "Strategy \"" + strategy.name()
                        + "\" may not be optimal for this flow topology. Recommended: "
                        + report.recommendedStrategy();
                log.warn(warning);
                warnings.add(warning);
            }
        } else {
            strategy = select(report);
        }
        log.debug("Compiling graph {} with strategy {}", graph.id(), strategy.name());

        GeneratedDocument generated = strategy.generate(graph, report);
        for (String w : generated.warnings())
            log.warn("{}: {}", graph.id(), w);
        warnings.addAll(generated.warnings());

        Map<String, Object> document = generated.document();
        if (options.isIncludeMetadata())
            document = metadata(graph, generated).embedInto(document);
        return TranspileResult.success(yaml.write(document), document, report, warnings, strategy.name());
    }

    /** Reads stored graph JSON and compiles it. Malformed JSON is reported in the result. */
    public TranspileResult transpileJson(String json, TranspilerOptions options) {
        FlowGraph graph;
        try {
            graph = reader.read(json);
        } catch (TranspilerException e) {
            log.debug("Graph JSON rejected: {}", e.getMessage());
            return TranspileResult.failure(e.getErrors(), null, List.of());
        }
        return transpile(graph, options);
    }

    /** Compiles with the automatic strategy and returns the YAML text. */
    public String toYaml(FlowGraph graph) {
        return yamlOrThrow(transpile(graph, TranspilerOptions.defaults()));
    }

    public String toNativeYaml(FlowGraph graph) {
        return yamlOrThrow(transpile(graph, TranspilerOptions.forced(TopologyReport.NATIVE)));
    }

    public String toStateMachineYaml(FlowGraph graph) {
        return yamlOrThrow(transpile(graph, TranspilerOptions.forced(TopologyReport.STATE_MACHINE)));
    }

    private static String yamlOrThrow(TranspileResult result) {
        if (!result.success())
            throw new TranspilerException("Transpilation failed", result.errors());
        return result.yaml();
    }

    // ── Decompilation and analysis ───────────────────────────────

    public ParseResult fromYaml(String text) {
        ParseResult result = parser.parse(text);
        for (String w : result.warnings())
            log.warn("Decompile: {}", w);
        return result;
    }

    public TopologyReport analyzeTopology(FlowGraph graph) {
        return analyzer.analyze(graph);
    }

    public ValidationResult validate(FlowGraph graph) {
        return validator.validate(graph);
    }

    // ── Strategy registry ────────────────────────────────────────

    /** Registers a strategy ahead of the built-in ones. */
    public FlowTranspiler addStrategy(TranspilerStrategy strategy) {
        if (strategy(strategy.name()) != null)
            throw new IllegalArgumentException("Duplicate strategy name: " + strategy.name());
        strategies.add(0, strategy);
        return this;
    }

    /** Registered strategies as name to description, in priority order. */
    public Map<String, String> strategies() {
        Map<String, String> out = new LinkedHashMap<>();
        for (TranspilerStrategy s : strategies)
            out.put(s.name(), s.description());
        return out;
    }

    private TranspilerStrategy strategy(String name) {
        for (TranspilerStrategy s : strategies)
            if (s.name().equals(name))
                return s;
        return null;
    }

    private TranspilerStrategy select(TopologyReport report) {
        for (TranspilerStrategy s : strategies)
            if (s.canHandle(report))
                return s;
        TranspilerStrategy fallback = strategy(TopologyReport.STATE_MACHINE);
        if (fallback == null)
            throw new IllegalStateException("No strategy accepts the analyzed topology");
        return fallback;
    }

    /**
     * Positions in emission order, then any node the backend did not emit.
     * The graph's own node order is recorded beside them.
     */
    private static RoundTripMetadata metadata(FlowGraph graph, GeneratedDocument generated) {
        LinkedHashMap<String, Position> positions = new LinkedHashMap<>();
        for (String id : generated.nodeOrder()) {
            FlowNode node = graph.node(id);
            if (node != null)
                positions.put(id, node.position());
        }
        List<String> order = new ArrayList<>(graph.nodes().size());
        for (FlowNode node : graph.nodes()) {
            positions.putIfAbsent(node.id(), node.position());
            order.add(node.id());
        }
        return new RoundTripMetadata(RoundTripMetadata.CURRENT_VERSION, positions, order, graph.id(),
                graph.version(), generated.strategy());
    }
}
