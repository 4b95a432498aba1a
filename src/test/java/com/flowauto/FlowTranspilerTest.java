package com.flowauto;

import com.flowauto.api.TranspilerStrategy;
import com.flowauto.dsl.FlowGraphBuilder;
import com.flowauto.engine.TopologyReport;
import com.flowauto.io.RoundTripMetadata;
import com.flowauto.io.YamlCodec;
import com.flowauto.node.*;
import com.flowauto.strategy.GeneratedDocument;
import com.flowauto.validate.ValidationError;
import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FlowTranspilerTest {

    private FlowTranspiler transpiler;

    @Before
    public void setUp() {
        transpiler = new FlowTranspiler();
    }

    private static FlowGraph motionLight() {
        return FlowGraphBuilder.create("Motion light")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "light.turn_on", "light.y")
                .edge("t", "a")
                .build();
    }

    private static FlowGraph pingPong() {
        return FlowGraphBuilder.create("Ping pong")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "light.toggle", "light.a")
                .action("b", "light.toggle", "light.b")
                .chain("t", "a", "b", "a")
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> read(String yaml) throws Exception {
        return (Map<String, Object>) new YamlCodec().read(yaml);
    }

    @Test
    public void testTreeCompilesNative() throws Exception {
        TranspileResult r = transpiler.transpile(motionLight());
        assertTrue(r.success());
        assertEquals(TopologyReport.NATIVE, r.strategy());
        assertTrue(r.report().isTree());
        assertFalse(r.yaml().startsWith("---"));

        Map<String, Object> doc = read(r.yaml());
        assertEquals(List.of(Map.of("platform", "state", "entity_id", "sensor.x", "to", "on")), doc.get("trigger"));
        assertEquals(List.of(Map.of("service", "light.turn_on", "target", Map.of("entity_id", "light.y"))),
                doc.get("action"));

        RoundTripMetadata meta = RoundTripMetadata.extract(doc);
        assertNotNull(meta);
        assertEquals(List.of("t", "a"), meta.nodeIds());
        assertEquals(List.of("t", "a"), meta.nodeOrder());
        assertEquals("motion-light", meta.graphId());
        assertEquals(TopologyReport.NATIVE, meta.strategy());
    }

    @Test
    public void testCycleCompilesStateMachine() {
        TranspileResult r = transpiler.transpile(pingPong());
        assertTrue(r.success());
        assertEquals(TopologyReport.STATE_MACHINE, r.strategy());
        assertTrue(r.report().hasCycles());
        assertTrue(r.yaml().contains("repeat:"));
        assertTrue(r.yaml().contains("until:"));
        assertTrue(r.yaml().contains("current_node"));
        assertFalse(r.warnings().isEmpty());
    }

    @Test
    public void testOutputIsDeterministic() {
        assertEquals(transpiler.toYaml(pingPong()), transpiler.toYaml(pingPong()));
        assertEquals(transpiler.toYaml(motionLight()), new FlowTranspiler().toYaml(motionLight()));
    }

    @Test
    public void testInvalidGraphReturnsErrors() {
        FlowGraph g = FlowGraphBuilder.create("Bad")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "not_a_service", null)
                .edge("t", "a")
                .build();

        TranspileResult r = transpiler.transpile(g);
        assertFalse(r.success());
        assertNull(r.yaml());
        assertEquals(ValidationError.Code.INVALID_SERVICE, r.errors().get(0).code());

        try {
            transpiler.toYaml(g);
            fail("Expected TranspilerException");
        } catch (TranspilerException e) {
            assertEquals(r.errors(), e.getErrors());
        }
    }

    @Test
    public void testUnknownForcedStrategy() {
        TranspileResult r = transpiler.transpile(motionLight(), TranspilerOptions.forced("fancy"));
        assertFalse(r.success());
        assertEquals(ValidationError.Code.UNKNOWN_STRATEGY, r.errors().get(0).code());
        assertEquals("Unknown strategy: fancy", r.errors().get(0).message());
    }

    @Test
    public void testForcedSuboptimalStrategyWarns() {
        TranspileResult r = transpiler.transpile(pingPong(), TranspilerOptions.forced(TopologyReport.NATIVE));
        assertTrue(r.success());
        assertEquals(TopologyReport.NATIVE, r.strategy());
        assertTrue(r.warnings().contains(
                "Strategy \"native\" may not be optimal for this flow topology. Recommended: state-machine"));
    }

    @Test
    public void testForcedStateMachineOnTree() {
        TranspileResult r = transpiler.transpile(motionLight(), TranspilerOptions.forced(TopologyReport.STATE_MACHINE));
        assertTrue(r.success());
        assertEquals(TopologyReport.STATE_MACHINE, r.strategy());
        assertTrue(r.warnings().isEmpty());
        assertTrue(transpiler.toStateMachineYaml(motionLight()).contains("State Machine Loop"));
        assertFalse(transpiler.toNativeYaml(motionLight()).contains("State Machine Loop"));
    }

    @Test
    public void testMetadataCanBeOmitted() throws Exception {
        TranspilerOptions options = TranspilerOptions.defaults();
        options.setIncludeMetadata(false);
        TranspileResult r = transpiler.transpile(motionLight(), options);
        assertFalse(read(r.yaml()).containsKey("variables"));
        assertFalse(r.document().containsKey("variables"));
    }

    @Test
    public void testStrategyRegistry() {
        assertEquals(List.of(TopologyReport.NATIVE, TopologyReport.STATE_MACHINE),
                List.copyOf(transpiler.strategies().keySet()));

        transpiler.addStrategy(new TranspilerStrategy() {
            @Override
            public String name() {
                return "noop";
            }

            @Override
            public String description() {
                return "Emits an empty action list";
            }

            @Override
            public boolean canHandle(TopologyReport report) {
                return true;
            }

            @Override
            public GeneratedDocument generate(FlowGraph graph, TopologyReport report) {
                Map<String, Object> doc = new LinkedHashMap<>();
                doc.put("alias", graph.name());
                doc.put("action", List.of());
                return new GeneratedDocument(doc, List.of(), name(), List.of(), false);
            }
        });

        assertEquals("noop", transpiler.strategies().keySet().iterator().next());
        assertEquals("Emits an empty action list", transpiler.strategies().get("noop"));
        assertEquals("noop", transpiler.transpile(motionLight()).strategy());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateStrategyName() {
        transpiler.addStrategy(new com.flowauto.strategy.NativeStrategy());
    }

    @Test
    public void testTranspileJson() {
        String json = """
                {
                  "id": "g1",
                  "name": "From JSON",
                  "nodes": [
                    {"id": "t", "type": "trigger", "position": {"x": 0, "y": 0},
                     "data": {"platform": "state", "entity_id": "sensor.x"}},
                    {"id": "a", "type": "action", "position": {"x": 250, "y": 0},
                     "data": {"service": "light.turn_on"}}
                  ],
                  "edges": [{"id": "e1", "source": "t", "target": "a"}]
                }
                """;
        TranspileResult ok = transpiler.transpileJson(json, TranspilerOptions.defaults());
        assertTrue(ok.errors().toString(), ok.success());

        TranspileResult bad = transpiler.transpileJson("{\"id\": \"g\", \"name\": \"x\", \"nodes\": "
                + "[{\"id\": \"n\", \"type\": \"teleport\"}]}", TranspilerOptions.defaults());
        assertFalse(bad.success());
        assertEquals(ValidationError.Code.INVALID_TYPE, bad.errors().get(0).code());
    }

    @Test
    public void testAnalyzeAndValidateShortcuts() {
        assertTrue(transpiler.analyzeTopology(pingPong()).hasCycles());
        assertTrue(transpiler.validate(motionLight()).isValid());
    }
}
