package com.flowauto;

import com.flowauto.dsl.FlowGraphBuilder;
import com.flowauto.engine.TopologyReport;
import com.flowauto.io.ParseResult;
import com.flowauto.node.*;
import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Compiles graphs with each backend and decompiles the output again. With
 * metadata embedded, node identities, data, positions and wiring all survive.
 */
public class RoundTripTest {

    private FlowTranspiler transpiler;

    @Before
    public void setUp() {
        transpiler = new FlowTranspiler();
    }

    private static FlowGraph eveningLights() {
        Map<String, Object> dark = new LinkedHashMap<>();
        dark.put("alias", "Dark outside");
        dark.put("entity_id", "sun.sun");
        dark.put("state", "below_horizon");
        return FlowGraphBuilder.create("Evening lights")
                .description("Hallway lights after sunset")
                .stateTrigger("t", "binary_sensor.motion", "on")
                .condition("c", Condition.of(ConditionType.STATE, dark))
                .action("a", "light.turn_on", "light.hallway")
                .delay("d", "00:05:00")
                .action("b", "notify.notify", null)
                .whenTrue("c", "a")
                .whenFalse("c", "b")
                .edge("t", "c")
                .edge("a", "d")
                .at("t", 100, 150)
                .at("c", 350, 150)
                .at("a", 600, 100)
                .at("d", 850, 100)
                .at("b", 600, 250)
                .build();
    }

    private static FlowGraph retryLoop() {
        return FlowGraphBuilder.create("Retry loop")
                .stateTrigger("t", "input_boolean.start", "on")
                .action("a", "switch.turn_on", "switch.pump")
                .delay("d", "00:00:30")
                .stateCondition("c", "switch.pump", "off")
                .waitTemplate("w", "{{ is_state('switch.pump', 'on') }}", "00:10:00")
                .chain("t", "a", "d", "c")
                .whenTrue("c", "a")
                .whenFalse("c", "w")
                .at("t", 0, 0)
                .at("a", 250, 0)
                .at("d", 500, 0)
                .at("c", 750, 0)
                .at("w", 1000, 120)
                .build();
    }

    /** Nodes declared out of emission order; c rejoins d on both outcomes inside a parallel branch. */
    private static FlowGraph guestArrival() {
        return FlowGraphBuilder.create("Guest arrival")
                .action("d", "notify.notify", null)
                .action("b", "light.turn_on", "light.hall")
                .stateCondition("c", "input_boolean.guest", "on")
                .action("e", "light.turn_on", "light.guest_room")
                .action("a", "scene.turn_on", "scene.welcome")
                .stateTrigger("t", "binary_sensor.door", "on")
                .chain("t", "a")
                .edge("a", "c")
                .edge("a", "b")
                .whenTrue("c", "e")
                .whenFalse("c", "d")
                .edge("e", "d")
                .edge("b", "d")
                .at("t", 100, 150)
                .at("a", 350, 150)
                .at("c", 600, 50)
                .at("e", 850, 50)
                .at("b", 600, 250)
                .at("d", 1100, 150)
                .build();
    }

    private static void assertSameGraph(FlowGraph expected, FlowGraph actual) {
        assertEquals(expected.id(), actual.id());
        assertEquals(expected.name(), actual.name());
        assertEquals(expected.version(), actual.version());
        assertEquals(new HashSet<>(expected.nodes()), new HashSet<>(actual.nodes()));
        assertEquals(new HashSet<>(expected.edges()), new HashSet<>(actual.edges()));
    }

    @Test
    public void testNativeRoundTrip() {
        FlowGraph graph = eveningLights();
        TranspileResult compiled = transpiler.transpile(graph, TranspilerOptions.forced(TopologyReport.NATIVE));
        assertTrue(compiled.success());

        ParseResult parsed = transpiler.fromYaml(compiled.yaml());
        assertTrue(parsed.errors().toString(), parsed.success());
        assertTrue(parsed.hadMetadata());
        assertSameGraph(graph, parsed.graph());
        assertEquals(graph.description(), parsed.graph().description());
    }

    @Test
    public void testParallelRejoinThroughConditionRoundTrip() {
        FlowGraph graph = guestArrival();
        TranspileResult compiled = transpiler.transpile(graph);
        assertEquals(TopologyReport.NATIVE, compiled.strategy());
        assertTrue(compiled.yaml().contains("parallel:"));

        ParseResult parsed = transpiler.fromYaml(compiled.yaml());
        assertTrue(parsed.errors().toString(), parsed.success());
        assertSameGraph(graph, parsed.graph());
    }

    @Test
    public void testGraphNodeOrderSurvives() {
        FlowGraph graph = guestArrival();
        FlowGraph parsed = transpiler.fromYaml(transpiler.toYaml(graph)).graph();
        assertEquals(graph.nodes(), parsed.nodes());
    }

    @Test
    public void testConditionLeavingParallelBranchIsNotLoweredNative() {
        // c reaches d only on false, so a parallel block followed by d would invent c -> d on true
        FlowGraph graph = FlowGraphBuilder.create("Half rejoin")
                .stateTrigger("t", "binary_sensor.door", "on")
                .action("a", "scene.turn_on", "scene.welcome")
                .stateCondition("c", "input_boolean.guest", "on")
                .action("b", "light.turn_on", "light.hall")
                .action("d", "notify.notify", null)
                .chain("t", "a")
                .edge("a", "c")
                .edge("a", "b")
                .whenFalse("c", "d")
                .edge("b", "d")
                .build();

        TranspileResult compiled = transpiler.transpile(graph);
        assertTrue(compiled.success());
        assertFalse(compiled.report().isTree());
        assertEquals(TopologyReport.STATE_MACHINE, compiled.strategy());
        assertFalse(compiled.yaml().contains("parallel:"));
    }

    @Test
    public void testStateMachineRoundTrip() {
        FlowGraph graph = retryLoop();
        TranspileResult compiled = transpiler.transpile(graph);
        assertEquals(TopologyReport.STATE_MACHINE, compiled.strategy());

        ParseResult parsed = transpiler.fromYaml(compiled.yaml());
        assertTrue(parsed.errors().toString(), parsed.success());
        assertTrue(parsed.hadMetadata());
        assertSameGraph(graph, parsed.graph());
    }

    @Test
    public void testTreeThroughStateMachineRoundTrip() {
        FlowGraph graph = eveningLights();
        String yaml = transpiler.toStateMachineYaml(graph);

        ParseResult parsed = transpiler.fromYaml(yaml);
        assertTrue(parsed.errors().toString(), parsed.success());
        assertSameGraph(graph, parsed.graph());
    }

    @Test
    public void testRecompilingDecompiledGraphIsStable() {
        String first = transpiler.toYaml(eveningLights());
        FlowGraph reparsed = transpiler.fromYaml(first).graph();
        assertEquals(first, transpiler.toYaml(reparsed));
    }

    @Test
    public void testWithoutMetadataStructureSurvives() {
        TranspilerOptions options = TranspilerOptions.defaults();
        options.setIncludeMetadata(false);
        TranspileResult compiled = transpiler.transpile(eveningLights(), options);

        ParseResult parsed = transpiler.fromYaml(compiled.yaml());
        assertTrue(parsed.success());
        assertFalse(parsed.hadMetadata());

        FlowGraph g = parsed.graph();
        assertEquals(5, g.nodes().size());
        assertEquals(4, g.edges().size());
        assertEquals(1, g.triggers().size());
        long tagged = g.edges().stream().filter(e -> e.branch() != null).count();
        assertEquals(2, tagged);
    }
}
