package com.flowauto.strategy;

import com.flowauto.dsl.FlowGraphBuilder;
import com.flowauto.engine.TopologyAnalyzer;
import com.flowauto.node.*;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class StateMachineStrategyTest {

    private final StateMachineStrategy strategy = new StateMachineStrategy();
    private final TopologyAnalyzer analyzer = new TopologyAnalyzer();

    private GeneratedDocument generate(FlowGraph g) {
        return strategy.generate(g, analyzer.analyze(g));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object o) {
        return (Map<String, Object>) o;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object o) {
        return (List<Object>) o;
    }

    private static Map<String, Object> dispatcher(GeneratedDocument out) {
        Map<String, Object> loop = map(out.steps().get(1));
        return map(list(map(loop.get("repeat")).get("sequence")).get(0));
    }

    /** Finds the dispatcher branch guarded by the given node id. */
    private static Map<String, Object> branchFor(GeneratedDocument out, String nodeId) {
        for (Object b : list(dispatcher(out).get("choose"))) {
            Map<String, Object> guard = map(list(map(b).get("conditions")).get(0));
            if (guard.get("value_template").equals("{{ current_node == \"" + nodeId + "\" }}"))
                return map(b);
        }
        throw new AssertionError("No branch for " + nodeId);
    }

    private static FlowGraph cycle() {
        return FlowGraphBuilder.create("Ping pong")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "light.toggle", "light.a")
                .action("b", "light.toggle", "light.b")
                .chain("t", "a", "b", "a")
                .build();
    }

    @Test
    public void testLoopShape() {
        GeneratedDocument out = generate(cycle());
        List<Object> steps = out.steps();
        assertEquals(2, steps.size());

        Map<String, Object> init = map(map(steps.get(0)).get("variables"));
        assertEquals("a", init.get(StateMachineStrategy.PC));
        assertEquals(Map.of(), init.get(StateMachineStrategy.CONTEXT));

        Map<String, Object> loop = map(steps.get(1));
        assertEquals(StateMachineStrategy.LOOP_ALIAS, loop.get("alias"));
        assertEquals("{{ current_node == \"END\" }}", map(loop.get("repeat")).get("until"));

        // one branch per non-trigger node
        assertEquals(2, list(dispatcher(out).get("choose")).size());
    }

    @Test
    public void testCycleTransitionsBackward() {
        GeneratedDocument out = generate(cycle());

        List<Object> a = list(branchFor(out, "a").get("sequence"));
        assertEquals("Action: light.toggle", map(a.get(0)).get("alias"));
        assertEquals("light.toggle", map(a.get(0)).get("service"));
        assertEquals(Map.of("variables", Map.of("current_node", "b")), a.get(1));

        List<Object> b = list(branchFor(out, "b").get("sequence"));
        assertEquals(Map.of("variables", Map.of("current_node", "a")), b.get(1));

        assertTrue(out.warnings().stream().anyMatch(w -> w.contains("no conditions")));
    }

    @Test
    public void testEveryBranchWritesTheCounter() {
        FlowGraph g = FlowGraphBuilder.create("Mixed")
                .stateTrigger("t", "sensor.x", "on")
                .stateCondition("c", "sun.sun", "below_horizon")
                .action("a", "light.turn_on", "light.a")
                .delay("d", "00:00:30")
                .waitTemplate("w", "{{ is_state('light.a', 'off') }}", "00:10:00")
                .edge("t", "c")
                .whenTrue("c", "a")
                .whenFalse("c", "d")
                .chain("a", "w", "c")
                .chain("d", "w")
                .build();

        GeneratedDocument out = generate(g);
        Map<String, Object> dispatch = dispatcher(out);
        for (Object b : list(dispatch.get("choose")))
            assertTrue(b.toString(), writesCounter(list(map(b).get("sequence"))));
        List<Object> dflt = list(dispatch.get("default"));
        assertEquals(Map.of("variables", Map.of("current_node", "END")), dflt.get(dflt.size() - 1));
        assertEquals("system_log.write", map(dflt.get(0)).get("service"));

        assertTrue(out.warnings().stream().anyMatch(w -> w.startsWith("Note:")));
    }

    private static boolean writesCounter(List<Object> body) {
        for (Object step : body) {
            Object vars = map(step).get("variables");
            if (vars != null && map(vars).containsKey(StateMachineStrategy.PC))
                return true;
        }
        return false;
    }

    @Test
    public void testConditionBranchUsesInlineConditional() {
        FlowGraph g = FlowGraphBuilder.create("Dusk")
                .stateTrigger("t", "binary_sensor.door", "on")
                .stateCondition("c", "sun.sun", "below_horizon")
                .action("a", "light.turn_on", "light.porch")
                .edge("t", "c")
                .whenTrue("c", "a")
                .build();

        Map<String, Object> step = map(list(branchFor(generate(g), "c").get("sequence")).get(0));
        assertEquals("Check: state", step.get("alias"));
        assertEquals("{% if is_state('sun.sun', 'below_horizon') %}\"a\"{% else %}\"END\"{% endif %}",
                map(step.get("variables")).get("current_node"));
    }

    @Test
    public void testUserAliasKept() {
        FlowGraph g = FlowGraphBuilder.create("Alias")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", Map.of("alias", "Porch on", "service", "light.turn_on"))
                .edge("t", "a")
                .build();

        Map<String, Object> step = map(list(branchFor(generate(g), "a").get("sequence")).get(0));
        assertEquals("Porch on", step.get("alias"));
        assertEquals(Map.of("variables", Map.of("current_node", "END")),
                list(branchFor(generate(g), "a").get("sequence")).get(1));
    }

    @Test
    public void testMultipleOutgoingEdgesWarn() {
        FlowGraph g = FlowGraphBuilder.create("Fan")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "scene.turn_on", "scene.x")
                .action("b", "light.turn_on", "light.b")
                .action("c", "light.turn_on", "light.c")
                .chain("t", "a")
                .edge("a", "b").edge("a", "c")
                .build();

        GeneratedDocument out = generate(g);
        assertTrue(out.warnings().stream().anyMatch(w -> w.contains("follows only the first")));
        assertEquals(Map.of("variables", Map.of("current_node", "b")),
                list(branchFor(out, "a").get("sequence")).get(1));
    }

    @Test
    public void testDivergentTriggersWarn() {
        FlowGraph g = FlowGraphBuilder.create("Divergent")
                .stateTrigger("t1", "sensor.x", "on")
                .stateTrigger("t2", "sensor.y", "on")
                .action("a", "light.turn_on", "light.a")
                .action("b", "light.turn_on", "light.b")
                .edge("t1", "a")
                .edge("t2", "b")
                .build();

        GeneratedDocument out = generate(g);
        assertEquals("a", map(map(out.steps().get(0)).get("variables")).get("current_node"));
        assertTrue(out.warnings().stream().anyMatch(w -> w.contains("'t2'")));
    }

    @Test
    public void testNoActionsAfterTriggers() {
        FlowGraph g = FlowGraphBuilder.create("Lonely").stateTrigger("t", "sensor.x", "on").build();
        GeneratedDocument out = generate(g);
        assertTrue(out.steps().isEmpty());
        assertEquals(List.of("No action nodes found after triggers"), out.warnings());
    }

    @Test
    public void testAlwaysHandles() {
        assertTrue(strategy.canHandle(analyzer.analyze(cycle())));
    }
}
