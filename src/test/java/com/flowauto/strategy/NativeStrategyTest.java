package com.flowauto.strategy;

import com.flowauto.dsl.FlowGraphBuilder;
import com.flowauto.engine.TopologyAnalyzer;
import com.flowauto.node.*;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class NativeStrategyTest {

    private final NativeStrategy strategy = new NativeStrategy();
    private final TopologyAnalyzer analyzer = new TopologyAnalyzer();

    private GeneratedDocument generate(FlowGraph g) {
        return strategy.generate(g, analyzer.analyze(g));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> step(List<Object> steps, int i) {
        return (Map<String, Object>) steps.get(i);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object o) {
        return (List<Object>) o;
    }

    @Test
    public void testTriggerToAction() {
        FlowGraph g = FlowGraphBuilder.create("Motion light")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "light.turn_on", "light.y")
                .edge("t", "a")
                .build();

        GeneratedDocument out = generate(g);
        Map<String, Object> doc = out.document();
        assertEquals("Motion light", doc.get("alias"));
        assertEquals(List.of(Map.of("platform", "state", "entity_id", "sensor.x", "to", "on")), doc.get("trigger"));
        assertEquals(List.of(Map.of("service", "light.turn_on", "target", Map.of("entity_id", "light.y"))),
                doc.get("action"));
        assertEquals("single", doc.get("mode"));
        assertFalse(doc.containsKey("initial_state"));
        assertFalse(out.script());
        assertEquals(List.of("t", "a"), out.nodeOrder());
        assertTrue(out.warnings().isEmpty());
    }

    @Test
    public void testTriggerKeyOrderStartsWithPlatform() {
        FlowGraph g = FlowGraphBuilder.create("Order")
                .node(new TriggerNode("t", Position.ORIGIN, Map.of("entity_id", "sensor.x")))
                .action("a", "light.turn_on", null)
                .edge("t", "a")
                .build();

        Map<String, Object> trigger = step(list(generate(g).document().get("trigger")), 0);
        assertEquals("platform", trigger.keySet().iterator().next());
        assertEquals(TriggerNode.DEFAULT_PLATFORM, trigger.get("platform"));
    }

    @Test
    public void testIfThenElse() {
        FlowGraph g = FlowGraphBuilder.create("Dusk")
                .stateTrigger("t", "binary_sensor.door", "on")
                .stateCondition("c", "sun.sun", "below_horizon")
                .action("a", "light.turn_on", "light.porch")
                .action("b", "light.turn_off", "light.porch")
                .edge("t", "c")
                .whenTrue("c", "a")
                .whenFalse("c", "b")
                .build();

        GeneratedDocument out = generate(g);
        List<Object> action = list(out.document().get("action"));
        assertEquals(1, action.size());
        Map<String, Object> block = step(action, 0);
        assertEquals(List.of(Map.of("condition", "state", "entity_id", "sun.sun", "state", "below_horizon")),
                block.get("if"));
        assertEquals("light.turn_on", step(list(block.get("then")), 0).get("service"));
        assertEquals("light.turn_off", step(list(block.get("else")), 0).get("service"));
        assertEquals(List.of("t", "c", "a", "b"), out.nodeOrder());
    }

    @Test
    public void testThenAlwaysPresentElseOnlyWithFalseEdge() {
        FlowGraph g = FlowGraphBuilder.create("Only false")
                .stateTrigger("t", "binary_sensor.door", "on")
                .condition("c", Condition.of(ConditionType.STATE,
                        Map.of("alias", "Someone home", "entity_id", "group.family", "state", "home")))
                .action("b", "alarm_control_panel.alarm_arm_away", "alarm_control_panel.house")
                .edge("t", "c")
                .whenFalse("c", "b")
                .build();

        Map<String, Object> block = step(list(generate(g).document().get("action")), 0);
        assertEquals("Someone home", block.get("alias"));
        assertEquals(List.of(), block.get("then"));
        assertEquals(1, list(block.get("else")).size());
        // the alias sits on the block, not inside the condition
        assertFalse(step(list(block.get("if")), 0).containsKey("alias"));
    }

    @Test
    public void testUntaggedConditionEdgeIsTrueBranch() {
        FlowGraph g = FlowGraphBuilder.create("Untagged")
                .stateTrigger("t", "binary_sensor.door", "on")
                .stateCondition("c", "sun.sun", "below_horizon")
                .action("a", "light.turn_on", "light.porch")
                .chain("t", "c", "a")
                .build();

        Map<String, Object> block = step(list(generate(g).document().get("action")), 0);
        assertEquals(1, list(block.get("then")).size());
        assertFalse(block.containsKey("else"));
    }

    @Test
    public void testFanOutWithMeetingPoint() {
        FlowGraph g = FlowGraphBuilder.create("Fan out")
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "scene.turn_on", "scene.evening")
                .action("b", "light.turn_on", "light.b")
                .action("c", "light.turn_on", "light.c")
                .action("d", "notify.notify", null)
                .chain("t", "a")
                .edge("a", "b").edge("a", "c")
                .edge("b", "d").edge("c", "d")
                .build();

        GeneratedDocument out = generate(g);
        List<Object> action = list(out.document().get("action"));
        assertEquals(3, action.size());
        assertEquals("scene.turn_on", step(action, 0).get("service"));
        List<Object> branches = list(step(action, 1).get("parallel"));
        assertEquals(2, branches.size());
        assertEquals("light.b", ((Map<?, ?>) step(list(step(branches, 0).get("sequence")), 0).get("target"))
                .get("entity_id"));
        assertEquals("notify.notify", step(action, 2).get("service"));
        // d is emitted once, after the block
        assertEquals(List.of("t", "a", "b", "c", "d"), out.nodeOrder());
    }

    @Test
    public void testScriptWithoutTriggers() {
        FlowGraph g = FlowGraphBuilder.create("Script")
                .action("a", "light.turn_on", "light.y")
                .delay("d", "00:01:00")
                .action("b", "light.turn_off", "light.y")
                .chain("a", "d", "b")
                .build();

        GeneratedDocument out = generate(g);
        assertTrue(out.script());
        assertFalse(out.document().containsKey("trigger"));
        List<Object> seq = list(out.document().get("sequence"));
        assertEquals(3, seq.size());
        assertEquals(Map.of("delay", "00:01:00"), seq.get(1));
        assertEquals(seq, out.steps());
    }

    @Test
    public void testSettingsEmitted() {
        FlowGraph g = FlowGraphBuilder.create("Queued")
                .settings(new ExecutionSettings(ExecutionMode.QUEUED, 5, OverflowPolicy.WARNING, false))
                .stateTrigger("t", "sensor.x", "on")
                .action("a", "light.turn_on", "light.y")
                .edge("t", "a")
                .build();

        Map<String, Object> doc = generate(g).document();
        assertEquals("queued", doc.get("mode"));
        assertEquals(5, doc.get("max"));
        assertEquals("warning", doc.get("max_exceeded"));
        assertEquals(false, doc.get("initial_state"));
    }

    @Test
    public void testTriggerWithoutActionsWarns() {
        FlowGraph g = FlowGraphBuilder.create("Empty")
                .stateTrigger("t", "sensor.x", "on")
                .build();

        GeneratedDocument out = generate(g);
        assertEquals(List.of(), out.document().get("action"));
        assertEquals(1, out.warnings().size());
    }

    @Test
    public void testCanHandleOnlyTrees() {
        FlowGraph cyclic = FlowGraphBuilder.create("Loop")
                .stateTrigger("t", "sensor.x", null)
                .action("a", "light.toggle", "light.y")
                .chain("t", "a", "a")
                .build();
        assertFalse(strategy.canHandle(analyzer.analyze(cyclic)));
    }
}
