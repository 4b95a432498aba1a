package com.flowauto.expr;

import com.flowauto.node.Condition;
import com.flowauto.node.ConditionType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TemplatePatternsTest {

    private final TemplatePatterns patterns = new TemplatePatterns();

    @Test
    public void testIsState() {
        Condition c = patterns.recognize("is_state('sun.sun', 'below_horizon')");
        assertEquals(ConditionType.STATE, c.type());
        assertEquals(Map.of("entity_id", "sun.sun", "state", "below_horizon"), c.fields());
    }

    @Test
    public void testStatesIn() {
        Condition c = patterns.recognize("states('light.a') in ['on', 'dim']");
        assertEquals(ConditionType.STATE, c.type());
        assertEquals(List.of("on", "dim"), c.get("state"));
    }

    @Test
    public void testStateAttribute() {
        Condition c = patterns.recognize("state_attr('climate.x', 'hvac_action') == 'heating'");
        assertEquals(ConditionType.STATE, c.type());
        assertEquals("hvac_action", c.string("attribute"));
        assertEquals("heating", c.string("state"));
    }

    @Test
    public void testNumericForms() {
        Condition above = patterns.recognize("states('sensor.t') | float > 20");
        assertEquals(ConditionType.NUMERIC_STATE, above.type());
        assertEquals(20, above.get("above"));
        assertNull(above.get("below"));

        Condition below = patterns.recognize("states('sensor.t') | float < 7.5");
        assertEquals(7.5, below.get("below"));

        Condition range = patterns.recognize("states('sensor.t') | float > 20 and states('sensor.t') | float < 25");
        assertEquals(20, range.get("above"));
        assertEquals(25, range.get("below"));
    }

    @Test
    public void testUnrecognizedBecomesTemplate() {
        String expr = "now().hour > 6";
        assertFalse(patterns.isRecognized(expr));
        Condition c = patterns.recognize(expr);
        assertEquals(ConditionType.TEMPLATE, c.type());
        assertEquals("{{ now().hour > 6 }}", c.string("template"));
    }

    @Test
    public void testCompiledFormsAreRecognized() {
        // every structured condition the inline compiler emits for these shapes reads back unchanged
        ConditionCompiler compiler = new ConditionCompiler();
        List<String> warnings = new ArrayList<>();
        List<Condition> samples = List.of(
                Condition.of(ConditionType.STATE, Map.of("entity_id", "sun.sun", "state", "above_horizon")),
                Condition.of(ConditionType.NUMERIC_STATE, Map.of("entity_id", "sensor.t", "above", 3)),
                Condition.of(ConditionType.NUMERIC_STATE, Map.of("entity_id", "sensor.t", "below", 2.5)));
        for (Condition sample : samples) {
            String expr = compiler.toInline(sample, warnings);
            assertTrue(expr, patterns.isRecognized(expr));
            assertEquals(sample, patterns.recognize(expr));
        }
    }

    @Test
    public void testWholeNumberDoubleBoundKeepsItsType() {
        ConditionCompiler compiler = new ConditionCompiler();
        Condition sample = Condition.of(ConditionType.NUMERIC_STATE,
                Map.of("entity_id", "sensor.t", "above", 20.0, "below", 30));
        String expr = compiler.toInline(sample, new ArrayList<>());
        assertEquals("states('sensor.t') | float > 20.0 and states('sensor.t') | float < 30", expr);

        Condition back = patterns.recognize(expr);
        assertEquals(20.0, back.get("above"));
        assertEquals(30, back.get("below"));
        assertEquals(sample, back);
    }

    @Test
    public void testCustomRuleTable() {
        TemplatePatterns none = new TemplatePatterns(List.of());
        assertFalse(none.isRecognized("is_state('a.b', 'on')"));
        assertEquals(6, TemplatePatterns.defaultRules().size());
    }
}
