package com.flowauto.io;

import com.flowauto.strategy.StateMachineStrategy;
import com.flowauto.util.DataMaps;

import java.util.*;
import java.util.function.Function;

/**
 * Boundary parse from loosely-typed step maps to {@link ActionShape}.
 *
 * <p>
 * Each variant has a strict parser. They are tried in a fixed priority order
 * and the first one that accepts the step wins; {@link ActionShape.Unknown} is
 * the fallback.
 */
public final class ActionShapes {
    private ActionShapes() {
        // Utility class
    }

    private static final List<Function<Map<String, Object>, ActionShape>> PARSERS = List.of(
            ActionShapes::delay,
            ActionShapes::waitStep,
            ActionShapes::choose,
            ActionShapes::ifBlock,
            ActionShapes::parallel,
            ActionShapes::serviceCall,
            ActionShapes::transition);

    public static ActionShape parse(Map<String, Object> step) {
        for (Function<Map<String, Object>, ActionShape> parser : PARSERS) {
            ActionShape shape = parser.apply(step);
            if (shape != null)
                return shape;
        }
        return new ActionShape.Unknown(step);
    }

    /** Parses a step that may not be a map at all. */
    public static ActionShape parse(Object step) {
        Map<String, Object> m = DataMaps.map(step);
        if (m == null) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("value", step);
            return new ActionShape.Unknown(raw);
        }
        return parse(m);
    }

    private static ActionShape delay(Map<String, Object> step) {
        Object d = step.get("delay");
        return d instanceof String || d instanceof Map || d instanceof Number ? new ActionShape.Delay(step) : null;
    }

    private static ActionShape waitStep(Map<String, Object> step) {
        if (step.get("wait_template") instanceof String || step.get("wait_for_trigger") instanceof List)
            return new ActionShape.Wait(step);
        return null;
    }

    private static ActionShape choose(Map<String, Object> step) {
        if (!step.containsKey("choose"))
            return null;
        List<ActionShape.Option> options = new ArrayList<>();
        for (Object o : DataMaps.asList(step.get("choose"))) {
            Map<String, Object> m = DataMaps.map(o);
            if (m == null)
                return null;
            options.add(new ActionShape.Option(DataMaps.string(m, "alias"), DataMaps.asList(m.get("conditions")),
                    DataMaps.asList(m.get("sequence"))));
        }
        List<Object> dflt = step.containsKey("default") ? DataMaps.asList(step.get("default")) : null;
        return new ActionShape.Choose(DataMaps.string(step, "alias"), options, dflt);
    }

    private static ActionShape ifBlock(Map<String, Object> step) {
        if (!step.containsKey("if"))
            return null;
        List<Object> elseSteps = step.containsKey("else") ? DataMaps.asList(step.get("else")) : null;
        return new ActionShape.If(DataMaps.string(step, "alias"), DataMaps.asList(step.get("if")),
                DataMaps.asList(step.get("then")), elseSteps);
    }

    private static ActionShape parallel(Map<String, Object> step) {
        if (!(step.get("parallel") instanceof List<?> items))
            return null;
        List<List<Object>> branches = new ArrayList<>();
        for (Object item : items) {
            Map<String, Object> m = DataMaps.map(item);
            if (m != null && m.size() == 1 && m.containsKey("sequence"))
                branches.add(DataMaps.asList(m.get("sequence")));
            else
                branches.add(DataMaps.asList(item));
        }
        return new ActionShape.Parallel(branches);
    }

    private static ActionShape serviceCall(Map<String, Object> step) {
        if (step.get("service") instanceof String s && !s.isEmpty())
            return new ActionShape.ServiceCall(step);
        if (step.get("action") instanceof String a && !a.isEmpty()) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : step.entrySet())
                renamed.put(e.getKey().equals("action") ? "service" : e.getKey(), e.getValue());
            return new ActionShape.ServiceCall(renamed);
        }
        return null;
    }

    private static ActionShape transition(Map<String, Object> step) {
        Map<String, Object> vars = DataMaps.map(step.get("variables"));
        if (vars == null || vars.size() != 1 || !(vars.get(StateMachineStrategy.PC) instanceof String value))
            return null;
        return new ActionShape.Transition(DataMaps.string(step, "alias"), value);
    }
}
