package com.flowauto.expr;

import com.flowauto.node.Condition;
import com.flowauto.node.ConditionType;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers structured conditions from inline boolean expressions.
 *
 * <p>
 * Recognition is a fixed table of whole-expression patterns tried in order.
 * Anything the table does not match becomes a {@code template} condition that
 * carries the expression verbatim. New shapes are added as table rows.
 */
public final class TemplatePatterns {

    /** One recognized expression shape. */
    public record Rule(String name, Pattern pattern, Function<Matcher, Condition> build) {
    }

    private static final String ENTITY = "'([^']+)'";
    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";
    private static final String FLOAT_OF = "states\\(" + ENTITY + "\\)\\s*\\|\\s*float";
    private static final Pattern QUOTED = Pattern.compile("'([^']*)'");

    private static final List<Rule> DEFAULT_RULES = List.of(
            new Rule("is_state",
                    Pattern.compile("is_state\\(" + ENTITY + ",\\s*'([^']*)'\\)"),
                    m -> state(m.group(1), null, m.group(2))),
            new Rule("states_in",
                    Pattern.compile("states\\(" + ENTITY + "\\)\\s+in\\s+\\[((?:\\s*'[^']*'\\s*,?)*)\\]"),
                    m -> state(m.group(1), null, quotedItems(m.group(2)))),
            new Rule("state_attr_equals",
                    Pattern.compile("state_attr\\(" + ENTITY + ",\\s*'([^']+)'\\)\\s*==\\s*'([^']*)'"),
                    m -> state(m.group(1), m.group(2), m.group(3))),
            new Rule("numeric_range",
                    Pattern.compile(FLOAT_OF + "\\s*>\\s*" + NUMBER + "\\s+and\\s+states\\('\\1'\\)\\s*\\|\\s*float\\s*<\\s*"
                            + NUMBER),
                    m -> numeric(m.group(1), m.group(2), m.group(3))),
            new Rule("numeric_above",
                    Pattern.compile(FLOAT_OF + "\\s*>\\s*" + NUMBER),
                    m -> numeric(m.group(1), m.group(2), null)),
            new Rule("numeric_below",
                    Pattern.compile(FLOAT_OF + "\\s*<\\s*" + NUMBER),
                    m -> numeric(m.group(1), null, m.group(2))));

    private final List<Rule> rules;

    public TemplatePatterns() {
        this(DEFAULT_RULES);
    }

    public TemplatePatterns(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<Rule> defaultRules() {
        return DEFAULT_RULES;
    }

    /**
     * Returns the structured condition for {@code expression}, or a template
     * condition wrapping it when no rule matches.
     */
    public Condition recognize(String expression) {
        String expr = expression.trim();
        for (Rule rule : rules) {
            Matcher m = rule.pattern().matcher(expr);
            if (m.matches())
                return rule.build().apply(m);
        }
        return Condition.of(ConditionType.TEMPLATE, Map.of("template", "{{ " + expr + " }}"));
    }

    /** Whether some rule other than the template fallback matches. */
    public boolean isRecognized(String expression) {
        String expr = expression.trim();
        for (Rule rule : rules)
            if (rule.pattern().matcher(expr).matches())
                return true;
        return false;
    }

    private static Condition state(String entity, String attribute, Object state) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("entity_id", entity);
        if (attribute != null)
            f.put("attribute", attribute);
        f.put("state", state);
        return Condition.of(ConditionType.STATE, f);
    }

    private static Condition numeric(String entity, String above, String below) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("entity_id", entity);
        if (above != null)
            f.put("above", parseNumber(above));
        if (below != null)
            f.put("below", parseNumber(below));
        return Condition.of(ConditionType.NUMERIC_STATE, f);
    }

    private static List<String> quotedItems(String text) {
        List<String> items = new ArrayList<>();
        Matcher m = QUOTED.matcher(text);
        while (m.find())
            items.add(m.group(1));
        return items;
    }

    /** Integral values become Integer (or Long), others Double. */
    static Number parseNumber(String text) {
        if (text.indexOf('.') < 0) {
            long v = Long.parseLong(text);
            if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                return (int) v;
            return v;
        }
        return Double.parseDouble(text);
    }
}
