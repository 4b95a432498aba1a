package com.flowauto.expr;

import com.flowauto.node.Condition;
import com.flowauto.node.ConditionType;
import com.flowauto.util.DataMaps;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;

/**
 * Translates conditions between the stored graph form and the two output
 * forms: a structured condition object for nested output, and an inline
 * boolean expression for the dispatch loop.
 *
 * <p>
 * Every translation recurses over the full condition tree. The one-level cap on
 * group nesting belongs to the stored schema and is enforced by the validator.
 */
public final class ConditionCompiler {

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    // ── Structured form ──────────────────────────────────────────────

    /**
     * Builds the structured condition: {@code condition_type} becomes
     * {@code condition} and a template condition's {@code template} becomes
     * {@code value_template}. Null and empty-string fields are dropped.
     *
     * @param includeAlias false for the top level, whose alias is written on the
     *                     enclosing block instead
     */
    public Map<String, Object> toStructured(Condition condition, boolean includeAlias) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("condition", condition.type().wireName());
        for (Map.Entry<String, Object> e : DataMaps.withoutEmpty(condition.fields()).entrySet()) {
            String key = e.getKey();
            if ("alias".equals(key) && !includeAlias)
                continue;
            if ("template".equals(key) && condition.type() == ConditionType.TEMPLATE
                    && !condition.fields().containsKey("value_template"))
                key = "value_template";
            out.put(key, e.getValue());
        }
        if (!condition.conditions().isEmpty()) {
            List<Object> children = new ArrayList<>();
            for (Condition child : condition.conditions())
                children.add(toStructured(child, true));
            out.put("conditions", children);
        }
        return out;
    }

    /**
     * Reads a structured condition back into stored form. Groups nested inside
     * groups are folded into a template condition holding their inline
     * expression, so the result always fits the stored one-level cap.
     */
    public Condition fromStructured(Map<String, Object> raw, List<String> warnings) {
        return fromStructured(raw, 0, warnings);
    }

    private Condition fromStructured(Map<String, Object> raw, int depth, List<String> warnings) {
        Object tag = raw.get("condition");
        ConditionType type = tag instanceof String s ? ConditionType.fromWire(s) : null;
        if (type == null) {
            warnings.add("Unrecognized condition '" + tag + "' kept as template");
            return opaqueCondition(raw);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        List<Condition> children = new ArrayList<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            switch (e.getKey()) {
                case "condition" -> {
                }
                case "conditions" -> {
                    for (Object child : DataMaps.asList(e.getValue())) {
                        Map<String, Object> m = DataMaps.map(child);
                        if (m != null)
                            children.add(fromStructured(m, depth + 1, warnings));
                    }
                }
                case "value_template" -> fields.put(type == ConditionType.TEMPLATE ? "template" : "value_template",
                        e.getValue());
                default -> fields.put(e.getKey(), e.getValue());
            }
        }
        Condition result = new Condition(type, fields, children);
        if (depth >= 1 && !children.isEmpty())
            return foldToTemplate(result, warnings);
        return result;
    }

    private Condition foldToTemplate(Condition group, List<String> warnings) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (group.alias() != null)
            fields.put("alias", group.alias());
        fields.put("template", OPEN + " " + toInline(group, warnings) + " " + CLOSE);
        return Condition.of(ConditionType.TEMPLATE, fields);
    }

    private static Condition opaqueCondition(Map<String, Object> raw) {
        Map<String, Object> fields = new LinkedHashMap<>(raw);
        fields.remove("condition");
        Object vt = fields.remove("value_template");
        if (vt != null)
            fields.put("template", vt);
        return Condition.of(ConditionType.TEMPLATE, fields);
    }

    // ── Inline form ──────────────────────────────────────────────────

    /**
     * Compiles a condition to a boolean expression suitable for embedding in
     * {@code {% if ... %}}. Conditions with no inline equivalent compile to
     * {@code true} and add a warning.
     */
    public String toInline(Condition c, List<String> warnings) {
        return switch (c.type()) {
            case STATE -> stateExpr(c);
            case NUMERIC_STATE -> numericExpr(c);
            case TEMPLATE -> stripDelimiters(firstNonNull(c.string("template"), c.string("value_template"), TRUE));
            case TIME -> timeExpr(c);
            case SUN -> sunExpr(c);
            case ZONE -> perEntity(c, e -> "is_state('" + e + "', '" + c.string("zone") + "')");
            case AND -> group(c, " and ", TRUE, warnings);
            case OR -> group(c, " or ", FALSE, warnings);
            case NOT -> c.conditions().isEmpty() ? TRUE : "not " + group(c, " and ", TRUE, warnings);
            case TRIGGER -> triggerExpr(c);
            case DEVICE -> {
                warnings.add("Device condition" + describe(c) + " has no inline form and evaluates as true");
                yield TRUE;
            }
        };
    }

    private String group(Condition c, String joiner, String empty, List<String> warnings) {
        if (c.conditions().isEmpty())
            return empty;
        StringJoiner j = new StringJoiner(joiner, "(", ")");
        for (Condition child : c.conditions())
            j.add(toInline(child, warnings));
        return j.toString();
    }

    private static String stateExpr(Condition c) {
        String attribute = c.string("attribute");
        Object state = c.get("state");
        return perEntity(c, entity -> {
            if (attribute != null) {
                String lookup = "state_attr('" + entity + "', '" + attribute + "')";
                return state instanceof List<?> l ? lookup + " in " + quotedList(l) : lookup + " == '" + state + "'";
            }
            return state instanceof List<?> l
                    ? "states('" + entity + "') in " + quotedList(l)
                    : "is_state('" + entity + "', '" + state + "')";
        });
    }

    private static String numericExpr(Condition c) {
        String template = c.string("value_template");
        String attribute = c.string("attribute");
        Object above = c.get("above");
        Object below = c.get("below");
        if (above == null && below == null)
            return TRUE;
        return perEntity(c, entity -> {
            String value;
            if (template != null)
                value = "(" + stripDelimiters(template) + ")";
            else if (attribute != null)
                value = "state_attr('" + entity + "', '" + attribute + "') | float";
            else
                value = "states('" + entity + "') | float";
            List<String> parts = new ArrayList<>(2);
            if (above != null)
                parts.add(value + " > " + formatNumber(above));
            if (below != null)
                parts.add(value + " < " + formatNumber(below));
            return String.join(" and ", parts);
        });
    }

    private static String timeExpr(Condition c) {
        List<String> parts = new ArrayList<>();
        String after = c.string("after");
        String before = c.string("before");
        if (after != null)
            parts.add("now().strftime('%H:%M:%S') >= '" + after + "'");
        if (before != null)
            parts.add("now().strftime('%H:%M:%S') < '" + before + "'");
        List<Object> days = DataMaps.asList(c.get("weekday"));
        if (!days.isEmpty())
            parts.add("now().strftime('%a').lower()[:3] in " + quotedList(days));
        return parts.isEmpty() ? TRUE : String.join(" and ", parts);
    }

    private static String sunExpr(Condition c) {
        String after = c.string("after");
        String before = c.string("before");
        if ("sunrise".equals(after) || "sunset".equals(before))
            return "is_state('sun.sun', 'above_horizon')";
        if ("sunset".equals(after) || "sunrise".equals(before))
            return "is_state('sun.sun', 'below_horizon')";
        return TRUE;
    }

    private static String triggerExpr(Condition c) {
        Object id = c.get("id");
        if (id == null)
            return TRUE;
        return id instanceof List<?> l ? "trigger.id in " + quotedList(l) : "trigger.id == '" + id + "'";
    }

    /** Applies a per-entity check; entity lists are combined with AND. */
    private static String perEntity(Condition c, Function<String, String> check) {
        List<Object> entities = DataMaps.asList(c.get("entity_id"));
        if (entities.size() <= 1)
            return check.apply(entities.isEmpty() ? "" : String.valueOf(entities.get(0)));
        StringJoiner j = new StringJoiner(" and ", "(", ")");
        for (Object e : entities)
            j.add(check.apply(String.valueOf(e)));
        return j.toString();
    }

    // ── Helpers ──────────────────────────────────────────────────────

    /** Removes one surrounding {@code {{ }}} pair, if present. */
    public static String stripDelimiters(String template) {
        String t = template.trim();
        if (t.startsWith(OPEN) && t.endsWith(CLOSE) && t.length() >= 4)
            return t.substring(2, t.length() - 2).trim();
        return t;
    }

    static String quotedList(List<?> values) {
        StringJoiner j = new StringJoiner(", ", "[", "]");
        for (Object v : values)
            j.add("'" + v + "'");
        return j.toString();
    }

    /**
     * Floating-point values keep a fractional part, even when integral, so the
     * inline form reads back as the same number type. Integers print as is.
     */
    static String formatNumber(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d))
                return ((long) d) + ".0";
            return BigDecimal.valueOf(d).toPlainString();
        }
        return String.valueOf(value);
    }

    private static String describe(Condition c) {
        String id = c.string("device_id");
        return id == null ? "" : " for device '" + id + "'";
    }

    private static String firstNonNull(String a, String b, String fallback) {
        return a != null ? a : b != null ? b : fallback;
    }
}
