package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A boolean predicate: a type tag, its type-specific fields, and for
 * {@code and/or/not} the child predicates.
 *
 * <p>
 * The type is recursive, so a tree of any depth is representable here. The
 * stored graph schema caps group nesting at one level; that cap lives in the
 * validator, not in this type or in the compilers that walk it.
 *
 * @param fields every field except {@code condition_type} and
 *               {@code conditions}, in their original order
 */
public record Condition(ConditionType type, Map<String, Object> fields, List<Condition> conditions) {

    public static final String TYPE_KEY = "condition_type";
    public static final String CHILDREN_KEY = "conditions";

    public Condition {
        if (type == null)
            throw new IllegalArgumentException("Condition type is required");
        fields = DataMaps.ordered(fields);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Condition of(ConditionType type, Map<String, ?> fields) {
        return new Condition(type, DataMaps.ordered(fields), List.of());
    }

    public static Condition group(ConditionType type, List<Condition> children) {
        return new Condition(type, Map.of(), children);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public String string(String key) {
        return DataMaps.string(fields, key);
    }

    public String alias() {
        return string("alias");
    }

    /** Number of group levels below this condition; 0 for a leaf. */
    public int depth() {
        int max = 0;
        for (Condition c : conditions)
            max = Math.max(max, 1 + c.depth());
        return conditions.isEmpty() ? 0 : Math.max(max, 1);
    }

    /** Renders the node-data form: {@code condition_type}, fields, then children. */
    public Map<String, Object> toData() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(TYPE_KEY, type.wireName());
        out.putAll(fields);
        if (!conditions.isEmpty()) {
            List<Object> children = new ArrayList<>(conditions.size());
            for (Condition c : conditions)
                children.add(c.toData());
            out.put(CHILDREN_KEY, children);
        }
        return out;
    }

    /**
     * Builds a condition from node data. The data must already have passed the
     * schema layer; an unknown type tag is a programming error here.
     */
    public static Condition fromData(Map<String, ?> data) {
        Object tag = data.get(TYPE_KEY);
        ConditionType type = tag instanceof String s ? ConditionType.fromWire(s) : null;
        if (type == null)
            throw new IllegalArgumentException("Unknown condition_type: " + tag);
        Map<String, Object> fields = new LinkedHashMap<>();
        List<Condition> children = new ArrayList<>();
        for (Map.Entry<String, ?> e : data.entrySet()) {
            switch (e.getKey()) {
                case TYPE_KEY -> {
                }
                case CHILDREN_KEY -> {
                    if (e.getValue() instanceof List<?> list) {
                        for (Object child : list) {
                            Map<String, Object> m = DataMaps.map(child);
                            if (m != null)
                                children.add(fromData(m));
                        }
                    }
                }
                default -> fields.put(e.getKey(), e.getValue());
            }
        }
        return new Condition(type, fields, children);
    }
}
