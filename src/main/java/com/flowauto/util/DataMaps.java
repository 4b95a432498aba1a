package com.flowauto.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely-typed, insertion-ordered maps that carry node data
 * and generated documents.
 */
public final class DataMaps {
    private DataMaps() {
        // Utility class
    }

    /** Unmodifiable copy that keeps insertion order and tolerates null values. */
    public static Map<String, Object> ordered(Map<String, ?> source) {
        if (source == null || source.isEmpty())
            return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Copy without null values and empty strings. */
    public static Map<String, Object> withoutEmpty(Map<String, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : source.entrySet()) {
            Object v = e.getValue();
            if (v == null || (v instanceof String s && s.isEmpty()))
                continue;
            out.put(e.getKey(), v);
        }
        return out;
    }

    /** Returns the value when it is a non-empty string, else null. */
    public static String string(Map<String, ?> map, String key) {
        Object v = map.get(key);
        return v instanceof String s && !s.isEmpty() ? s : null;
    }

    /** Returns the value as a string-keyed map, or null if it is not a map. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }

    /**
     * Normalizes a scalar-or-list value into a list; null yields an empty list.
     */
    public static List<Object> asList(Object value) {
        if (value == null)
            return Collections.emptyList();
        if (value instanceof List<?> l)
            return new ArrayList<>(l);
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }
}
