package com.flowauto.strategy;

import java.util.List;
import java.util.Map;

/**
 * Output of one backend run.
 *
 * @param document     the automation or script body, insertion-ordered
 * @param warnings     non-fatal findings about the graph or the encoding
 * @param strategy     name of the backend that produced the document
 * @param nodeOrder    node ids in the order the backend emitted them; round-trip
 *                     metadata lists positions in this order
 * @param script       true when the document is a script ({@code sequence})
 *                     rather than an automation ({@code trigger}/{@code action})
 */
public record GeneratedDocument(Map<String, Object> document, List<String> warnings, String strategy,
        List<String> nodeOrder, boolean script) {

    public GeneratedDocument {
        warnings = List.copyOf(warnings);
        nodeOrder = List.copyOf(nodeOrder);
    }

    /** The top-level step list ({@code action} or {@code sequence}). */
    @SuppressWarnings("unchecked")
    public List<Object> steps() {
        Object steps = document.get(script ? "sequence" : "action");
        return steps instanceof List<?> l ? (List<Object>) l : List.of();
    }
}
