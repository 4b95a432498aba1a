package com.flowauto.io;

import com.flowauto.node.Position;
import com.flowauto.util.DataMaps;

import java.util.*;

/**
 * Side-channel block embedded in generated documents under
 * {@code variables._cafe_metadata}. It carries node positions, the originating
 * graph identity and the backend used, which makes decompiling generated text
 * lossless.
 *
 * @param nodes     positions keyed by node id, in emission order
 * @param nodeOrder node ids in the graph's own order; null when not recorded
 */
public record RoundTripMetadata(int version, LinkedHashMap<String, Position> nodes, List<String> nodeOrder,
        String graphId, Integer graphVersion, String strategy) {

    public RoundTripMetadata {
        nodeOrder = nodeOrder == null ? null : List.copyOf(nodeOrder);
    }

    public static final int CURRENT_VERSION = 1;
    public static final String KEY = "_cafe_metadata";
    public static final String LEGACY_KEY = "_flow_automator";

    public List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> positions = new LinkedHashMap<>();
        for (Map.Entry<String, Position> e : nodes.entrySet()) {
            Map<String, Object> xy = new LinkedHashMap<>();
            xy.put("x", e.getValue().x());
            xy.put("y", e.getValue().y());
            positions.put(e.getKey(), xy);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", version);
        out.put("nodes", positions);
        if (nodeOrder != null)
            out.put("node_order", new ArrayList<Object>(nodeOrder));
        if (graphId != null)
            out.put("graph_id", graphId);
        if (graphVersion != null)
            out.put("graph_version", graphVersion);
        if (strategy != null)
            out.put("strategy", strategy);
        return out;
    }

    /**
     * Adds this block to a document's {@code variables}, keeping any variables
     * already present.
     */
    public Map<String, Object> embedInto(Map<String, Object> document) {
        Map<String, Object> out = new LinkedHashMap<>(document);
        Map<String, Object> vars = new LinkedHashMap<>();
        Map<String, Object> existing = DataMaps.map(document.get("variables"));
        if (existing != null)
            vars.putAll(existing);
        vars.put(KEY, toMap());
        out.put("variables", vars);
        return out;
    }

    /**
     * Extracts the block from a document's {@code variables}, reading the legacy
     * key as a fallback. Returns null when absent or malformed.
     */
    public static RoundTripMetadata extract(Map<String, Object> document) {
        Map<String, Object> vars = DataMaps.map(document.get("variables"));
        if (vars == null)
            return null;
        Map<String, Object> raw = DataMaps.map(vars.get(KEY));
        if (raw == null)
            raw = DataMaps.map(vars.get(LEGACY_KEY));
        return raw == null ? null : fromMap(raw);
    }

    /** Returns null unless {@code nodes} is a map of {x, y} numbers. */
    public static RoundTripMetadata fromMap(Map<String, Object> raw) {
        Map<String, Object> rawNodes = DataMaps.map(raw.get("nodes"));
        if (rawNodes == null)
            return null;
        LinkedHashMap<String, Position> positions = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : rawNodes.entrySet()) {
            Map<String, Object> xy = DataMaps.map(e.getValue());
            if (xy == null || !(xy.get("x") instanceof Number x) || !(xy.get("y") instanceof Number y))
                return null;
            positions.put(e.getKey(), new Position(x.doubleValue(), y.doubleValue()));
        }
        List<String> order = null;
        if (raw.get("node_order") instanceof List<?> list) {
            order = new ArrayList<>(list.size());
            for (Object o : list) {
                if (!(o instanceof String id))
                    return null;
                order.add(id);
            }
        }
        int version = raw.get("version") instanceof Number v ? v.intValue() : CURRENT_VERSION;
        String graphId = raw.get("graph_id") instanceof String s ? s : null;
        Integer graphVersion = raw.get("graph_version") instanceof Number gv ? gv.intValue() : null;
        String strategy = raw.get("strategy") instanceof String s ? s : null;
        return new RoundTripMetadata(version, positions, order, graphId, graphVersion, strategy);
    }
}
