package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * A service invocation such as {@code light.turn_on}.
 */
public record ActionNode(String id, Position position, Map<String, Object> data) implements FlowNode {

    public ActionNode {
        data = DataMaps.ordered(data);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ACTION;
    }

    public String service() {
        return DataMaps.string(data, "service");
    }

    /** Target selector, or null. */
    public Object target() {
        return data.get("target");
    }

    /** Service payload, or null. */
    public Object payload() {
        return data.get("data");
    }

    @Override
    public ActionNode withPosition(Position position) {
        return new ActionNode(id, position, data);
    }
}
