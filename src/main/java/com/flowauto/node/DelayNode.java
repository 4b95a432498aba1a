package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * A pause. The duration is either a string ({@code HH:MM:SS} or a template)
 * or a map of hours/minutes/seconds/milliseconds.
 */
public record DelayNode(String id, Position position, Map<String, Object> data) implements FlowNode {

    public DelayNode {
        data = DataMaps.ordered(data);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELAY;
    }

    public Object delay() {
        return data.get("delay");
    }

    @Override
    public DelayNode withPosition(Position position) {
        return new DelayNode(id, position, data);
    }
}
