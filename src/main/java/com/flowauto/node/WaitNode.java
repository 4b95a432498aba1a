package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * Waits for a template to become true or for one of a list of triggers.
 */
public record WaitNode(String id, Position position, Map<String, Object> data) implements FlowNode {

    public WaitNode {
        data = DataMaps.ordered(data);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WAIT;
    }

    public String waitTemplate() {
        return DataMaps.string(data, "wait_template");
    }

    @Override
    public WaitNode withPosition(Position position) {
        return new WaitNode(id, position, data);
    }
}
