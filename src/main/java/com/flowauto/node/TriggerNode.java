package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * An external event that starts the flow. Every trigger is an independent
 * entry point; all fields are passed to the target platform as-is.
 */
public record TriggerNode(String id, Position position, Map<String, Object> data) implements FlowNode {

    public static final String DEFAULT_PLATFORM = "device";

    public TriggerNode {
        data = DataMaps.ordered(data);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRIGGER;
    }

    /**
     * The platform tag, taken from {@code platform}, then the newer
     * {@code trigger} key, then a device trigger's {@code domain}.
     */
    public String platform() {
        String p = DataMaps.string(data, "platform");
        if (p == null)
            p = DataMaps.string(data, "trigger");
        if (p == null)
            p = DataMaps.string(data, "domain");
        return p == null ? DEFAULT_PLATFORM : p;
    }

    @Override
    public TriggerNode withPosition(Position position) {
        return new TriggerNode(id, position, data);
    }
}
