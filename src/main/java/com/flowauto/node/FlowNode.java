package com.flowauto.node;

import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * A vertex of a flow graph.
 *
 * <p>
 * Nodes are immutable values. The position is cosmetic and never influences
 * compilation; it is carried only so a round trip through generated text can
 * restore the editor layout exactly.
 */
public sealed interface FlowNode permits TriggerNode, ConditionNode, ActionNode, DelayNode, WaitNode {

    String id();

    Position position();

    NodeKind kind();

    /** Variant-specific data in the stored graph form, insertion-ordered. */
    Map<String, Object> data();

    FlowNode withPosition(Position position);

    default String alias() {
        return DataMaps.string(data(), "alias");
    }

    /**
     * Creates a node of the given kind from stored data. The data is expected to
     * have passed the schema layer already.
     */
    static FlowNode of(NodeKind kind, String id, Position position, Map<String, ?> data) {
        Position pos = position == null ? Position.ORIGIN : position;
        return switch (kind) {
            case TRIGGER -> new TriggerNode(id, pos, DataMaps.ordered(data));
            case CONDITION -> new ConditionNode(id, pos, Condition.fromData(data));
            case ACTION -> new ActionNode(id, pos, DataMaps.ordered(data));
            case DELAY -> new DelayNode(id, pos, DataMaps.ordered(data));
            case WAIT -> new WaitNode(id, pos, DataMaps.ordered(data));
        };
    }
}
