package com.flowauto.node;

import java.util.Map;

/**
 * A boolean branch point. Outgoing edges tagged {@code true} or
 * {@code false} select the outcome they follow.
 */
public record ConditionNode(String id, Position position, Condition condition) implements FlowNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITION;
    }

    @Override
    public Map<String, Object> data() {
        return condition.toData();
    }

    @Override
    public String alias() {
        return condition.alias();
    }

    public ConditionType conditionType() {
        return condition.type();
    }

    @Override
    public ConditionNode withPosition(Position position) {
        return new ConditionNode(id, position, condition);
    }
}
