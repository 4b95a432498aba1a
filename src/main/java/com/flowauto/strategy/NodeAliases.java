package com.flowauto.strategy;

import com.flowauto.node.*;
import com.flowauto.util.DataMaps;

import java.util.Map;

/**
 * Readable default aliases for generated steps.
 */
public final class NodeAliases {
    private NodeAliases() {
        // Utility class
    }

    public static String aliasOrDefault(FlowNode node) {
        String alias = node.alias();
        return alias != null ? alias : defaultAlias(node);
    }

    public static String defaultAlias(FlowNode node) {
        return switch (node.kind()) {
            case TRIGGER -> "Trigger: " + ((TriggerNode) node).platform();
            case CONDITION -> "Check: " + ((ConditionNode) node).conditionType().wireName();
            case ACTION -> "Action: " + orUnknown(((ActionNode) node).service());
            case DELAY -> "Delay";
            case WAIT -> "Wait";
        };
    }

    /**
     * Whether {@code alias} is the default a generated step of this kind would
     * carry. Condition defaults match any condition type, since the decompiled
     * type may differ from the one the alias names.
     */
    public static boolean isDefault(String alias, NodeKind kind, Map<String, Object> data) {
        if (alias == null)
            return false;
        return switch (kind) {
            case TRIGGER -> alias.startsWith("Trigger: ");
            case CONDITION -> alias.startsWith("Check: ")
                    && ConditionType.fromWire(alias.substring("Check: ".length())) != null;
            case ACTION -> alias.equals("Action: " + orUnknown(DataMaps.string(data, "service")));
            case DELAY -> alias.equals("Delay");
            case WAIT -> alias.equals("Wait");
        };
    }

    private static String orUnknown(String s) {
        return s == null || s.isEmpty() ? "unknown" : s;
    }
}
