package com.flowauto.node;

/**
 * The five node variants a flow graph may contain, with their wire names.
 */
public enum NodeKind {
    TRIGGER("trigger"),
    CONDITION("condition"),
    ACTION("action"),
    DELAY("delay"),
    WAIT("wait");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns the kind for a wire name, or null when the name is not a node kind. */
    public static NodeKind fromWire(String text) {
        for (NodeKind k : values()) {
            if (k.wireName.equals(text)) {
                return k;
            }
        }
        return null;
    }
}
