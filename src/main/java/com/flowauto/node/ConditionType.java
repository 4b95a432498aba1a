package com.flowauto.node;

/**
 * Predicate kinds a condition may use, with their wire names.
 */
public enum ConditionType {
    STATE("state"),
    NUMERIC_STATE("numeric_state"),
    TEMPLATE("template"),
    TIME("time"),
    SUN("sun"),
    ZONE("zone"),
    AND("and"),
    OR("or"),
    NOT("not"),
    DEVICE("device"),
    TRIGGER("trigger");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns the type for a wire name, or null when the name is unknown. */
    public static ConditionType fromWire(String text) {
        for (ConditionType t : values()) {
            if (t.wireName.equals(text)) {
                return t;
            }
        }
        return null;
    }
}
