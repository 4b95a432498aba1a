package com.flowauto.node;

/**
 * Boolean outcome selected by an edge leaving a {@link ConditionNode}.
 */
public enum BranchTag {
    TRUE("true"),
    FALSE("false");

    private final String wireName;

    BranchTag(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns the tag for a wire name, or null when the name is not a tag. */
    public static BranchTag fromWire(String text) {
        if ("true".equals(text))
            return TRUE;
        if ("false".equals(text))
            return FALSE;
        return null;
    }
}
