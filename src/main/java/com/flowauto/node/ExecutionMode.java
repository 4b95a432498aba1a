package com.flowauto.node;

/**
 * Concurrency mode of the generated automation on the target platform.
 */
public enum ExecutionMode {
    SINGLE, RESTART, QUEUED, PARALLEL;

    public String wireName() {
        return name().toLowerCase();
    }

    /** Returns the mode for a wire name, or null when the name is unknown. */
    public static ExecutionMode fromWire(String text) {
        for (ExecutionMode m : values()) {
            if (m.wireName().equals(text)) {
                return m;
            }
        }
        return null;
    }
}
