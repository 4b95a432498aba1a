package com.flowauto.node;

/**
 * What the platform does when more runs are requested than {@code max} allows.
 */
public enum OverflowPolicy {
    SILENT, WARNING, CRITICAL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static OverflowPolicy fromWire(String text) {
        for (OverflowPolicy p : values()) {
            if (p.wireName().equals(text)) {
                return p;
            }
        }
        return null;
    }
}
