package com.flowauto.node;

/**
 * Cosmetic canvas position of a node. Never consulted by compilation, but
 * carried through round-trip metadata unchanged.
 */
public record Position(double x, double y) {
    public static final Position ORIGIN = new Position(0, 0);
}
