package com.flowauto.node;

/**
 * Directed connection between two nodes.
 *
 * @param branch the boolean outcome this edge represents when the source is a
 *               condition; null for ordinary sequencing.
 */
public record FlowEdge(String id, String source, String target, BranchTag branch) {

    public static FlowEdge of(String id, String source, String target) {
        return new FlowEdge(id, source, target, null);
    }

    public boolean isTagged() {
        return branch != null;
    }
}
