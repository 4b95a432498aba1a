package com.flowauto.validate;

/**
 * One schema or structural problem.
 *
 * @param path dotted location of the problem, e.g. {@code nodes.a1.data.service}
 */
public record ValidationError(Code code, String path, String message) {

    public enum Code {
        INVALID_TYPE,
        REQUIRED,
        INVALID_VALUE,
        CONDITION_TOO_DEEP,
        DUPLICATE_NODE_ID,
        DANGLING_EDGE,
        TRIGGER_HAS_INCOMING,
        BRANCH_ON_NON_CONDITION,
        CONDITION_NO_EDGES,
        INVALID_SERVICE,
        ORPHANED_NODE,
        UNKNOWN_STRATEGY
    }

    @Override
    public String toString() {
        return "[" + code + "]" + (path == null || path.isEmpty() ? "" : " at " + path) + ": " + message;
    }
}
