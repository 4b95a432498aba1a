package com.flowauto.node;

/**
 * Execution-mode block of a graph.
 *
 * @param max          optional concurrency limit for queued/parallel modes
 * @param maxExceeded  optional overflow policy
 * @param initialState whether the automation starts enabled
 */
public record ExecutionSettings(ExecutionMode mode, Integer max, OverflowPolicy maxExceeded, boolean initialState) {

    public static final ExecutionSettings DEFAULT = new ExecutionSettings(ExecutionMode.SINGLE, null, null, true);

    public ExecutionSettings {
        if (mode == null)
            mode = ExecutionMode.SINGLE;
    }
}
