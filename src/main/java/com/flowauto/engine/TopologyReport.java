package com.flowauto.engine;

import java.util.List;

/**
 * Shape classification of one flow graph. Derived on every compilation and
 * never stored.
 *
 * @param topologicalOrder node ids in dependency order; null when the graph has
 *                         a cycle
 * @param recommendedStrategy {@value #NATIVE} for tree-shaped graphs,
 *                            otherwise {@value #STATE_MACHINE}
 */
public record TopologyReport(
        boolean hasCycles,
        boolean isTree,
        boolean hasMultipleEntryPoints,
        boolean hasCrossLinks,
        boolean hasConvergingPaths,
        boolean hasDivergentTriggerPaths,
        List<String> entryNodes,
        List<String> exitNodes,
        List<String> topologicalOrder,
        String recommendedStrategy) {

    public static final String NATIVE = "native";
    public static final String STATE_MACHINE = "state-machine";

    public TopologyReport {
        entryNodes = List.copyOf(entryNodes);
        exitNodes = List.copyOf(exitNodes);
        topologicalOrder = topologicalOrder == null ? null : List.copyOf(topologicalOrder);
    }

    public boolean isAcyclic() {
        return !hasCycles;
    }
}
