package com.flowauto.api;

import com.flowauto.node.FlowEdge;
import com.flowauto.node.FlowNode;
import com.flowauto.node.Position;

import java.util.List;
import java.util.Map;

/**
 * Places nodes that have no saved position. Only cosmetics depend on the
 * result, so any deterministic placement is acceptable.
 */
@FunctionalInterface
public interface LayoutEngine {

    /**
     * @return one position per node id in {@code nodes}
     */
    Map<String, Position> layout(List<FlowNode> nodes, List<FlowEdge> edges);
}
