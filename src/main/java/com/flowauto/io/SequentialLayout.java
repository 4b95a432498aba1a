package com.flowauto.io;

import com.flowauto.api.LayoutEngine;
import com.flowauto.node.FlowEdge;
import com.flowauto.node.FlowNode;
import com.flowauto.node.Position;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places nodes left to right on one row, in list order.
 */
public final class SequentialLayout implements LayoutEngine {
    public static final double START_X = 100;
    public static final double START_Y = 150;
    public static final double SPACING = 250;

    @Override
    public Map<String, Position> layout(List<FlowNode> nodes, List<FlowEdge> edges) {
        Map<String, Position> out = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++)
            out.put(nodes.get(i).id(), new Position(START_X + i * SPACING, START_Y));
        return out;
    }
}
