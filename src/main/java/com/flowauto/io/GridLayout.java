package com.flowauto.io;

import com.flowauto.api.LayoutEngine;
import com.flowauto.node.FlowEdge;
import com.flowauto.node.FlowNode;
import com.flowauto.node.Position;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places nodes on a grid of fixed-size cells, row by row.
 */
public final class GridLayout implements LayoutEngine {
    private final int columns;
    private final double cellWidth;
    private final double cellHeight;

    public GridLayout() {
        this(3, 300, 150);
    }

    public GridLayout(int columns, double cellWidth, double cellHeight) {
        if (columns < 1)
            throw new IllegalArgumentException("columns must be positive: " + columns);
        this.columns = columns;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    @Override
    public Map<String, Position> layout(List<FlowNode> nodes, List<FlowEdge> edges) {
        Map<String, Position> out = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            int row = i / columns, col = i % columns;
            out.put(nodes.get(i).id(), new Position(100 + col * cellWidth, 100 + row * cellHeight));
        }
        return out;
    }
}
