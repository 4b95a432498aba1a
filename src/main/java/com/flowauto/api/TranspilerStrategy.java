package com.flowauto.api;

import com.flowauto.engine.TopologyReport;
import com.flowauto.node.FlowGraph;
import com.flowauto.strategy.GeneratedDocument;

/**
 * A lowering backend that turns a validated flow graph into an automation
 * document.
 *
 * <p>
 * Implementations are stateless and may be shared between calls.
 */
public interface TranspilerStrategy {

    /** Unique name, also written into round-trip metadata. */
    String name();

    String description();

    /** Whether this backend produces correct output for the analyzed shape. */
    boolean canHandle(TopologyReport report);

    GeneratedDocument generate(FlowGraph graph, TopologyReport report);
}
