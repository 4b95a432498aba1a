package com.flowauto.engine;

import com.flowauto.node.*;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Classifies the shape of a flow graph and recommends a backend.
 *
 * <p>
 * A graph is tree-shaped when it is acyclic and has no cross-links, no
 * unaccepted converging paths, and no triggers leading to different first
 * steps. Two forms of convergence are accepted because the native backend can
 * express them: several triggers sharing one first step, and branches of an
 * untagged fan-out (a parallel block) meeting again.
 *
 * <p>
 * The parallel detection is a conservative heuristic. It exists to keep the
 * native backend from producing wrong output, not to accept every graph a
 * person could express with parallel blocks.
 */
@Log4j2
public final class TopologyAnalyzer {

    public TopologyReport analyze(FlowGraph graph) {
        TopologicalOrder topo = buildTopology(graph);
        int n = topo.nodeCount();

        boolean hasCycles = !topo.isAcyclic();
        List<String> entries = new ArrayList<>();
        List<String> exits = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (topo.parentCount(i) == 0)
                entries.add(topo.id(i));
            if (topo.childCount(i) == 0)
                exits.add(topo.id(i));
        }

        boolean crossLinks = !hasCycles && detectCrossLinks(graph, topo, entries);
        boolean converging = detectConvergingPaths(graph, topo);
        boolean divergent = detectDivergentTriggerPaths(graph);
        boolean isTree = !hasCycles && !crossLinks && !converging && !divergent;

        TopologyReport report = new TopologyReport(
                hasCycles,
                isTree,
                entries.size() > 1,
                crossLinks,
                converging,
                divergent,
                entries,
                exits,
                topo.order(),
                isTree ? TopologyReport.NATIVE : TopologyReport.STATE_MACHINE);
        log.trace("Topology of '{}': {}", graph.name(), report);
        return report;
    }

    static TopologicalOrder buildTopology(FlowGraph graph) {
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (FlowNode node : graph.nodes())
            b.addNode(node.id());
        for (FlowEdge edge : graph.edges())
            b.addEdge(edge.source(), edge.target());
        return b.build();
    }

    // ── Cross-links ──────────────────────────────────────────────────

    private boolean detectCrossLinks(FlowGraph graph, TopologicalOrder topo, List<String> entries) {
        int[] starts = new int[entries.size()];
        for (int i = 0; i < starts.length; i++)
            starts[i] = topo.index(entries.get(i));
        int[] level = topo.levelsFrom(starts);

        for (FlowEdge edge : graph.edges()) {
            int src = level[topo.index(edge.source())];
            int tgt = level[topo.index(edge.target())];
            if (src < 0 || tgt < 0)
                continue;
            if (tgt > src + 1 || tgt < src) {
                if (findParallelSource(graph, topo, edge.source()) == null
                        || !rejoinsCleanly(graph, topo, edge.target(), Set.of(edge.source()))) {
                    log.trace("Cross-link {} -> {} (levels {} -> {})", edge.source(), edge.target(), src, tgt);
                    return true;
                }
            }
        }
        return false;
    }

    // ── Converging paths ─────────────────────────────────────────────

    private boolean detectConvergingPaths(FlowGraph graph, TopologicalOrder topo) {
        for (FlowNode node : graph.nodes()) {
            int idx = topo.index(node.id());
            if (topo.distinctParentCount(idx) < 2)
                continue;

            Set<String> sources = new LinkedHashSet<>();
            for (int i = 0; i < topo.parentCount(idx); i++)
                sources.add(topo.id(topo.parent(idx, i)));

            if (allTriggers(graph, sources))
                continue;
            if (shareParallelSource(graph, topo, sources) && !isConditionFanIn(graph, node.id(), sources)
                    && rejoinsCleanly(graph, topo, node.id(), sources))
                continue;

            log.trace("Converging paths into {} from {}", node.id(), sources);
            return true;
        }
        return false;
    }

    private static boolean allTriggers(FlowGraph graph, Set<String> sources) {
        for (String s : sources)
            if (!(graph.node(s) instanceof TriggerNode))
                return false;
        return true;
    }

    private static boolean shareParallelSource(FlowGraph graph, TopologicalOrder topo, Set<String> sources) {
        String common = null;
        for (String s : sources) {
            String p = findParallelSource(graph, topo, s);
            if (p == null || (common != null && !common.equals(p)))
                return false;
            common = p;
        }
        return common != null;
    }

    /**
     * True when every source is a condition reaching the target only through
     * {@code true} edges. That is ordinary branching, not parallel execution.
     */
    private static boolean isConditionFanIn(FlowGraph graph, String target, Set<String> sources) {
        for (String s : sources)
            if (!(graph.node(s) instanceof ConditionNode))
                return false;
        for (FlowEdge e : graph.incoming(target))
            if (sources.contains(e.source()) && e.branch() != BranchTag.TRUE)
                return false;
        return true;
    }

    /**
     * A parallel branch rejoins at {@code target} only if every condition on
     * the way back from each source to the fan-out sends both outcomes to
     * {@code target}. The step after a parallel block continues from every
     * open end of every branch, so an outcome that never reaches the rejoin
     * node would gain an edge to it.
     */
    private static boolean rejoinsCleanly(FlowGraph graph, TopologicalOrder topo, String target,
            Set<String> sources) {
        for (String s : sources) {
            Set<String> seen = new HashSet<>();
            String current = s;
            while (current != null && seen.add(current) && !isParallelFanOut(graph, current)) {
                if (graph.node(current) instanceof ConditionNode && !bothOutcomesReach(graph, current, target)) {
                    log.trace("Condition {} does not rejoin at {} on both outcomes", current, target);
                    return false;
                }
                int idx = topo.index(current);
                current = topo.distinctParentCount(idx) == 1 ? topo.id(topo.parent(idx, 0)) : null;
            }
        }
        return true;
    }

    /** Untagged edges count as the {@code true} outcome. */
    private static boolean bothOutcomesReach(FlowGraph graph, String conditionId, String target) {
        boolean whenTrue = false;
        boolean whenFalse = false;
        for (FlowEdge e : graph.outgoing(conditionId)) {
            if (!reaches(graph, e.target(), target))
                return false;
            if (e.branch() == BranchTag.FALSE)
                whenFalse = true;
            else
                whenTrue = true;
        }
        return whenTrue && whenFalse;
    }

    private static boolean reaches(FlowGraph graph, String from, String target) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            String curr = queue.poll();
            if (curr.equals(target))
                return true;
            if (!seen.add(curr))
                continue;
            for (FlowEdge e : graph.outgoing(curr))
                queue.add(e.target());
        }
        return false;
    }

    /**
     * Walks back from {@code nodeId} (inclusive) through single-predecessor
     * chains and returns the first node that fans out over two or more untagged
     * edges, or null when the chain ends without one.
     */
    static String findParallelSource(FlowGraph graph, TopologicalOrder topo, String nodeId) {
        Set<String> seen = new HashSet<>();
        String current = nodeId;
        while (current != null && seen.add(current)) {
            if (isParallelFanOut(graph, current))
                return current;
            int idx = topo.index(current);
            if (topo.distinctParentCount(idx) != 1)
                return null;
            current = topo.id(topo.parent(idx, 0));
        }
        return null;
    }

    static boolean isParallelFanOut(FlowGraph graph, String nodeId) {
        List<FlowEdge> out = graph.outgoing(nodeId);
        if (out.size() < 2)
            return false;
        for (FlowEdge e : out)
            if (e.isTagged())
                return false;
        return true;
    }

    // ── Divergent triggers ───────────────────────────────────────────

    private static boolean detectDivergentTriggerPaths(FlowGraph graph) {
        List<TriggerNode> triggers = graph.triggers();
        if (triggers.size() < 2)
            return false;
        Set<String> first = successors(graph, triggers.get(0).id());
        for (int i = 1; i < triggers.size(); i++)
            if (!first.equals(successors(graph, triggers.get(i).id())))
                return true;
        return false;
    }

    private static Set<String> successors(FlowGraph graph, String nodeId) {
        Set<String> out = new HashSet<>();
        for (FlowEdge e : graph.outgoing(nodeId))
            out.add(e.target());
        return out;
    }
}
