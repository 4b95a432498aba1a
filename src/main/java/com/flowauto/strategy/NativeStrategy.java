package com.flowauto.strategy;

import com.flowauto.engine.TopologyReport;
import com.flowauto.expr.ConditionCompiler;
import com.flowauto.node.*;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Lowers tree-shaped graphs to nested native blocks.
 *
 * <p>
 * Each node becomes a step, followed by the lowering of its successors:
 * <ul>
 * <li>a condition becomes an {@code if/then/else} block whose branches are the
 * lowerings of its {@code true} and {@code false} edges;</li>
 * <li>a single untagged edge continues the current sequence;</li>
 * <li>several untagged edges become a {@code parallel} block. When all branches
 * meet again, each branch stops before the meeting node and the sequence
 * resumes from it after the block.</li>
 * </ul>
 */
@Log4j2
public final class NativeStrategy extends StrategySupport {

    public NativeStrategy() {
        this(new ConditionCompiler());
    }

    public NativeStrategy(ConditionCompiler conditions) {
        super(conditions);
    }

    @Override
    public String name() {
        return TopologyReport.NATIVE;
    }

    @Override
    public String description() {
        return "Generates nested native YAML for tree-shaped flows";
    }

    @Override
    public boolean canHandle(TopologyReport report) {
        return report.isTree();
    }

    @Override
    public GeneratedDocument generate(FlowGraph graph, TopologyReport report) {
        List<String> warnings = new ArrayList<>();
        Lowering lowering = new Lowering(graph, warnings);

        List<String> order = new ArrayList<>();
        for (TriggerNode t : graph.triggers())
            order.add(t.id());

        List<String> starts = startNodes(graph, report);
        List<Object> steps;
        if (starts.isEmpty()) {
            steps = new ArrayList<>();
            warnings.add("No actions found after trigger nodes");
        } else if (starts.size() == 1) {
            steps = lowering.sequence(starts.get(0), null, new HashSet<>());
        } else {
            steps = lowering.fanOut(starts, null, new HashSet<>());
        }
        order.addAll(lowering.emitted);

        var doc = envelope(graph, triggerList(graph), steps);
        log.debug("Native lowering of '{}' emitted {} top-level steps", graph.name(), steps.size());
        return new GeneratedDocument(doc, warnings, name(), order, graph.triggers().isEmpty());
    }

    /** Per-call lowering state. */
    private final class Lowering {
        private final FlowGraph graph;
        private final List<String> warnings;
        private final Set<String> emitted = new LinkedHashSet<>();

        Lowering(FlowGraph graph, List<String> warnings) {
            this.graph = graph;
            this.warnings = warnings;
        }

        /**
         * Lowers the chain starting at {@code nodeId}, stopping before
         * {@code stopId} when it is non-null.
         */
        List<Object> sequence(String nodeId, String stopId, Set<String> visited) {
            List<Object> seq = new ArrayList<>();
            if (nodeId.equals(stopId) || !visited.add(nodeId))
                return seq;
            FlowNode node = graph.node(nodeId);
            if (node == null)
                return seq;
            emitted.add(nodeId);

            List<FlowEdge> out = graph.outgoing(nodeId);
            if (node instanceof ConditionNode c) {
                Map<String, Object> block = new LinkedHashMap<>();
                if (c.alias() != null)
                    block.put("alias", c.alias());
                block.put("if", List.of(conditions.toStructured(c.condition(), false)));
                block.put("then", branch(trueEdges(out), stopId, visited));
                List<FlowEdge> falses = falseEdges(out);
                if (!falses.isEmpty())
                    block.put("else", branch(falses, stopId, visited));
                seq.add(block);
                return seq;
            }

            if (node instanceof TriggerNode) {
                warnings.add("Trigger '" + nodeId + "' reached inside the action sequence was skipped");
            } else {
                seq.add(nodeStep(node, node.alias()));
            }

            if (out.size() == 1) {
                seq.addAll(sequence(out.get(0).target(), stopId, new HashSet<>(visited)));
            } else if (out.size() > 1) {
                List<String> targets = new ArrayList<>();
                for (FlowEdge e : out)
                    targets.add(e.target());
                seq.addAll(fanOut(targets, stopId, visited));
            }
            return seq;
        }

        /** One edge continues the branch; several run as a parallel block. */
        private List<Object> branch(List<FlowEdge> edges, String stopId, Set<String> visited) {
            if (edges.isEmpty())
                return new ArrayList<>();
            if (edges.size() == 1)
                return sequence(edges.get(0).target(), stopId, new HashSet<>(visited));
            List<String> targets = new ArrayList<>();
            for (FlowEdge e : edges)
                targets.add(e.target());
            return fanOut(targets, stopId, visited);
        }

        /**
         * Lowers several branches as a parallel block. If the branches share a
         * convergence node, they stop before it and lowering continues from it.
         */
        List<Object> fanOut(List<String> targets, String stopId, Set<String> visited) {
            List<Object> seq = new ArrayList<>();
            String meet = findConvergencePoint(targets);
            if (meet != null && meet.equals(stopId))
                meet = null;
            String branchStop = meet != null ? meet : stopId;

            List<List<Object>> branches = new ArrayList<>();
            boolean any = false;
            for (String t : targets) {
                List<Object> b = sequence(t, branchStop, new HashSet<>(visited));
                any |= !b.isEmpty();
                branches.add(b);
            }
            if (any)
                seq.add(parallelBlock(branches));
            if (meet != null)
                seq.addAll(sequence(meet, stopId, new HashSet<>(visited)));
            return seq;
        }

        /**
         * Picks the node reachable from every branch start whose largest
         * per-branch distance is smallest; null when no node is common to all.
         */
        String findConvergencePoint(List<String> starts) {
            if (starts.size() < 2)
                return null;
            List<Map<String, Integer>> distances = new ArrayList<>();
            for (String s : starts)
                distances.add(distancesFrom(s));

            String best = null;
            int bestMax = Integer.MAX_VALUE;
            for (String candidate : distances.get(0).keySet()) {
                int max = 0;
                for (Map<String, Integer> d : distances) {
                    Integer dist = d.get(candidate);
                    if (dist == null) {
                        max = Integer.MAX_VALUE;
                        break;
                    }
                    max = Math.max(max, dist);
                }
                if (max < bestMax) {
                    bestMax = max;
                    best = candidate;
                }
            }
            return best;
        }

        /** Breadth-first distances, in discovery order. */
        private Map<String, Integer> distancesFrom(String start) {
            Map<String, Integer> dist = new LinkedHashMap<>();
            Deque<String> queue = new ArrayDeque<>();
            dist.put(start, 0);
            queue.add(start);
            while (!queue.isEmpty()) {
                String curr = queue.poll();
                for (FlowEdge e : graph.outgoing(curr)) {
                    if (!dist.containsKey(e.target())) {
                        dist.put(e.target(), dist.get(curr) + 1);
                        queue.add(e.target());
                    }
                }
            }
            return dist;
        }
    }

    /** Each branch is written as a {@code sequence} so empty branches survive. */
    private static Map<String, Object> parallelBlock(List<List<Object>> branches) {
        List<Object> items = new ArrayList<>();
        for (List<Object> b : branches)
            items.add(Map.of("sequence", b));
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("parallel", items);
        return block;
    }
}
