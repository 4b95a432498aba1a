package com.flowauto.engine;

import java.util.*;

/**
 * Index-based adjacency of a flow graph plus its topological order.
 *
 * <p>
 * Node ids are mapped to dense indices in insertion order. Successors are kept
 * in Compressed Sparse Row form: the successors of node {@code i} are
 * {@code childrenList[childrenOffset[i]]} inclusive to
 * {@code childrenList[childrenOffset[i+1]]} exclusive, in edge order. Parallel
 * edges between the same pair are kept, so the structure is a multigraph.
 *
 * <p>
 * Unlike a plain DAG sort, a cycle is not an error here: the order is simply
 * absent and {@link #isAcyclic()} reports false.
 */
public final class TopologicalOrder {
    private final String[] ids;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentOffset;
    private final int[] parentList;
    private final Map<String, Integer> idToIndex;
    // Indices in topological order, or null when the graph has a cycle.
    private final int[] order;

    private TopologicalOrder(String[] ids, int[] childrenOffset, int[] childrenList, int[] parentOffset,
            int[] parentList, Map<String, Integer> idToIndex, int[] order) {
        this.ids = ids;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.idToIndex = idToIndex;
        this.order = order;
    }

    public int nodeCount() {
        return ids.length;
    }

    public String id(int index) {
        return ids[index];
    }

    /** Resolves a node id to its index. */
    public int index(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public boolean contains(String id) {
        return idToIndex.containsKey(id);
    }

    public int childCount(int index) {
        return childrenOffset[index + 1] - childrenOffset[index];
    }

    public int child(int index, int i) {
        return childrenList[childrenOffset[index] + i];
    }

    public int parentCount(int index) {
        return parentOffset[index + 1] - parentOffset[index];
    }

    public int parent(int index, int i) {
        return parentList[parentOffset[index] + i];
    }

    /** Number of distinct predecessors. */
    public int distinctParentCount(int index) {
        int start = parentOffset[index], end = parentOffset[index + 1];
        int distinct = 0;
        for (int i = start; i < end; i++) {
            boolean seen = false;
            for (int j = start; j < i && !seen; j++)
                seen = parentList[j] == parentList[i];
            if (!seen)
                distinct++;
        }
        return distinct;
    }

    public boolean isAcyclic() {
        return order != null;
    }

    /** Node ids in topological order, or null when the graph has a cycle. */
    public List<String> order() {
        if (order == null)
            return null;
        List<String> out = new ArrayList<>(order.length);
        for (int idx : order)
            out.add(ids[idx]);
        return out;
    }

    /**
     * Shortest distance in edges from any of the given start indices, by
     * breadth-first search. Unreachable nodes get -1.
     */
    public int[] levelsFrom(int[] starts) {
        int n = ids.length;
        int[] level = new int[n];
        Arrays.fill(level, -1);
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int s : starts) {
            if (level[s] < 0) {
                level[s] = 0;
                queue[tail++] = s;
            }
        }
        while (head < tail) {
            int curr = queue[head++];
            for (int k = childrenOffset[curr]; k < childrenOffset[curr + 1]; k++) {
                int child = childrenList[k];
                if (level[child] < 0) {
                    level[child] = level[curr] + 1;
                    queue[tail++] = child;
                }
            }
        }
        return level;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     */
    public static final class Builder {
        private final List<String> ids = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String id) {
            if (idToIdx.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            idToIdx.put(id, ids.size());
            ids.add(id);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Adds a directed edge; a self-edge is allowed and forms a cycle. */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Builds the adjacency arrays and runs Kahn's algorithm. Ties are broken by
         * insertion order so the result is deterministic.
         */
        public TopologicalOrder build() {
            int n = ids.size();
            int[] inDegree = new int[n];

            // 1. In-degrees and CSR children
            int totalEdges = 0;
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                List<Integer> children = forwardEdges.get(i);
                offsets[i + 1] = offsets[i] + children.size();
                totalEdges += children.size();
                for (int child : children)
                    inDegree[child]++;
            }
            int[] flatChildren = new int[totalEdges];
            for (int i = 0; i < n; i++) {
                List<Integer> children = forwardEdges.get(i);
                for (int j = 0; j < children.size(); j++)
                    flatChildren[offsets[i] + j] = children.get(j);
            }

            // 2. CSR parents
            int[] parentOffsets = new int[n + 1];
            for (int i = 0; i < n; i++)
                parentOffsets[i + 1] = parentOffsets[i] + inDegree[i];
            int[] flatParents = new int[totalEdges];
            int[] fill = Arrays.copyOf(parentOffsets, n);
            for (int i = 0; i < n; i++)
                for (int child : forwardEdges.get(i))
                    flatParents[fill[child]++] = i;

            // 3. Kahn's algorithm
            int[] remaining = inDegree.clone();
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (remaining[i] == 0)
                    queue[tail++] = i;
            while (head < tail) {
                int curr = queue[head++];
                for (int k = offsets[curr]; k < offsets[curr + 1]; k++)
                    if (--remaining[flatChildren[k]] == 0)
                        queue[tail++] = flatChildren[k];
            }
            int[] order = tail == n ? queue : null;

            return new TopologicalOrder(ids.toArray(new String[0]), offsets, flatChildren, parentOffsets,
                    flatParents, new HashMap<>(idToIdx), order);
        }
    }
}
