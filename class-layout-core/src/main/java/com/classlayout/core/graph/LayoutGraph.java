package com.classlayout.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index-based directed graph mutated in place by the layout phases.
 *
 * <p>Nodes and edges live in flat lists and reference each other by index. The edge list
 * is authoritative; the forward and reverse adjacency lists are caches of edge indices
 * grouped by {@code from} and {@code to}, rebuilt in full by {@link #rebuildAdjacency()}
 * whenever edge directions change. Self-loops are kept in the edge list but never
 * appear in the adjacency views, so they take no part in layering or ordering.
 *
 * <p>Instances are confined to a single layout run and are not thread-safe.
 */
public final class LayoutGraph {

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Integer> nodeIndex;
    private final List<String> duplicateNames;

    private List<List<Integer>> adjacency;
    private List<List<Integer>> reverseAdjacency;

    LayoutGraph(List<Node> nodes, List<Edge> edges, Map<String, Integer> nodeIndex, List<String> duplicateNames) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.nodeIndex = Map.copyOf(nodeIndex);
        this.duplicateNames = List.copyOf(duplicateNames);
        rebuildAdjacency();
    }

    /**
     * Recomputes both adjacency views from the current edge list.
     */
    public void rebuildAdjacency() {
        int n = nodes.size();
        List<List<Integer>> forward = new ArrayList<>(n);
        List<List<Integer>> reverse = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            forward.add(new ArrayList<>());
            reverse.add(new ArrayList<>());
        }
        for (int edgeIdx = 0; edgeIdx < edges.size(); edgeIdx++) {
            Edge edge = edges.get(edgeIdx);
            if (edge.isSelfLoop()) {
                continue;
            }
            forward.get(edge.getFrom()).add(edgeIdx);
            reverse.get(edge.getTo()).add(edgeIdx);
        }
        this.adjacency = forward;
        this.reverseAdjacency = reverse;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public Edge edge(int index) {
        return edges.get(index);
    }

    /**
     * Returns indices of edges leaving a node.
     *
     * @param node node index
     * @return unmodifiable edge index list
     */
    public List<Integer> outgoingEdges(int node) {
        return Collections.unmodifiableList(adjacency.get(node));
    }

    /**
     * Returns indices of edges entering a node.
     *
     * @param node node index
     * @return unmodifiable edge index list
     */
    public List<Integer> incomingEdges(int node) {
        return Collections.unmodifiableList(reverseAdjacency.get(node));
    }

    /**
     * Returns the indices of nodes on a layer, in node index order.
     *
     * @param layer layer number
     * @return node indices
     */
    public List<Integer> nodesOnLayer(int layer) {
        List<Integer> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.getLayer() == layer) {
                result.add(node.getIndex());
            }
        }
        return result;
    }

    public int maxLayer() {
        int max = 0;
        for (Node node : nodes) {
            max = Math.max(max, node.getLayer());
        }
        return max;
    }

    public Optional<Node> findNode(String name) {
        Integer idx = nodeIndex.get(name);
        return idx == null ? Optional.empty() : Optional.of(nodes.get(idx));
    }

    /**
     * Returns classifier names declared more than once; only the first declaration got a node.
     *
     * @return duplicate names in encounter order
     */
    public List<String> duplicateNames() {
        return duplicateNames;
    }

    /**
     * Checks whether the forward adjacency view contains a directed cycle.
     *
     * @return true if every node can be topologically ordered
     */
    public boolean isAcyclic() {
        int n = nodes.size();
        int[] inDegree = new int[n];
        for (int node = 0; node < n; node++) {
            for (int edgeIdx : adjacency.get(node)) {
                inDegree[edges.get(edgeIdx).getTo()]++;
            }
        }
        Deque<Integer> queue = new ArrayDeque<>();
        for (int node = 0; node < n; node++) {
            if (inDegree[node] == 0) {
                queue.add(node);
            }
        }
        int visited = 0;
        while (!queue.isEmpty()) {
            int node = queue.poll();
            visited++;
            for (int edgeIdx : adjacency.get(node)) {
                int target = edges.get(edgeIdx).getTo();
                if (--inDegree[target] == 0) {
                    queue.add(target);
                }
            }
        }
        return visited == n;
    }
}
