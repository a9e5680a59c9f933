package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.LayoutGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Longest-path layering.
 *
 * <p>Nodes are visited in topological order (Kahn's algorithm over the forward adjacency)
 * and placed one layer below their deepest predecessor; nodes without predecessors stay on
 * layer 0. Every non-loop edge therefore points from a lower to a strictly higher layer.
 */
public final class LayerAssignment implements LayoutPhase {

    private static final Logger log = LoggerFactory.getLogger(LayerAssignment.class);

    @Override
    public String getName() {
        return "layer-assignment";
    }

    @Override
    public void apply(LayoutGraph graph) {
        int n = graph.nodeCount();
        int[] layers = new int[n];

        for (int node : topologicalOrder(graph)) {
            int layer = 0;
            for (int edgeIdx : graph.incomingEdges(node)) {
                layer = Math.max(layer, layers[graph.edge(edgeIdx).getFrom()] + 1);
            }
            layers[node] = layer;
        }

        for (int i = 0; i < n; i++) {
            graph.node(i).setLayer(layers[i]);
        }

        log.debug("Assigned {} layer(s)", n == 0 ? 0 : graph.maxLayer() + 1);
    }

    /**
     * Kahn's topological sort. Nodes left over by a remaining cycle are appended in index
     * order instead of failing.
     *
     * @param graph graph to sort
     * @return every node index exactly once
     */
    List<Integer> topologicalOrder(LayoutGraph graph) {
        int n = graph.nodeCount();
        int[] inDegree = new int[n];
        for (int node = 0; node < n; node++) {
            inDegree[node] = graph.incomingEdges(node).size();
        }

        Deque<Integer> queue = new ArrayDeque<>();
        for (int node = 0; node < n; node++) {
            if (inDegree[node] == 0) {
                queue.add(node);
            }
        }

        List<Integer> order = new ArrayList<>(n);
        boolean[] placed = new boolean[n];
        while (!queue.isEmpty()) {
            int node = queue.poll();
            order.add(node);
            placed[node] = true;
            for (int edgeIdx : graph.outgoingEdges(node)) {
                int target = graph.edge(edgeIdx).getTo();
                if (--inDegree[target] == 0) {
                    queue.add(target);
                }
            }
        }

        if (order.size() < n) {
            log.warn("Graph still cyclic after cycle removal; appending {} node(s) in index order",
                n - order.size());
            for (int node = 0; node < n; node++) {
                if (!placed[node]) {
                    order.add(node);
                }
            }
        }
        return order;
    }
}
