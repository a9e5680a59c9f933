package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.Edge;
import com.classlayout.core.graph.LayoutGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Iterative barycenter ordering within layers.
 *
 * <p>Positions start at the node index. Each sweep reorders layers 1..max top-down by the
 * mean position of predecessors, then layers max-1..0 bottom-up by the mean position of
 * successors. A node without neighbours in the sweep direction keeps its current position
 * as its key. Sorting is stable, so equal keys keep node index order. The sweep count is
 * fixed; there is no convergence check.
 */
public final class CrossingMinimization implements LayoutPhase {

    /** Number of down-and-up sweeps. */
    public static final int SWEEPS = 10;

    private static final Logger log = LoggerFactory.getLogger(CrossingMinimization.class);

    @Override
    public String getName() {
        return "crossing-minimization";
    }

    @Override
    public void apply(LayoutGraph graph) {
        graph.nodes().forEach(node -> node.setPosition(node.getIndex()));

        int maxLayer = graph.maxLayer();
        if (maxLayer == 0) {
            return;
        }

        for (int sweep = 0; sweep < SWEEPS; sweep++) {
            for (int layer = 1; layer <= maxLayer; layer++) {
                orderLayer(graph, layer, true);
            }
            for (int layer = maxLayer - 1; layer >= 0; layer--) {
                orderLayer(graph, layer, false);
            }
        }

        log.debug("Completed {} barycenter sweeps over {} layers", SWEEPS, maxLayer + 1);
    }

    private void orderLayer(LayoutGraph graph, int layer, boolean usePredecessors) {
        List<Integer> members = graph.nodesOnLayer(layer);
        if (members.isEmpty()) {
            return;
        }

        Map<Integer, Double> keys = new HashMap<>();
        for (int node : members) {
            keys.put(node, barycenter(graph, node, usePredecessors));
        }

        members.sort(Comparator.comparingDouble(keys::get));

        for (int rank = 0; rank < members.size(); rank++) {
            graph.node(members.get(rank)).setPosition(rank);
        }
    }

    double barycenter(LayoutGraph graph, int node, boolean usePredecessors) {
        List<Integer> edges = usePredecessors ? graph.incomingEdges(node) : graph.outgoingEdges(node);
        if (edges.isEmpty()) {
            return graph.node(node).getPosition();
        }

        double sum = 0;
        for (int edgeIdx : edges) {
            Edge edge = graph.edge(edgeIdx);
            int neighbour = usePredecessors ? edge.getFrom() : edge.getTo();
            sum += graph.node(neighbour).getPosition();
        }
        return sum / edges.size();
    }
}
