package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.Edge;
import com.classlayout.core.graph.LayoutGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Makes the graph acyclic by reversing DFS back-edges.
 *
 * <p>A depth-first search starts from every unvisited node in index order and follows
 * outgoing edges in adjacency order. An edge reaching a node that is still on the DFS
 * stack closes a cycle and is recorded. After the traversal every recorded edge is
 * reversed and the adjacency views are rebuilt.
 *
 * <p>The result is acyclic, but the reversed set is not guaranteed to be minimal; which
 * edge of a cycle gets reversed depends on traversal order.
 */
public final class CycleRemoval implements LayoutPhase {

    private static final Logger log = LoggerFactory.getLogger(CycleRemoval.class);

    @Override
    public String getName() {
        return "cycle-removal";
    }

    @Override
    public void apply(LayoutGraph graph) {
        List<Integer> backEdges = findBackEdges(graph);

        for (int edgeIdx : backEdges) {
            graph.edge(edgeIdx).reverse();
        }
        graph.rebuildAdjacency();

        log.debug("Reversed {} back-edge(s)", backEdges.size());
    }

    /**
     * Finds back-edges without recursion so deep chains cannot overflow the call stack.
     * Visit order is identical to the recursive formulation.
     *
     * @param graph graph to search
     * @return back-edge indices in discovery order
     */
    List<Integer> findBackEdges(LayoutGraph graph) {
        int n = graph.nodeCount();
        boolean[] visited = new boolean[n];
        boolean[] onStack = new boolean[n];
        List<Integer> backEdges = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (visited[start]) {
                continue;
            }
            // frame = {node, next outgoing edge cursor}
            Deque<int[]> stack = new ArrayDeque<>();
            visited[start] = true;
            onStack[start] = true;
            stack.push(new int[] {start, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                List<Integer> outgoing = graph.outgoingEdges(node);

                if (frame[1] < outgoing.size()) {
                    int edgeIdx = outgoing.get(frame[1]++);
                    Edge edge = graph.edge(edgeIdx);
                    int target = edge.getTo();
                    if (!visited[target]) {
                        visited[target] = true;
                        onStack[target] = true;
                        stack.push(new int[] {target, 0});
                    } else if (onStack[target]) {
                        backEdges.add(edgeIdx);
                    }
                } else {
                    onStack[node] = false;
                    stack.pop();
                }
            }
        }
        return backEdges;
    }
}
