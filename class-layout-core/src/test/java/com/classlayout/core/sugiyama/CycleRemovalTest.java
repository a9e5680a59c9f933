package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.Edge;
import com.classlayout.core.graph.LayoutGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.classlayout.core.sugiyama.SugiyamaTestGraphs.associations;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CycleRemoval}.
 */
class CycleRemovalTest {

    private CycleRemoval phase;

    @BeforeEach
    void setUp() {
        phase = new CycleRemoval();
    }

    @Test
    void apply_acyclicGraph_reversesNothing() {
        LayoutGraph graph = associations("A,B,C", "A->B", "B->C", "A->C");

        phase.apply(graph);

        assertThat(graph.edges()).noneMatch(Edge::isReversed);
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void apply_threeCycle_reversesClosingEdge() {
        LayoutGraph graph = associations("A,B,C", "A->B", "B->C", "C->A");
        assertThat(graph.isAcyclic()).isFalse();

        phase.apply(graph);

        assertThat(graph.edges()).filteredOn(Edge::isReversed).hasSize(1);
        Edge closing = graph.edge(2);
        assertThat(closing.isReversed()).isTrue();
        assertThat(graph.node(closing.getFrom()).getId()).isEqualTo("A");
        assertThat(graph.node(closing.getTo()).getId()).isEqualTo("C");
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void apply_twoCycle_rebuildsAdjacency() {
        LayoutGraph graph = associations("A,B", "A->B", "B->A");

        phase.apply(graph);

        assertThat(graph.isAcyclic()).isTrue();
        assertThat(graph.outgoingEdges(0)).containsExactly(0, 1);
        assertThat(graph.incomingEdges(1)).containsExactly(0, 1);
    }

    @Test
    void findBackEdges_followsIndexAndAdjacencyOrder() {
        // Two disjoint cycles; each is closed by the edge found last in DFS order
        LayoutGraph graph = associations("A,B,C,D", "C->D", "A->B", "D->C", "B->A");

        assertThat(phase.findBackEdges(graph)).containsExactly(3, 2);
    }

    @Test
    void apply_selfLoop_isNotReversed() {
        LayoutGraph graph = associations("A", "A->A");

        phase.apply(graph);

        assertThat(graph.edge(0).isReversed()).isFalse();
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void apply_longChainWithBackEdge_doesNotOverflowStack() {
        int n = 5_000;
        List<String> names = new ArrayList<>(n);
        List<String> arcs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            names.add("N" + i);
            arcs.add("N" + i + "->N" + ((i + 1) % n));
        }
        LayoutGraph graph = associations(names, arcs.toArray(new String[0]));

        phase.apply(graph);

        assertThat(graph.edges()).filteredOn(Edge::isReversed).hasSize(1);
        assertThat(graph.edge(n - 1).isReversed()).isTrue();
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void getName_isStable() {
        assertThat(phase.getName()).isEqualTo("cycle-removal");
    }
}
