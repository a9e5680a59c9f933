package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.LayoutGraph;
import com.classlayout.core.graph.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static com.classlayout.core.sugiyama.SugiyamaTestGraphs.associations;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CrossingMinimization}.
 */
class CrossingMinimizationTest {

    private CrossingMinimization phase;

    @BeforeEach
    void setUp() {
        phase = new CrossingMinimization();
    }

    private static LayoutGraph layered(String names, String... arcs) {
        LayoutGraph graph = associations(names, arcs);
        new CycleRemoval().apply(graph);
        new LayerAssignment().apply(graph);
        return graph;
    }

    @Test
    void apply_crossedPair_isUncrossed() {
        LayoutGraph graph = layered("P0,P1,Q0,Q1", "P0->Q1", "P1->Q0");

        phase.apply(graph);

        assertThat(position(graph, "P0")).isZero();
        assertThat(position(graph, "P1")).isEqualTo(1);
        assertThat(position(graph, "Q1")).isZero();
        assertThat(position(graph, "Q0")).isEqualTo(1);
    }

    @Test
    void apply_equalKeys_keepIndexOrder() {
        LayoutGraph graph = layered("Animal,Dog,Cat", "Animal->Dog", "Animal->Cat");

        phase.apply(graph);

        assertThat(position(graph, "Dog")).isZero();
        assertThat(position(graph, "Cat")).isEqualTo(1);
        assertThat(position(graph, "Animal")).isZero();
    }

    @Test
    void apply_singleLayer_positionsEqualIndex() {
        LayoutGraph graph = layered("A,B,C");
        graph.node(0).setPosition(7);

        phase.apply(graph);

        assertThat(graph.nodes()).extracting(Node::getPosition).containsExactly(0, 1, 2);
    }

    @Test
    void apply_positionsArePermutationPerLayer() {
        LayoutGraph graph = layered("A,B,C,D,E,F", "A->D", "B->E", "C->F", "A->F", "C->D", "B->D");

        phase.apply(graph);

        for (int layer = 0; layer <= graph.maxLayer(); layer++) {
            int size = graph.nodesOnLayer(layer).size();
            assertThat(graph.nodesOnLayer(layer))
                .extracting(idx -> graph.node(idx).getPosition())
                .containsExactlyInAnyOrderElementsOf(IntStream.range(0, size).boxed().toList());
        }
    }

    @Test
    void barycenter_noNeighbours_keepsCurrentPosition() {
        LayoutGraph graph = layered("A,B", "A->B");
        graph.node(0).setPosition(3);

        assertThat(phase.barycenter(graph, 0, true)).isEqualTo(3.0);
        assertThat(phase.barycenter(graph, 1, true)).isEqualTo(3.0);
    }

    private static int position(LayoutGraph graph, String name) {
        return graph.findNode(name).orElseThrow().getPosition();
    }
}
