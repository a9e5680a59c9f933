package com.classlayout.core.sugiyama;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.graph.LayoutGraph;
import com.classlayout.core.graph.Node;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static com.classlayout.core.sugiyama.SugiyamaTestGraphs.associations;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CoordinateAssignment}.
 */
class CoordinateAssignmentTest {

    private static LayoutGraph laidOut(ClassLayoutConfig config, String names, String... arcs) {
        LayoutGraph graph = associations(names, arcs);
        new CycleRemoval().apply(graph);
        new LayerAssignment().apply(graph);
        new CrossingMinimization().apply(graph);
        new CoordinateAssignment(config).apply(graph);
        return graph;
    }

    @Test
    void apply_yIsFixedBandPerLayer() {
        LayoutGraph graph = laidOut(ClassLayoutConfig.defaults(), "A,B,C", "A->B", "B->C");

        assertThat(graph.nodes()).extracting(Node::getY).containsExactly(20.0, 160.0, 300.0);
    }

    @Test
    void apply_narrowLayer_isCentredOnWidest() {
        LayoutGraph graph = laidOut(ClassLayoutConfig.defaults(), "Animal,Dog,Cat", "Animal->Dog", "Animal->Cat");

        // widest layer: 120 + 50 + 120 = 290; top layer shifted by (290 - 120) / 2
        assertThat(graph.findNode("Animal").orElseThrow().getX()).isEqualTo(105.0);
        assertThat(graph.findNode("Dog").orElseThrow().getX()).isEqualTo(20.0);
        assertThat(graph.findNode("Cat").orElseThrow().getX()).isEqualTo(190.0);
    }

    @Test
    void apply_customSpacing_isHonoured() {
        ClassLayoutConfig config = ClassLayoutConfig.defaults().withNodeSpacing(10, 40).withMargin(0);

        LayoutGraph graph = laidOut(config, "A,B,C", "A->C");

        // layer 0: A, B; layer 1: C
        assertThat(graph.findNode("A").orElseThrow().getX()).isEqualTo(0.0);
        assertThat(graph.findNode("B").orElseThrow().getX()).isEqualTo(130.0);
        assertThat(graph.findNode("C").orElseThrow().getY()).isEqualTo(100.0);
    }

    @Test
    void apply_sameLayer_boxesDoNotOverlap() {
        LayoutGraph graph = laidOut(ClassLayoutConfig.defaults(), "R,A,B,C,D", "R->A", "R->B", "R->C", "R->D");

        List<Node> layer = graph.nodesOnLayer(1).stream()
            .map(graph::node)
            .sorted(Comparator.comparingDouble(Node::getX))
            .toList();
        for (int i = 1; i < layer.size(); i++) {
            Node left = layer.get(i - 1);
            Node right = layer.get(i);
            assertThat(right.getX()).isGreaterThanOrEqualTo(left.getX() + left.getWidth() + 50.0);
        }
    }
}
