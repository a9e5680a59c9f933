package com.classlayout.core.graph;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.Member;
import com.classlayout.core.model.Relationship;
import com.classlayout.core.model.RelationshipType;
import com.classlayout.core.model.UmlPackage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphBuilder}.
 */
class GraphBuilderTest {

    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new GraphBuilder(ClassLayoutConfig.defaults());
    }

    @Test
    void build_inheritance_storesParentToChild() {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.of("Animal"), Classifier.of("Dog")),
            List.of(Relationship.inheritance("Dog", "Animal")));

        LayoutGraph graph = builder.build(diagram);

        Edge edge = graph.edge(0);
        assertThat(graph.node(edge.getFrom()).getId()).isEqualTo("Animal");
        assertThat(graph.node(edge.getTo()).getId()).isEqualTo("Dog");
        assertThat(edge.isReversed()).isFalse();
    }

    @Test
    void build_realization_storesContractToImplementor() {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.interfaceOf("Shape"), Classifier.of("Circle")),
            List.of(Relationship.realization("Circle", "Shape")));

        LayoutGraph graph = builder.build(diagram);

        assertThat(graph.node(graph.edge(0).getFrom()).getId()).isEqualTo("Shape");
    }

    @Test
    void build_composition_keepsDeclaredDirection() {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.of("Car"), Classifier.of("Engine")),
            List.of(Relationship.composition("Car", "Engine").withLabel("has")));

        LayoutGraph graph = builder.build(diagram);

        Edge edge = graph.edge(0);
        assertThat(graph.node(edge.getFrom()).getId()).isEqualTo("Car");
        assertThat(graph.node(edge.getTo()).getId()).isEqualTo("Engine");
        assertThat(edge.getType()).isEqualTo(RelationshipType.COMPOSITION);
        assertThat(edge.getLabel()).isEqualTo("has");
    }

    @Test
    void build_packages_visitedDepthFirstAfterTopLevel() {
        UmlPackage inner = UmlPackage.of("inner", List.of(Classifier.of("C")), List.of());
        UmlPackage outer = UmlPackage.of("outer", List.of(Classifier.of("B")), List.of(inner));
        UmlPackage second = UmlPackage.of("second", List.of(Classifier.of("D")), List.of());
        ClassDiagram diagram = new ClassDiagram(null, List.of(Classifier.of("A")), List.of(), List.of(outer, second));

        LayoutGraph graph = builder.build(diagram);

        assertThat(graph.nodes()).extracting(Node::getId).containsExactly("A", "B", "C", "D");
        assertThat(graph.nodes()).extracting(Node::getIndex).containsExactly(0, 1, 2, 3);
    }

    @Test
    void build_danglingReference_createsPhantomNode() {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.of("Dog")),
            List.of(Relationship.inheritance("Dog", "Animal")));

        LayoutGraph graph = builder.build(diagram);

        assertThat(graph.nodeCount()).isEqualTo(2);
        Node phantom = graph.findNode("Animal").orElseThrow();
        assertThat(phantom.isPhantom()).isTrue();
        assertThat(phantom.getWidth()).isEqualTo(120.0);
        assertThat(phantom.getHeight()).isEqualTo(60.0);
        assertThat(graph.findNode("Dog").orElseThrow().isPhantom()).isFalse();
    }

    @Test
    void build_duplicateName_firstDeclarationWins() {
        Classifier first = Classifier.of("User");
        Classifier second = Classifier.of("User").withField(Member.field("aVeryLongFieldName", "java.lang.String"));
        UmlPackage pkg = UmlPackage.of("p", List.of(second), List.of());
        ClassDiagram diagram = new ClassDiagram(null, List.of(first), List.of(), List.of(pkg));

        LayoutGraph graph = builder.build(diagram);

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(graph.node(0).getWidth()).isEqualTo(120.0);
        assertThat(graph.duplicateNames()).containsExactly("User");
    }

    @Test
    void build_selfLoop_isExcludedFromAdjacency() {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.of("Node")),
            List.of(Relationship.association("Node", "Node")));

        LayoutGraph graph = builder.build(diagram);

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.edge(0).isSelfLoop()).isTrue();
        assertThat(graph.outgoingEdges(0)).isEmpty();
        assertThat(graph.incomingEdges(0)).isEmpty();
    }

    @Test
    void build_emptyDiagram_returnsEmptyGraph() {
        LayoutGraph graph = builder.build(ClassDiagram.empty());

        assertThat(graph.nodeCount()).isZero();
        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void build_nullDiagram_throwsException() {
        assertThatThrownBy(() -> builder.build(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("diagram");
    }
}
