package com.classlayout.core.engine;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.graph.Edge;
import com.classlayout.core.graph.GraphBuilder;
import com.classlayout.core.graph.LayoutGraph;
import com.classlayout.core.graph.Node;
import com.classlayout.core.layout.ClassBox;
import com.classlayout.core.layout.EdgePath;
import com.classlayout.core.layout.LayoutElement;
import com.classlayout.core.layout.LayoutResult;
import com.classlayout.core.layout.Point;
import com.classlayout.core.layout.Rect;
import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Relationship;
import com.classlayout.core.sugiyama.SugiyamaLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hierarchical layout engine for class diagrams.
 *
 * <p>Pipeline per call:
 * <ol>
 *   <li>build a {@link LayoutGraph} (phantom nodes for undeclared endpoints, parents
 *       above children)</li>
 *   <li>run the four {@link SugiyamaLayout} phases</li>
 *   <li>emit one {@link ClassBox} per node, then one {@link EdgePath} per relationship</li>
 *   <li>compute the overall bounds, grown by the configured margin</li>
 * </ol>
 *
 * <p>Edge paths always run from the semantic source (child, whole, client) to the
 * semantic target, whatever direction the graph used internally.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ClassDiagram diagram = ClassDiagram.of(
 *     List.of(Classifier.of("Animal"), Classifier.of("Dog")),
 *     List.of(Relationship.inheritance("Dog", "Animal")));
 *
 * LayoutResult result = new ClassLayoutEngine().layout(diagram);
 * }</pre>
 */
public class ClassLayoutEngine implements LayoutEngine<ClassDiagram> {

    private static final Logger log = LoggerFactory.getLogger(ClassLayoutEngine.class);

    private final ClassLayoutConfig config;

    public ClassLayoutEngine() {
        this(ClassLayoutConfig.defaults());
    }

    public ClassLayoutEngine(ClassLayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public String getId() {
        return "class";
    }

    @Override
    public String getDisplayName() {
        return "Class Diagram Layout";
    }

    public ClassLayoutConfig getConfig() {
        return config;
    }

    /**
     * Lays out a class diagram.
     *
     * @param diagram diagram to lay out
     * @return positioned boxes and edges; {@link LayoutResult#empty()} when the diagram
     *         declares no classifiers and no packages
     */
    @Override
    public LayoutResult layout(ClassDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        if (!diagram.hasContent()) {
            log.debug("Diagram has no classifiers or packages, returning empty layout");
            return LayoutResult.empty();
        }

        LayoutGraph graph = runPipeline(diagram);

        List<LayoutElement> elements = new ArrayList<>(graph.nodeCount() + graph.edgeCount());
        ClassBoxFactory boxes = new ClassBoxFactory(new ClassifierIndex(diagram));
        for (Node node : graph.nodes()) {
            elements.add(boxes.create(node));
        }

        EdgeRouter router = new EdgeRouter(config);
        Map<String, Integer> idCounts = new HashMap<>();
        for (Edge edge : graph.edges()) {
            Relationship relationship = diagram.relationships().get(edge.getRelationshipIndex());
            elements.add(createEdgePath(graph, edge, relationship, router, idCounts));
        }

        if (elements.isEmpty()) {
            return LayoutResult.empty();
        }

        Rect bounds = Rect.union(elements.stream().map(LayoutElement::bounds).toList()).expand(config.margin());

        log.info("Laid out {} classifier(s) and {} relationship(s) in {} x {}",
            graph.nodeCount(), graph.edgeCount(), bounds.width(), bounds.height());
        return new LayoutResult(elements, bounds);
    }

    /**
     * Runs the layout pipeline and reports how the input was normalised.
     *
     * @param diagram diagram to analyse
     * @return layout statistics; all zero when the diagram declares nothing
     */
    public LayoutStatistics analyze(ClassDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        if (!diagram.hasContent()) {
            return LayoutStatistics.empty();
        }

        LayoutGraph graph = runPipeline(diagram);

        List<String> phantomNames = graph.nodes().stream()
            .filter(Node::isPhantom)
            .map(Node::getId)
            .toList();
        int selfLoops = (int) graph.edges().stream().filter(Edge::isSelfLoop).count();
        int reversed = (int) graph.edges().stream().filter(Edge::isReversed).count();
        int layers = graph.nodeCount() == 0 ? 0 : graph.maxLayer() + 1;

        return new LayoutStatistics(
            graph.nodeCount(),
            phantomNames.size(),
            graph.edgeCount(),
            selfLoops,
            reversed,
            layers,
            graph.duplicateNames(),
            phantomNames
        );
    }

    private LayoutGraph runPipeline(ClassDiagram diagram) {
        LayoutGraph graph = new GraphBuilder(config).build(diagram);
        new SugiyamaLayout(config).run(graph);
        return graph;
    }

    private EdgePath createEdgePath(LayoutGraph graph, Edge edge, Relationship relationship,
                                    EdgeRouter router, Map<String, Integer> idCounts) {
        Node internalFrom = graph.node(edge.getFrom());
        Node internalTo = graph.node(edge.getTo());

        // Hierarchical edges were stored parent to child; draw them child to parent.
        Node visualFrom = edge.getType().isHierarchical() ? internalTo : internalFrom;
        Node visualTo = edge.getType().isHierarchical() ? internalFrom : internalTo;

        Rect sourceBox = boundsOf(visualFrom);
        List<Point> points = edge.isSelfLoop()
            ? router.selfLoop(sourceBox)
            : router.route(sourceBox, boundsOf(visualTo));

        ArrowStyle style = ArrowStyle.forKind(edge.getType());
        if (edge.isReversed()) {
            style = style.swapped();
        }

        // After a cycle-removal flip the semantic source sits at the visual end.
        String startLabel = edge.isReversed() ? relationship.toCardinality() : relationship.fromCardinality();
        String endLabel = edge.isReversed() ? relationship.fromCardinality() : relationship.toCardinality();

        return new EdgePath(
            uniqueId("edge_" + internalFrom.getId() + "_" + internalTo.getId(), idCounts),
            Rect.fromPoints(points),
            points,
            edge.getLabel(),
            style.arrowStart(),
            style.arrowEnd(),
            style.dashed(),
            edge.getType(),
            startLabel,
            endLabel,
            visualFrom.getId(),
            visualTo.getId()
        );
    }

    private static Rect boundsOf(Node node) {
        return new Rect(node.getX(), node.getY(), node.getWidth(), node.getHeight());
    }

    private static String uniqueId(String base, Map<String, Integer> idCounts) {
        int seen = idCounts.merge(base, 1, Integer::sum) - 1;
        return seen == 0 ? base : base + "#" + seen;
    }
}
