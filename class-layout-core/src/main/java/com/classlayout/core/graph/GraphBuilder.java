package com.classlayout.core.graph;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.Relationship;
import com.classlayout.core.model.UmlPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link LayoutGraph} from a class diagram.
 *
 * <p>Nodes are created once per first-seen name, in this order:
 * <ol>
 *   <li>top-level classifiers in declaration order</li>
 *   <li>package classifiers, depth-first, a package's classifiers before its sub-packages</li>
 *   <li>phantom nodes for relationship endpoints that were never declared</li>
 * </ol>
 * A repeated name keeps the node (and content) of its first declaration.
 *
 * <p>One edge is created per relationship. Inheritance and realization are stored
 * parent to child so that parents end up on lower layers; all other kinds keep their
 * declared direction.
 *
 * <p>Building never fails for a structurally valid diagram.
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final NodeSizer sizer;

    public GraphBuilder(ClassLayoutConfig config) {
        this.sizer = new NodeSizer(Objects.requireNonNull(config, "config must not be null"));
    }

    /**
     * Builds the graph.
     *
     * @param diagram diagram to convert
     * @return a fresh graph owned by the caller
     */
    public LayoutGraph build(ClassDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");

        List<Node> nodes = new ArrayList<>();
        Map<String, Integer> nodeIndex = new HashMap<>();
        List<String> duplicates = new ArrayList<>();

        for (Classifier classifier : diagram.classifiers()) {
            addClassifier(classifier, nodes, nodeIndex, duplicates);
        }
        collectPackages(diagram.packages(), nodes, nodeIndex, duplicates);

        int phantoms = 0;
        for (Relationship rel : diagram.relationships()) {
            for (String name : new String[] {rel.from(), rel.to()}) {
                if (!nodeIndex.containsKey(name)) {
                    int index = nodes.size();
                    nodeIndex.put(name, index);
                    nodes.add(new Node(name, index, sizer.phantomSize(), true));
                    phantoms++;
                }
            }
        }

        List<Edge> edges = new ArrayList<>(diagram.relationships().size());
        List<Relationship> relationships = diagram.relationships();
        for (int i = 0; i < relationships.size(); i++) {
            Relationship rel = relationships.get(i);
            int fromIdx = nodeIndex.get(rel.from());
            int toIdx = nodeIndex.get(rel.to());
            if (rel.type().isHierarchical()) {
                edges.add(new Edge(i, toIdx, fromIdx, rel.type(), rel.label()));
            } else {
                edges.add(new Edge(i, fromIdx, toIdx, rel.type(), rel.label()));
            }
        }

        if (!duplicates.isEmpty()) {
            log.debug("Ignored duplicate classifier declarations: {}", duplicates);
        }
        log.debug("Built graph with {} nodes ({} phantom) and {} edges", nodes.size(), phantoms, edges.size());

        return new LayoutGraph(nodes, edges, nodeIndex, duplicates);
    }

    private void collectPackages(List<UmlPackage> packages, List<Node> nodes,
                                 Map<String, Integer> nodeIndex, List<String> duplicates) {
        for (UmlPackage pkg : packages) {
            for (Classifier classifier : pkg.classifiers()) {
                addClassifier(classifier, nodes, nodeIndex, duplicates);
            }
            collectPackages(pkg.packages(), nodes, nodeIndex, duplicates);
        }
    }

    private void addClassifier(Classifier classifier, List<Node> nodes,
                               Map<String, Integer> nodeIndex, List<String> duplicates) {
        String name = classifier.name();
        if (nodeIndex.containsKey(name)) {
            duplicates.add(name);
            return;
        }
        int index = nodes.size();
        nodeIndex.put(name, index);
        nodes.add(new Node(name, index, sizer.sizeOf(classifier), false));
    }
}
