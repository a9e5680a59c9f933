package com.classlayout.core.sugiyama;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.graph.LayoutGraph;
import com.classlayout.core.graph.Node;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Converts layers and intra-layer positions into coordinates.
 *
 * <p>Every layer is a band of fixed height {@link ClassLayoutConfig#layerPitch()}, whatever
 * its tallest box. Within a layer boxes are packed left to right in position order with
 * {@code nodeHorizontalSpacing} between them; each layer is then shifted right by half of
 * the difference between its width and the widest layer, centring all layers.
 */
public final class CoordinateAssignment implements LayoutPhase {

    private final ClassLayoutConfig config;

    public CoordinateAssignment(ClassLayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public String getName() {
        return "coordinate-assignment";
    }

    @Override
    public void apply(LayoutGraph graph) {
        for (Node node : graph.nodes()) {
            node.setY(config.margin() + node.getLayer() * config.layerPitch());
        }

        int maxLayer = graph.maxLayer();
        double maxLayerWidth = 0;
        for (int layer = 0; layer <= maxLayer; layer++) {
            maxLayerWidth = Math.max(maxLayerWidth, layerWidth(graph, graph.nodesOnLayer(layer)));
        }

        for (int layer = 0; layer <= maxLayer; layer++) {
            positionLayer(graph, layer, maxLayerWidth);
        }
    }

    private void positionLayer(LayoutGraph graph, int layer, double maxLayerWidth) {
        List<Integer> members = graph.nodesOnLayer(layer);
        if (members.isEmpty()) {
            return;
        }
        members.sort(Comparator.comparingInt(idx -> graph.node(idx).getPosition()));

        double offset = (maxLayerWidth - layerWidth(graph, members)) / 2;
        double x = config.margin();
        for (int idx : members) {
            Node node = graph.node(idx);
            node.setX(x + offset);
            x += node.getWidth() + config.nodeHorizontalSpacing();
        }
    }

    private double layerWidth(LayoutGraph graph, List<Integer> members) {
        if (members.isEmpty()) {
            return 0;
        }
        double width = 0;
        for (int idx : members) {
            width += graph.node(idx).getWidth();
        }
        return width + (members.size() - 1) * config.nodeHorizontalSpacing();
    }
}
