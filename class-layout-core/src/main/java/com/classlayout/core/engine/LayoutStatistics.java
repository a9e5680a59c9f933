package com.classlayout.core.engine;

import java.util.List;

/**
 * Diagnostics collected while laying out a class diagram.
 *
 * <p>Exposes how the input was normalised: which endpoints had to be invented, which
 * declarations were ignored and how many edges the cycle removal flipped.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * LayoutStatistics stats = new ClassLayoutEngine().analyze(diagram);
 * if (stats.phantomCount() > 0) {
 *     log.warn("Undeclared classifiers: {}", stats.phantomNames());
 * }
 * }</pre>
 *
 * @param nodeCount nodes in the graph, phantoms included
 * @param phantomCount nodes created for undeclared relationship endpoints
 * @param edgeCount edges, one per relationship
 * @param selfLoopCount relationships whose endpoints are the same classifier
 * @param reversedEdgeCount edges flipped to break cycles
 * @param layerCount number of layers, 0 for an empty graph
 * @param duplicateNames names declared more than once, in encounter order
 * @param phantomNames names of phantom nodes in creation order
 */
public record LayoutStatistics(
    int nodeCount,
    int phantomCount,
    int edgeCount,
    int selfLoopCount,
    int reversedEdgeCount,
    int layerCount,
    List<String> duplicateNames,
    List<String> phantomNames
) {
    /**
     * Compact constructor with defaults.
     */
    public LayoutStatistics {
        duplicateNames = duplicateNames == null ? List.of() : List.copyOf(duplicateNames);
        phantomNames = phantomNames == null ? List.of() : List.copyOf(phantomNames);
    }

    public static LayoutStatistics empty() {
        return new LayoutStatistics(0, 0, 0, 0, 0, 0, List.of(), List.of());
    }

    /**
     * Returns whether the input needed no normalisation.
     *
     * @return true if there are no phantoms, duplicates or reversed edges
     */
    public boolean isClean() {
        return phantomCount == 0 && duplicateNames.isEmpty() && reversedEdgeCount == 0;
    }
}
