package com.classlayout.core.sugiyama;

import com.classlayout.core.graph.LayoutGraph;

/**
 * One step of the hierarchical layout pipeline.
 *
 * <p>Phases mutate the graph in place and must run in the order given by
 * {@link SugiyamaLayout}: each one relies on the state written by its predecessors.
 */
public interface LayoutPhase {

    /**
     * Returns a short phase name for logging.
     *
     * @return phase name
     */
    String getName();

    /**
     * Applies the phase to the graph.
     *
     * @param graph graph to mutate
     */
    void apply(LayoutGraph graph);
}
