package com.classlayout.core.sugiyama;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.graph.LayoutGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Four-phase hierarchical layout (Sugiyama method).
 *
 * <p>Runs, strictly in order:
 * <ol>
 *   <li>{@link CycleRemoval} - reverse DFS back-edges</li>
 *   <li>{@link LayerAssignment} - longest-path layering</li>
 *   <li>{@link CrossingMinimization} - barycenter ordering within layers</li>
 *   <li>{@link CoordinateAssignment} - x/y from layer and position</li>
 * </ol>
 *
 * <p>The graph is mutated in place. A layout instance holds no per-run state and may be
 * shared between threads as long as each thread lays out its own graph.
 */
public final class SugiyamaLayout {

    private static final Logger log = LoggerFactory.getLogger(SugiyamaLayout.class);

    private final List<LayoutPhase> phases;

    public SugiyamaLayout(ClassLayoutConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.phases = List.of(
            new CycleRemoval(),
            new LayerAssignment(),
            new CrossingMinimization(),
            new CoordinateAssignment(config)
        );
    }

    /**
     * Lays out the graph.
     *
     * @param graph graph to mutate; an empty graph is left untouched
     */
    public void run(LayoutGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        if (graph.nodeCount() == 0) {
            return;
        }
        for (LayoutPhase phase : phases) {
            log.debug("Running layout phase: {}", phase.getName());
            phase.apply(graph);
        }
    }

    public List<LayoutPhase> getPhases() {
        return phases;
    }
}
