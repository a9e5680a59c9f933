package com.classlayout.core.graph;

import com.classlayout.core.model.RelationshipType;

import java.util.Objects;

/**
 * Graph edge for one relationship, referencing its endpoints by node index.
 *
 * <p>The construction-time direction already has parents before children for
 * hierarchical kinds (see {@link GraphBuilder}). Cycle removal may then
 * {@link #reverse()} the edge once more.
 */
public final class Edge {

    private final int relationshipIndex;
    private final RelationshipType type;
    private final String label;

    private int from;
    private int to;
    private boolean reversed;

    Edge(int relationshipIndex, int from, int to, RelationshipType type, String label) {
        this.relationshipIndex = relationshipIndex;
        this.from = from;
        this.to = to;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.label = label;
    }

    /**
     * Returns the position of the originating relationship in the diagram.
     *
     * @return relationship index
     */
    public int getRelationshipIndex() {
        return relationshipIndex;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public RelationshipType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns whether cycle removal flipped this edge.
     *
     * @return true if {@link #reverse()} was called
     */
    public boolean isReversed() {
        return reversed;
    }

    public boolean isSelfLoop() {
        return from == to;
    }

    /**
     * Swaps the endpoints and marks the edge reversed.
     *
     * <p>Adjacency views of the owning graph are stale afterwards until
     * {@link LayoutGraph#rebuildAdjacency()} runs.
     *
     * @throws IllegalStateException if the edge was already reversed
     */
    public void reverse() {
        if (reversed) {
            throw new IllegalStateException("edge for relationship " + relationshipIndex + " already reversed");
        }
        int tmp = from;
        from = to;
        to = tmp;
        reversed = true;
    }

    @Override
    public String toString() {
        return "Edge[" + from + "->" + to + " " + type + (reversed ? " reversed" : "") + "]";
    }
}
