package com.classlayout.core.engine;

import com.classlayout.core.model.RelationshipType;

import java.util.Objects;

/**
 * Marker placement and line style of a rendered relationship.
 *
 * <p>Ends refer to the visual path, which always runs from the semantic source box
 * (child, whole, client) to the semantic target box (parent, part, supplier).
 *
 * @param arrowStart marker drawn at the first point
 * @param arrowEnd marker drawn at the last point
 * @param dashed dashed line
 */
public record ArrowStyle(boolean arrowStart, boolean arrowEnd, boolean dashed) {

    private static final ArrowStyle SOLID_TO_TARGET = new ArrowStyle(false, true, false);
    private static final ArrowStyle DASHED_TO_TARGET = new ArrowStyle(false, true, true);
    private static final ArrowStyle SOLID_AT_SOURCE = new ArrowStyle(true, false, false);
    private static final ArrowStyle PLAIN = new ArrowStyle(false, false, false);

    /**
     * Returns the style table entry for a relationship kind.
     *
     * <ul>
     *   <li>inheritance, association: solid, arrow at target</li>
     *   <li>realization, dependency: dashed, arrow at target</li>
     *   <li>composition, aggregation: solid, diamond at the whole (source)</li>
     *   <li>link: solid, no marker</li>
     * </ul>
     *
     * @param kind relationship kind
     * @return arrow style
     */
    public static ArrowStyle forKind(RelationshipType kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case INHERITANCE, ASSOCIATION -> SOLID_TO_TARGET;
            case REALIZATION, DEPENDENCY -> DASHED_TO_TARGET;
            case COMPOSITION, AGGREGATION -> SOLID_AT_SOURCE;
            case LINK -> PLAIN;
        };
    }

    /**
     * Returns this style with the two ends exchanged.
     *
     * @return swapped style
     */
    public ArrowStyle swapped() {
        return new ArrowStyle(arrowEnd, arrowStart, dashed);
    }
}
