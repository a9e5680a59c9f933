package com.classlayout.core.layout;

import com.classlayout.core.model.RelationshipType;

import java.util.List;
import java.util.Objects;

/**
 * Orthogonal polyline for one relationship.
 *
 * <p>{@code arrowStart} and {@code arrowEnd} say at which end of {@link #points()} the
 * kind-specific marker is drawn (triangle for generalization, diamond for
 * composition and aggregation, arrowhead otherwise).
 *
 * @param id element id
 * @param bounds bounding box of the waypoints
 * @param points 2 to 4 waypoints
 * @param label optional relationship label
 * @param arrowStart marker at the first point
 * @param arrowEnd marker at the last point
 * @param dashed dashed line style
 * @param kind relationship kind
 * @param startLabel optional multiplicity shown at the first point
 * @param endLabel optional multiplicity shown at the last point
 * @param sourceId id of the box the path starts at
 * @param targetId id of the box the path ends at
 */
public record EdgePath(
    String id,
    Rect bounds,
    List<Point> points,
    String label,
    boolean arrowStart,
    boolean arrowEnd,
    boolean dashed,
    RelationshipType kind,
    String startLabel,
    String endLabel,
    String sourceId,
    String targetId
) implements LayoutElement {

    /**
     * Compact constructor with validation.
     */
    public EdgePath {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        points = List.copyOf(Objects.requireNonNull(points, "points must not be null"));
        if (points.size() < 2) {
            throw new IllegalArgumentException("an edge needs at least 2 points, got " + points.size());
        }
    }

    public Point start() {
        return points.get(0);
    }

    public Point end() {
        return points.get(points.size() - 1);
    }
}
