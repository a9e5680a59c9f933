package com.classlayout.core.layout;

import java.util.Collection;

/**
 * Axis-aligned rectangle anchored at its top-left corner.
 *
 * @param x left edge
 * @param y top edge
 * @param width rectangle width
 * @param height rectangle height
 */
public record Rect(double x, double y, double width, double height) {

    private static final Rect EMPTY = new Rect(0, 0, 0, 0);

    /**
     * Returns the degenerate rectangle at the origin.
     *
     * @return zero-sized rectangle
     */
    public static Rect empty() {
        return EMPTY;
    }

    public static Rect of(Point topLeft, Size size) {
        return new Rect(topLeft.x(), topLeft.y(), size.width(), size.height());
    }

    /**
     * Smallest rectangle containing all given points.
     *
     * @param points points to enclose
     * @return bounding rectangle, or {@link #empty()} for no points
     */
    public static Rect fromPoints(Collection<Point> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Point p : points) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        return new Rect(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * Smallest rectangle containing all given rectangles.
     *
     * @param rects rectangles to enclose
     * @return union, or {@link #empty()} for no rectangles
     */
    public static Rect union(Collection<Rect> rects) {
        if (rects.isEmpty()) {
            return EMPTY;
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Rect r : rects) {
            minX = Math.min(minX, r.x());
            minY = Math.min(minY, r.y());
            maxX = Math.max(maxX, r.right());
            maxY = Math.max(maxY, r.bottom());
        }
        return new Rect(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * Grows the rectangle by {@code margin} on every side.
     *
     * @param margin amount to add on each side
     * @return expanded rectangle
     */
    public Rect expand(double margin) {
        return new Rect(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    public Point topCenter() {
        return new Point(x + width / 2, y);
    }

    public Point bottomCenter() {
        return new Point(x + width / 2, bottom());
    }

    public Point leftCenter() {
        return new Point(x, y + height / 2);
    }

    public Point rightCenter() {
        return new Point(right(), y + height / 2);
    }

    /**
     * Returns whether the horizontal extents of the two rectangles overlap.
     *
     * <p>Touching edges do not count as overlap.
     *
     * @param other rectangle to compare with
     * @return true if the x-ranges intersect
     */
    public boolean overlapsHorizontally(Rect other) {
        return x < other.right() && other.x < right();
    }
}
