package com.classlayout.core.engine;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.layout.Point;
import com.classlayout.core.layout.Rect;

import java.util.List;

/**
 * Computes orthogonal waypoints between two boxes.
 *
 * <p>The dominant axis of the centre-to-centre vector picks the sides: vertical
 * connections leave through the bottom (or top) centre, horizontal ones through the right
 * (or left) centre. Nearly aligned connection points give a straight segment, everything
 * else a single bend at mid height.
 */
final class EdgeRouter {

    private final double loopOffset;

    EdgeRouter(ClassLayoutConfig config) {
        this.loopOffset = config.nodeHorizontalSpacing() / 2;
    }

    List<Point> route(Rect source, Rect target) {
        Point sourceCenter = source.center();
        Point targetCenter = target.center();
        double dx = targetCenter.x() - sourceCenter.x();
        double dy = targetCenter.y() - sourceCenter.y();

        Point start;
        Point end;
        if (Math.abs(dy) > Math.abs(dx)) {
            if (dy > 0) {
                start = source.bottomCenter();
                end = target.topCenter();
            } else {
                start = source.topCenter();
                end = target.bottomCenter();
            }
        } else if (dx > 0) {
            start = source.rightCenter();
            end = target.leftCenter();
        } else {
            start = source.leftCenter();
            end = target.rightCenter();
        }
        return orthogonalPath(start, end);
    }

    static List<Point> orthogonalPath(Point start, Point end) {
        double dx = end.x() - start.x();
        double dy = end.y() - start.y();
        if (Math.abs(dx) < 1 || Math.abs(dy) < 1) {
            return List.of(start, end);
        }
        double midY = start.y() + dy / 2;
        return List.of(start, new Point(start.x(), midY), new Point(end.x(), midY), end);
    }

    /**
     * Loop leaving the right side at one third of the height and re-entering at two thirds.
     */
    List<Point> selfLoop(Rect box) {
        double right = box.right();
        double upper = box.y() + box.height() / 3;
        double lower = box.y() + 2 * box.height() / 3;
        return List.of(
            new Point(right, upper),
            new Point(right + loopOffset, upper),
            new Point(right + loopOffset, lower),
            new Point(right, lower)
        );
    }
}
