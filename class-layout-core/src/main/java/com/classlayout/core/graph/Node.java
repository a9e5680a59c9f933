package com.classlayout.core.graph;

import com.classlayout.core.layout.Size;

import java.util.Objects;

/**
 * Graph node for one classifier, or a phantom placeholder for an undeclared name.
 *
 * <p>Identity ({@code id}, {@code index}, {@code size}) is fixed at construction. Layer,
 * position and coordinates are written by the layout phases in order.
 */
public final class Node {

    private final String id;
    private final int index;
    private final Size size;
    private final boolean phantom;

    private int layer;
    private int position;
    private double x;
    private double y;

    Node(String id, int index, Size size, boolean phantom) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.index = index;
        this.size = Objects.requireNonNull(size, "size must not be null");
        this.phantom = phantom;
        this.position = index;
    }

    /**
     * Returns the node id, which is also the classifier name used for lookups.
     *
     * @return node id
     */
    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public Size getSize() {
        return size;
    }

    public double getWidth() {
        return size.width();
    }

    public double getHeight() {
        return size.height();
    }

    /**
     * Returns whether this node stands in for a name only seen in relationships.
     *
     * @return true for phantom nodes
     */
    public boolean isPhantom() {
        return phantom;
    }

    public int getLayer() {
        return layer;
    }

    public void setLayer(int layer) {
        if (layer < 0) {
            throw new IllegalArgumentException("layer must be >= 0, got " + layer);
        }
        this.layer = layer;
    }

    /**
     * Returns the order of this node within its layer.
     *
     * @return intra-layer rank, initially the node index
     */
    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public void setY(double y) {
        this.y = y;
    }

    @Override
    public String toString() {
        return "Node[" + index + ":" + id + " layer=" + layer + " pos=" + position + "]";
    }
}
