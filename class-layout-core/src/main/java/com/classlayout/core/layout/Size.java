package com.classlayout.core.layout;

/**
 * Width and height of a box.
 *
 * @param width box width
 * @param height box height
 */
public record Size(double width, double height) {
}
