package com.classlayout.core.layout;

/**
 * Point in diagram coordinates (y grows downwards).
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Point(double x, double y) {
}
