package com.classlayout.core.config;

/**
 * Numeric settings for sizing class boxes and spacing the hierarchical layout.
 *
 * <p>All values are in diagram units (pixels for the SVG renderer). Node sizing reads
 * {@code charWidth}, {@code lineHeight}, {@code classHeaderHeight}, {@code classPadding}
 * and the two minimums; coordinate assignment reads {@code margin} and the two spacings.
 *
 * @param margin distance from the diagram origin to the first layer and first node
 * @param minClassWidth minimum box width
 * @param minClassHeight minimum box height, also the height of every layer band
 * @param classPadding padding on each side of box text
 * @param charWidth estimated width of one character
 * @param lineHeight height of one member line
 * @param classHeaderHeight height of the name compartment
 * @param layerVerticalSpacing gap between layer bands
 * @param nodeHorizontalSpacing gap between neighbouring boxes in a layer
 */
public record ClassLayoutConfig(
    double margin,
    double minClassWidth,
    double minClassHeight,
    double classPadding,
    double charWidth,
    double lineHeight,
    double classHeaderHeight,
    double layerVerticalSpacing,
    double nodeHorizontalSpacing
) {
    public static final double DEFAULT_MARGIN = 20.0;
    public static final double DEFAULT_MIN_CLASS_WIDTH = 120.0;
    public static final double DEFAULT_MIN_CLASS_HEIGHT = 60.0;
    public static final double DEFAULT_CLASS_PADDING = 10.0;
    public static final double DEFAULT_CHAR_WIDTH = 8.0;
    public static final double DEFAULT_LINE_HEIGHT = 20.0;
    public static final double DEFAULT_CLASS_HEADER_HEIGHT = 30.0;
    public static final double DEFAULT_LAYER_VERTICAL_SPACING = 80.0;
    public static final double DEFAULT_NODE_HORIZONTAL_SPACING = 50.0;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if any value is negative, NaN or infinite
     */
    public ClassLayoutConfig {
        requireNonNegative("margin", margin);
        requireNonNegative("minClassWidth", minClassWidth);
        requireNonNegative("minClassHeight", minClassHeight);
        requireNonNegative("classPadding", classPadding);
        requireNonNegative("charWidth", charWidth);
        requireNonNegative("lineHeight", lineHeight);
        requireNonNegative("classHeaderHeight", classHeaderHeight);
        requireNonNegative("layerVerticalSpacing", layerVerticalSpacing);
        requireNonNegative("nodeHorizontalSpacing", nodeHorizontalSpacing);
    }

    /**
     * Creates the default configuration.
     *
     * @return default layout config
     */
    public static ClassLayoutConfig defaults() {
        return new ClassLayoutConfig(
            DEFAULT_MARGIN,
            DEFAULT_MIN_CLASS_WIDTH,
            DEFAULT_MIN_CLASS_HEIGHT,
            DEFAULT_CLASS_PADDING,
            DEFAULT_CHAR_WIDTH,
            DEFAULT_LINE_HEIGHT,
            DEFAULT_CLASS_HEADER_HEIGHT,
            DEFAULT_LAYER_VERTICAL_SPACING,
            DEFAULT_NODE_HORIZONTAL_SPACING
        );
    }

    /**
     * Returns a copy with different node spacing.
     *
     * @param horizontal gap between boxes of one layer
     * @param vertical gap between layers
     * @return new config
     */
    public ClassLayoutConfig withNodeSpacing(double horizontal, double vertical) {
        return new ClassLayoutConfig(margin, minClassWidth, minClassHeight, classPadding, charWidth,
            lineHeight, classHeaderHeight, vertical, horizontal);
    }

    /**
     * Returns a copy with a different margin.
     *
     * @param newMargin diagram margin
     * @return new config
     */
    public ClassLayoutConfig withMargin(double newMargin) {
        return new ClassLayoutConfig(newMargin, minClassWidth, minClassHeight, classPadding, charWidth,
            lineHeight, classHeaderHeight, layerVerticalSpacing, nodeHorizontalSpacing);
    }

    /**
     * Height of one layer band: spacing plus the minimum box height.
     *
     * @return vertical distance between the tops of consecutive layers
     */
    public double layerPitch() {
        return layerVerticalSpacing + minClassHeight;
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a finite non-negative number, got " + value);
        }
    }
}
