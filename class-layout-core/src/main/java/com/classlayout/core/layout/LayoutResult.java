package com.classlayout.core.layout;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of a layout run: every positioned element plus the overall diagram bounds.
 *
 * @param elements boxes first (node order), then edges (relationship order)
 * @param bounds union of all element bounds, expanded by the configured margin
 */
public record LayoutResult(
    List<LayoutElement> elements,
    Rect bounds
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutResult {
        elements = elements == null ? List.of() : List.copyOf(elements);
        Objects.requireNonNull(bounds, "bounds must not be null");
    }

    /**
     * Result with no elements and degenerate bounds.
     *
     * @return empty result
     */
    public static LayoutResult empty() {
        return new LayoutResult(List.of(), Rect.empty());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public List<ClassBox> boxes() {
        return elements.stream()
            .filter(ClassBox.class::isInstance)
            .map(ClassBox.class::cast)
            .toList();
    }

    public List<EdgePath> edges() {
        return elements.stream()
            .filter(EdgePath.class::isInstance)
            .map(EdgePath.class::cast)
            .toList();
    }

    /**
     * Finds the box laid out for a classifier.
     *
     * @param name classifier name
     * @return the box, or empty if no node has that name
     */
    public Optional<ClassBox> findBox(String name) {
        return boxes().stream()
            .filter(box -> box.name().equals(name))
            .findFirst();
    }
}
