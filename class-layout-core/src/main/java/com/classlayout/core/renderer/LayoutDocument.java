package com.classlayout.core.renderer;

import com.classlayout.core.engine.LayoutStatistics;
import com.classlayout.core.layout.LayoutResult;

import java.util.Objects;

/**
 * A laid-out diagram ready to be rendered.
 *
 * @param name base name for outputs, usually the input file name without extension
 * @param result layout result
 * @param statistics layout diagnostics
 */
public record LayoutDocument(
    String name,
    LayoutResult result,
    LayoutStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(result, "result must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (statistics == null) {
            statistics = LayoutStatistics.empty();
        }
    }
}
