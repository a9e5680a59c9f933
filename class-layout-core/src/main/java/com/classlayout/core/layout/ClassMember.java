package com.classlayout.core.layout;

import com.classlayout.core.model.Visibility;

import java.util.Objects;

/**
 * Display-ready member line of a class box.
 *
 * @param visibility visibility marker to draw before the text
 * @param text member text, e.g. {@code name: String} or {@code getName()}
 * @param staticMember render underlined
 * @param abstractMember render in italics
 */
public record ClassMember(
    Visibility visibility,
    String text,
    boolean staticMember,
    boolean abstractMember
) {
    /**
     * Compact constructor with validation.
     */
    public ClassMember {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns the line as drawn, visibility symbol included.
     *
     * @return e.g. {@code -id: Long}
     */
    public String displayText() {
        return visibility.symbol() + text;
    }
}
