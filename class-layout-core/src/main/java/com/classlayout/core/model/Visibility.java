package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * UML member visibility.
 */
public enum Visibility {
    /** {@code +} public */
    PUBLIC('+'),

    /** {@code -} private */
    PRIVATE('-'),

    /** {@code #} protected */
    PROTECTED('#'),

    /** {@code ~} package private */
    PACKAGE('~');

    private final char symbol;

    Visibility(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the UML symbol for this visibility.
     *
     * @return one of {@code + - # ~}
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Resolves a visibility from its UML symbol.
     *
     * @param symbol UML symbol
     * @return matching visibility, or {@code null} if the symbol is unknown
     */
    public static Visibility fromSymbol(char symbol) {
        for (Visibility visibility : values()) {
            if (visibility.symbol == symbol) {
                return visibility;
            }
        }
        return null;
    }

    /**
     * JSON factory accepting either the UML symbol or the constant name.
     *
     * @param value symbol ("+") or name ("public")
     * @return matching visibility
     * @throws IllegalArgumentException if the value is not recognised
     */
    @JsonCreator
    public static Visibility fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PUBLIC;
        }
        String trimmed = value.trim();
        if (trimmed.length() == 1) {
            Visibility bySymbol = fromSymbol(trimmed.charAt(0));
            if (bySymbol != null) {
                return bySymbol;
            }
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown visibility: " + value, e);
        }
    }
}
