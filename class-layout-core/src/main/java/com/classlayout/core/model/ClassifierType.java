package com.classlayout.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of classifiers a class diagram can declare.
 */
public enum ClassifierType {
    /** Plain class */
    CLASS,

    /** Interface */
    INTERFACE,

    /** Abstract class */
    ABSTRACT_CLASS,

    /** Enumeration */
    ENUM,

    /** Annotation type */
    ANNOTATION,

    /** Persistent entity */
    ENTITY,

    /** Circle shorthand (lollipop) */
    CIRCLE,

    /** Diamond shorthand (n-ary association) */
    DIAMOND;

    /**
     * Parses a classifier keyword as written in diagram source.
     *
     * <p>Accepts {@code class}, {@code interface}, {@code abstract},
     * {@code abstract class}, {@code enum}, {@code annotation}, {@code entity},
     * {@code circle} and {@code diamond}, case-insensitively.
     *
     * @param keyword keyword text
     * @return matching type, or empty if the keyword is unknown
     */
    public static Optional<ClassifierType> parse(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "class" -> Optional.of(CLASS);
            case "interface" -> Optional.of(INTERFACE);
            case "abstract", "abstract class" -> Optional.of(ABSTRACT_CLASS);
            case "enum" -> Optional.of(ENUM);
            case "annotation" -> Optional.of(ANNOTATION);
            case "entity" -> Optional.of(ENTITY);
            case "circle" -> Optional.of(CIRCLE);
            case "diamond" -> Optional.of(DIAMOND);
            default -> Optional.empty();
        };
    }
}
