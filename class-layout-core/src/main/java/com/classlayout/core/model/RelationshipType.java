package com.classlayout.core.model;

import java.util.Optional;

/**
 * Types of relationships between classifiers.
 */
public enum RelationshipType {
    /** Generalization, child extends parent ({@code <|--}) */
    INHERITANCE,

    /** Interface implementation ({@code <|..}) */
    REALIZATION,

    /** Whole owns part, part lifecycle bound to whole ({@code *--}) */
    COMPOSITION,

    /** Whole references part ({@code o--}) */
    AGGREGATION,

    /** Directed association ({@code -->}) */
    ASSOCIATION,

    /** Usage dependency ({@code ..>}) */
    DEPENDENCY,

    /** Undirected link ({@code --}) */
    LINK;

    /**
     * Returns whether the semantic direction of this kind is child to parent.
     *
     * <p>Such relationships are laid out with the parent above the child.
     *
     * @return true for inheritance and realization
     */
    public boolean isHierarchical() {
        return this == INHERITANCE || this == REALIZATION;
    }

    /**
     * Maps an arrow token to a relationship type.
     *
     * @param arrow arrow token, e.g. {@code <|--} or {@code ..>}
     * @return matching type, or empty if the token is unknown
     */
    public static Optional<RelationshipType> fromArrow(String arrow) {
        if (arrow == null) {
            return Optional.empty();
        }
        return switch (arrow.trim()) {
            case "<|--", "--|>" -> Optional.of(INHERITANCE);
            case "<|..", "..|>" -> Optional.of(REALIZATION);
            case "*--", "--*" -> Optional.of(COMPOSITION);
            case "o--", "--o" -> Optional.of(AGGREGATION);
            case "<--", "-->" -> Optional.of(ASSOCIATION);
            case "--" -> Optional.of(LINK);
            case "<..", "..>", ".." -> Optional.of(DEPENDENCY);
            default -> Optional.empty();
        };
    }
}
