package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Directed relationship between two classifiers, referenced by name.
 *
 * <p>For {@link RelationshipType#INHERITANCE} and {@link RelationshipType#REALIZATION}
 * {@code from} is the child and {@code to} the parent. For composition and aggregation
 * {@code from} is the whole.
 *
 * @param from source classifier name
 * @param to target classifier name
 * @param type relationship type
 * @param label optional label
 * @param fromCardinality optional multiplicity at the source end
 * @param toCardinality optional multiplicity at the target end
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Relationship(
    String from,
    String to,
    RelationshipType type,
    String label,
    String fromCardinality,
    String toCardinality
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Relationship of(String from, String to, RelationshipType type) {
        return new Relationship(from, to, type, null, null, null);
    }

    public static Relationship inheritance(String child, String parent) {
        return of(child, parent, RelationshipType.INHERITANCE);
    }

    public static Relationship realization(String implementor, String contract) {
        return of(implementor, contract, RelationshipType.REALIZATION);
    }

    public static Relationship composition(String whole, String part) {
        return of(whole, part, RelationshipType.COMPOSITION);
    }

    public static Relationship aggregation(String whole, String part) {
        return of(whole, part, RelationshipType.AGGREGATION);
    }

    public static Relationship association(String from, String to) {
        return of(from, to, RelationshipType.ASSOCIATION);
    }

    public static Relationship dependency(String from, String to) {
        return of(from, to, RelationshipType.DEPENDENCY);
    }

    public static Relationship link(String from, String to) {
        return of(from, to, RelationshipType.LINK);
    }

    public Relationship withLabel(String newLabel) {
        return new Relationship(from, to, type, newLabel, fromCardinality, toCardinality);
    }

    public Relationship withCardinality(String newFromCardinality, String newToCardinality) {
        return new Relationship(from, to, type, label, newFromCardinality, newToCardinality);
    }
}
