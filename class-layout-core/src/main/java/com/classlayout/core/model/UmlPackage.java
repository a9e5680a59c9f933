package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Package grouping classifiers and nested packages.
 *
 * @param name package name
 * @param stereotype optional stereotype
 * @param classifiers classifiers declared directly in this package
 * @param packages nested packages
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UmlPackage(
    String name,
    String stereotype,
    List<Classifier> classifiers,
    List<UmlPackage> packages
) {
    /**
     * Compact constructor with validation.
     */
    public UmlPackage {
        Objects.requireNonNull(name, "name must not be null");
        classifiers = classifiers == null ? List.of() : List.copyOf(classifiers);
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    public static UmlPackage of(String name, List<Classifier> classifiers, List<UmlPackage> packages) {
        return new UmlPackage(name, null, classifiers, packages);
    }
}
