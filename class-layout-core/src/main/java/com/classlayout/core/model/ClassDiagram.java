package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Class diagram as produced by the diagram parser.
 *
 * <p>This is the input of the layout pipeline. Classifiers are referenced by name; a
 * relationship may name a classifier that is never declared.
 *
 * @param title optional diagram title
 * @param classifiers top-level classifiers in declaration order
 * @param relationships relationships in declaration order
 * @param packages top-level packages in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassDiagram(
    String title,
    List<Classifier> classifiers,
    List<Relationship> relationships,
    List<UmlPackage> packages
) {
    /**
     * Compact constructor normalising absent lists.
     */
    public ClassDiagram {
        classifiers = classifiers == null ? List.of() : List.copyOf(classifiers);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    public static ClassDiagram empty() {
        return new ClassDiagram(null, List.of(), List.of(), List.of());
    }

    public static ClassDiagram of(List<Classifier> classifiers, List<Relationship> relationships) {
        return new ClassDiagram(null, classifiers, relationships, List.of());
    }

    /**
     * Returns whether the diagram declares anything to lay out.
     *
     * @return true if there is at least one classifier or package
     */
    public boolean hasContent() {
        return !classifiers.isEmpty() || !packages.isEmpty();
    }
}
