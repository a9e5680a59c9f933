package com.classlayout.core.engine;

import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.UmlPackage;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name to classifier lookup for one diagram.
 *
 * <p>Visits classifiers in the same order the graph builder creates nodes (top level, then
 * packages depth-first), so the first declaration of a repeated name wins in both places.
 */
final class ClassifierIndex {

    private final Map<String, Classifier> byName = new HashMap<>();

    ClassifierIndex(ClassDiagram diagram) {
        diagram.classifiers().forEach(c -> byName.putIfAbsent(c.name(), c));
        indexPackages(diagram.packages());
    }

    Optional<Classifier> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    int size() {
        return byName.size();
    }

    private void indexPackages(List<UmlPackage> packages) {
        for (UmlPackage pkg : packages) {
            pkg.classifiers().forEach(c -> byName.putIfAbsent(c.name(), c));
            indexPackages(pkg.packages());
        }
    }
}
