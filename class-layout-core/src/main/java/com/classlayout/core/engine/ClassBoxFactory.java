package com.classlayout.core.engine;

import com.classlayout.core.graph.Node;
import com.classlayout.core.layout.ClassBox;
import com.classlayout.core.layout.ClassMember;
import com.classlayout.core.layout.ClassifierKind;
import com.classlayout.core.layout.Rect;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.ClassifierType;
import com.classlayout.core.model.Member;

import java.util.List;
import java.util.Optional;

/**
 * Turns positioned nodes into {@link ClassBox} elements.
 */
final class ClassBoxFactory {

    private final ClassifierIndex index;

    ClassBoxFactory(ClassifierIndex index) {
        this.index = index;
    }

    ClassBox create(Node node) {
        Rect bounds = new Rect(node.getX(), node.getY(), node.getWidth(), node.getHeight());
        Optional<Classifier> classifier = index.find(node.getId());
        if (classifier.isEmpty()) {
            return new ClassBox(node.getId(), bounds, ClassifierKind.CLASS, node.getId(), null, List.of(), List.of());
        }

        Classifier c = classifier.get();
        return new ClassBox(
            node.getId(),
            bounds,
            kindOf(c.type()),
            node.getId(),
            stereotypeOf(c),
            c.fields().stream().map(ClassBoxFactory::fieldLine).toList(),
            c.methods().stream().map(ClassBoxFactory::methodLine).toList()
        );
    }

    static ClassifierKind kindOf(ClassifierType type) {
        return switch (type) {
            case INTERFACE -> ClassifierKind.INTERFACE;
            case ABSTRACT_CLASS -> ClassifierKind.ABSTRACT_CLASS;
            case ENUM -> ClassifierKind.ENUM;
            case ANNOTATION -> ClassifierKind.ANNOTATION;
            case ENTITY -> ClassifierKind.ENTITY;
            case CLASS, CIRCLE, DIAMOND -> ClassifierKind.CLASS;
        };
    }

    /**
     * Explicit stereotype if present, otherwise the one implied by the classifier type.
     */
    static String stereotypeOf(Classifier classifier) {
        if (classifier.stereotype() != null && !classifier.stereotype().isBlank()) {
            return classifier.stereotype();
        }
        return switch (classifier.type()) {
            case INTERFACE -> "interface";
            case ABSTRACT_CLASS -> "abstract";
            case ENUM -> "enum";
            case ANNOTATION -> "annotation";
            case ENTITY -> "entity";
            case CLASS, CIRCLE, DIAMOND -> null;
        };
    }

    static ClassMember fieldLine(Member field) {
        String text = field.type() == null || field.type().isBlank()
            ? field.name()
            : field.name() + ": " + field.type();
        return new ClassMember(field.visibility(), text, field.staticMember(), false);
    }

    static ClassMember methodLine(Member method) {
        return new ClassMember(method.visibility(), method.name() + "()", method.staticMember(), method.abstractMember());
    }
}
