package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Class, interface, enum or other classifier declared in a class diagram.
 *
 * @param name classifier name, used as its identity within the diagram
 * @param type classifier kind
 * @param fields ordered fields
 * @param methods ordered methods
 * @param stereotype explicit stereotype text without guillemets, may be null
 * @param generics generic parameter text, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Classifier(
    String name,
    ClassifierType type,
    List<Member> fields,
    List<Member> methods,
    String stereotype,
    String generics
) {
    /**
     * Compact constructor with validation.
     */
    public Classifier {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = ClassifierType.CLASS;
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public static Classifier of(String name) {
        return new Classifier(name, ClassifierType.CLASS, List.of(), List.of(), null, null);
    }

    public static Classifier interfaceOf(String name) {
        return new Classifier(name, ClassifierType.INTERFACE, List.of(), List.of(), null, null);
    }

    public static Classifier abstractOf(String name) {
        return new Classifier(name, ClassifierType.ABSTRACT_CLASS, List.of(), List.of(), null, null);
    }

    public static Classifier enumOf(String name) {
        return new Classifier(name, ClassifierType.ENUM, List.of(), List.of(), null, null);
    }

    /**
     * Returns a copy with the given field appended.
     *
     * @param field field to add
     * @return new classifier
     */
    public Classifier withField(Member field) {
        List<Member> copy = new ArrayList<>(fields);
        copy.add(field);
        return new Classifier(name, type, copy, methods, stereotype, generics);
    }

    /**
     * Returns a copy with the given method appended.
     *
     * @param method method to add
     * @return new classifier
     */
    public Classifier withMethod(Member method) {
        List<Member> copy = new ArrayList<>(methods);
        copy.add(method);
        return new Classifier(name, type, fields, copy, stereotype, generics);
    }

    public Classifier withStereotype(String newStereotype) {
        return new Classifier(name, type, fields, methods, newStereotype, generics);
    }
}
