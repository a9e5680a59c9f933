package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Field or method of a classifier.
 *
 * @param name member name
 * @param type field type or method return type, may be null
 * @param visibility member visibility
 * @param staticMember whether the member is static
 * @param abstractMember whether the member is abstract (methods only)
 * @param parameters method parameters, empty for fields
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Member(
    String name,
    String type,
    Visibility visibility,
    boolean staticMember,
    boolean abstractMember,
    List<Parameter> parameters
) {
    /**
     * Compact constructor with validation.
     */
    public Member {
        Objects.requireNonNull(name, "name must not be null");
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Creates a private field.
     *
     * @param name field name
     * @param type field type
     * @return field member
     */
    public static Member field(String name, String type) {
        return new Member(name, type, Visibility.PRIVATE, false, false, List.of());
    }

    /**
     * Creates a public method without parameters.
     *
     * @param name method name
     * @return method member
     */
    public static Member method(String name) {
        return new Member(name, null, Visibility.PUBLIC, false, false, List.of());
    }

    public Member withVisibility(Visibility newVisibility) {
        return new Member(name, type, newVisibility, staticMember, abstractMember, parameters);
    }

    public Member asStatic() {
        return new Member(name, type, visibility, true, abstractMember, parameters);
    }

    public Member asAbstract() {
        return new Member(name, type, visibility, staticMember, true, parameters);
    }

    public Member withParameters(List<Parameter> newParameters) {
        return new Member(name, type, visibility, staticMember, abstractMember, newParameters);
    }
}
