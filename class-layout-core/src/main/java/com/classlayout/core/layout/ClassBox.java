package com.classlayout.core.layout;

import java.util.List;
import java.util.Objects;

/**
 * Box for one classifier: header plus field and method compartments.
 *
 * @param id element id (the classifier name)
 * @param bounds box rectangle
 * @param kind box style
 * @param name display name
 * @param stereotype stereotype text without guillemets, may be null
 * @param fields field lines in declaration order
 * @param methods method lines in declaration order
 */
public record ClassBox(
    String id,
    Rect bounds,
    ClassifierKind kind,
    String name,
    String stereotype,
    List<ClassMember> fields,
    List<ClassMember> methods
) implements LayoutElement {

    /**
     * Compact constructor with validation.
     */
    public ClassBox {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = ClassifierKind.CLASS;
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }
}
