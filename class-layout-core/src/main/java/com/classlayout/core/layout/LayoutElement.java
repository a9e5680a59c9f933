package com.classlayout.core.layout;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Positioned element handed to a renderer.
 *
 * <p>Elements are renderer-agnostic: they carry geometry and display text only.
 *
 * @see ClassBox
 * @see EdgePath
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClassBox.class, name = "class-box"),
    @JsonSubTypes.Type(value = EdgePath.class, name = "edge")
})
public interface LayoutElement {

    /**
     * Returns the element identifier, unique within one layout result.
     *
     * @return element id
     */
    String id();

    /**
     * Returns the bounding box of the element.
     *
     * @return bounds in diagram coordinates
     */
    Rect bounds();
}
