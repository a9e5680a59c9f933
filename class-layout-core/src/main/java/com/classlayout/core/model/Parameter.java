package com.classlayout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Method parameter.
 *
 * @param name parameter name
 * @param type parameter type, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Parameter(
    String name,
    String type
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
    }
}
