package com.classlayout.core.io;

import com.classlayout.core.model.ClassDiagram;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads class diagram models written by the diagram parser.
 *
 * <p>Enum values are matched case-insensitively and unknown properties are ignored, so
 * parser output carrying extra attributes still loads.
 */
public final class ClassDiagramJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ClassDiagramJson() {
        // Utility class
    }

    public static ClassDiagram read(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path is null");
        }
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ClassDiagram.class);
        }
    }

    /**
     * Parses a class diagram from a JSON string.
     *
     * @param json JSON text
     * @return parsed diagram
     * @throws IOException if the text is not a valid diagram
     */
    public static ClassDiagram readFromString(String json) throws IOException {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json is blank");
        }
        return MAPPER.readValue(json, ClassDiagram.class);
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
