package com.classlayout.core.io;

import com.classlayout.core.layout.LayoutResult;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization of layout results.
 *
 * <p>Writing is deterministic: elements keep their layout order, map keys are sorted and
 * the output always ends with a newline, so writing the same result twice yields identical
 * text.
 */
public final class LayoutJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private LayoutJson() {
        // Utility class
    }

    public static String toJsonString(LayoutResult result) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("result is null");
        }
        return MAPPER.writer(PRETTY).writeValueAsString(result) + "\n";
    }

    public static void write(LayoutResult result, Path path) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("result is null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path is null");
        }
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, result);
            out.write('\n');
        }
    }

    public static LayoutResult read(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path is null");
        }
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, LayoutResult.class);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Leave the caller's stream open so the trailing newline can be appended.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
