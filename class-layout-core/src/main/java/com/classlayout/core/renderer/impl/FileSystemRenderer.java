package com.classlayout.core.renderer.impl;

import com.classlayout.core.io.LayoutJson;
import com.classlayout.core.renderer.LayoutDocument;
import com.classlayout.core.renderer.LayoutRenderer;
import com.classlayout.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes the layout result as JSON to the filesystem.
 *
 * <p>Creates the output directory if needed and overwrites an existing file. The file is
 * named {@code <document name>.layout.json}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./build/layout", Map.of());
 * LayoutDocument document = new LayoutDocument("animals", result, statistics);
 *
 * new FileSystemRenderer().render(document, context);
 * // Creates: ./build/layout/animals.layout.json
 * }</pre>
 */
public class FileSystemRenderer implements LayoutRenderer {

    /** Suffix appended to the document name. */
    public static final String FILE_SUFFIX = ".layout.json";

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(LayoutDocument document, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Rendering layout '{}' to filesystem at: {}", document.name(), outputDir);

        try {
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        Path target = outputDir.resolve(document.name() + FILE_SUFFIX);
        try {
            LayoutJson.write(document.result(), target);
            logger.info("Wrote file: {} ({} elements)", target.getFileName(), document.result().elements().size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
