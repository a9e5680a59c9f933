package com.classlayout.cli;

import com.classlayout.ClassLayoutCLI;
import com.classlayout.core.config.ConfigLoader;
import com.classlayout.core.config.LayoutProjectConfig;
import com.classlayout.core.engine.ClassLayoutEngine;
import com.classlayout.core.engine.LayoutStatistics;
import com.classlayout.core.io.ClassDiagramJson;
import com.classlayout.core.layout.LayoutResult;
import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.renderer.LayoutDocument;
import com.classlayout.core.renderer.LayoutRenderer;
import com.classlayout.core.renderer.RenderContext;
import com.classlayout.core.renderer.RendererRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to lay out a class diagram and render the result.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Read the diagram JSON produced by the parser</li>
 *   <li>Load {@code classlayout.yaml} (defaults when absent)</li>
 *   <li>Run the class layout engine</li>
 *   <li>Hand the document to each selected renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Lay out using classlayout.yaml next to the diagram
 * classlayout layout diagrams/animals.json
 *
 * # Override output directory and renderers
 * classlayout layout animals.json -o build/out -r filesystem,console
 * }</pre>
 */
@Command(
    name = "layout",
    description = "Lay out a class diagram and render the positioned elements",
    mixinStandardHelpOptions = true
)
public class LayoutCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LayoutCommand.class);

    @ParentCommand
    private ClassLayoutCLI parent;

    @Parameters(index = "0", description = "Class diagram JSON file")
    private Path diagramFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: classlayout.yaml next to the diagram)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-r", "--renderer"},
        split = ",",
        description = "Renderer ids to run (overrides config), e.g. filesystem,console"
    )
    private List<String> rendererIds;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        try {
            log.info("Laying out diagram: {}", diagramFile.toAbsolutePath());

            LayoutProjectConfig config = loadConfiguration();
            ClassDiagram diagram = ClassDiagramJson.read(diagramFile);

            ClassLayoutEngine engine = new ClassLayoutEngine(config.toLayoutConfig());
            LayoutResult result = engine.layout(diagram);
            LayoutStatistics statistics = engine.analyze(diagram);

            LayoutDocument document = new LayoutDocument(DiagramFiles.documentName(diagramFile), result, statistics);
            List<LayoutRenderer> renderers = RendererRegistry.load().resolve(selectedRenderers(config));
            RenderContext context = new RenderContext(
                getOutputDirectory(config),
                Map.of("console.colors", String.valueOf(config.output().consoleColors()))
            );

            for (LayoutRenderer renderer : renderers) {
                log.debug("Rendering with: {}", renderer.getId());
                renderer.render(document, context);
            }

            System.out.println("✓ Laid out " + result.boxes().size() + " classifiers and "
                + result.edges().size() + " relationships");
            return 0;

        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("Layout failed", e);
            System.err.println("✗ Layout failed: " + e.getMessage());
            return 1;
        }
    }

    private LayoutProjectConfig loadConfiguration() {
        Path path = configPath;
        if (path == null) {
            Path parentDir = diagramFile.toAbsolutePath().getParent();
            path = parentDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        }
        log.debug("Loading configuration from: {}", path);
        return ConfigLoader.load(path);
    }

    private List<String> selectedRenderers(LayoutProjectConfig config) {
        if (rendererIds != null && !rendererIds.isEmpty()) {
            return rendererIds;
        }
        return config.output().renderers();
    }

    private String getOutputDirectory(LayoutProjectConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().toString();
        }
        return config.output().directory();
    }
}
