package com.classlayout.cli;

import com.classlayout.ClassLayoutCLI;
import com.classlayout.core.engine.ClassLayoutEngine;
import com.classlayout.core.engine.LayoutStatistics;
import com.classlayout.core.io.ClassDiagramJson;
import com.classlayout.core.model.ClassDiagram;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to report how a class diagram is normalised before layout.
 *
 * <p>Undeclared relationship endpoints, duplicate declarations and cycle-breaking edge
 * reversals are listed but never fail the command.
 */
@Command(
    name = "validate",
    description = "Report undeclared, duplicate and cyclic classifiers in a class diagram",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private ClassLayoutCLI parent;

    @Parameters(index = "0", description = "Class diagram JSON file")
    private Path diagramFile;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        ClassDiagram diagram;
        try {
            log.info("Validating diagram: {}", diagramFile);
            diagram = ClassDiagramJson.read(diagramFile);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read diagram", e);
            System.err.println("✗ Cannot read diagram: " + e.getMessage());
            return 1;
        }

        LayoutStatistics stats = new ClassLayoutEngine().analyze(diagram);

        System.out.println("Classifiers: " + (stats.nodeCount() - stats.phantomCount()));
        System.out.println("Relationships: " + stats.edgeCount());
        System.out.println("Layers: " + stats.layerCount());
        System.out.println("Reversed edges: " + stats.reversedEdgeCount());
        System.out.println("Self-loops: " + stats.selfLoopCount());

        if (!stats.phantomNames().isEmpty()) {
            System.out.println("⚠ Undeclared classifiers: " + String.join(", ", stats.phantomNames()));
        }
        if (!stats.duplicateNames().isEmpty()) {
            System.out.println("⚠ Duplicate declarations: " + String.join(", ", stats.duplicateNames()));
        }
        if (stats.isClean()) {
            System.out.println("✓ Diagram is clean");
        }
        return 0;
    }
}
