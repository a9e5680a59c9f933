package com.classlayout.core.renderer;

import com.classlayout.core.engine.ClassLayoutEngine;
import com.classlayout.core.engine.LayoutStatistics;
import com.classlayout.core.layout.LayoutResult;
import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Base class for renderer functional tests.
 *
 * <p>Provides a temporary output directory, a default {@link RenderContext} and a small
 * laid-out hierarchy to render.
 */
public abstract class RendererTestBase {

    @TempDir
    protected Path tempDir;

    protected RenderContext context;

    @BeforeEach
    void setUpContext() {
        context = new RenderContext(tempDir.toString(), Map.of());
    }

    /**
     * Lays out Animal with the subclasses Dog and Cat.
     *
     * @param name document name
     * @return document with result and statistics of the same run
     */
    protected LayoutDocument animalsDocument(String name) {
        ClassDiagram diagram = ClassDiagram.of(
            List.of(Classifier.of("Animal"), Classifier.of("Dog"), Classifier.of("Cat")),
            List.of(Relationship.inheritance("Dog", "Animal"), Relationship.inheritance("Cat", "Animal")));
        ClassLayoutEngine engine = new ClassLayoutEngine();
        LayoutResult result = engine.layout(diagram);
        LayoutStatistics statistics = engine.analyze(diagram);
        return new LayoutDocument(name, result, statistics);
    }

    protected RenderContext createContext(String outputDirectory, Map<String, String> settings) {
        return new RenderContext(outputDirectory, settings);
    }
}
