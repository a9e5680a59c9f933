package com.classlayout.core.renderer.impl;

import com.classlayout.core.engine.LayoutStatistics;
import com.classlayout.core.layout.ClassBox;
import com.classlayout.core.layout.LayoutResult;
import com.classlayout.core.layout.Rect;
import com.classlayout.core.renderer.LayoutDocument;
import com.classlayout.core.renderer.LayoutRenderer;
import com.classlayout.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Renderer that prints a layout summary to the console with optional ANSI colors.
 *
 * <p>Color support can be disabled via settings for CI environments or when redirecting
 * output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator drawn around the box table (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements LayoutRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(LayoutDocument document, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        PrintStream out = System.out;

        logger.info("Rendering layout '{}' to console (colors: {})", document.name(), useColors);

        LayoutResult result = document.result();
        printSummary(out, document, useColors);
        printStatistics(out, document.statistics(), useColors);

        out.println();
        printSeparator(out, separator, useColors);
        for (ClassBox box : result.boxes()) {
            printBox(out, box, useColors);
        }
        printSeparator(out, separator, useColors);
    }

    private void printSummary(PrintStream out, LayoutDocument document, boolean useColors) {
        String prefix = useColors ? ANSI_BOLD + ANSI_GREEN : "";
        String suffix = useColors ? ANSI_RESET : "";
        LayoutResult result = document.result();
        Rect bounds = result.bounds();

        out.println(prefix + "Layout " + document.name() + ": " + result.boxes().size() + " box(es), "
            + result.edges().size() + " edge(s)" + suffix);
        out.println("Bounds: " + format(bounds.width()) + " x " + format(bounds.height()));
    }

    private void printStatistics(PrintStream out, LayoutStatistics stats, boolean useColors) {
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(metaColor + "Layers: " + stats.layerCount()
            + ", reversed edges: " + stats.reversedEdgeCount()
            + ", self-loops: " + stats.selfLoopCount() + reset);
        if (!stats.phantomNames().isEmpty()) {
            out.println(metaColor + "Undeclared: " + String.join(", ", stats.phantomNames()) + reset);
        }
        if (!stats.duplicateNames().isEmpty()) {
            out.println(metaColor + "Duplicates: " + String.join(", ", stats.duplicateNames()) + reset);
        }
    }

    private void printBox(PrintStream out, ClassBox box, boolean useColors) {
        String nameColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        Rect b = box.bounds();
        String stereotype = box.stereotype() == null ? "" : " <<" + box.stereotype() + ">>";

        out.println(nameColor + box.name() + reset + stereotype
            + " @ (" + format(b.x()) + ", " + format(b.y()) + ") "
            + format(b.width()) + " x " + format(b.height()));
    }

    private void printSeparator(PrintStream out, String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        // Repeat separator to fill ~80 characters
        int repeatCount = Math.max(1, 80 / separator.length());
        out.println(color + separator.repeat(repeatCount) + reset);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
