package com.classlayout.cli;

import java.nio.file.Path;

/**
 * Helpers for diagram input paths shared by the commands.
 */
final class DiagramFiles {

    private DiagramFiles() {
        // Utility class
    }

    /**
     * Derives the document name from a diagram file: the file name up to its first dot.
     *
     * @param diagramFile diagram input path
     * @return base name, e.g. {@code animals} for {@code animals.classdiagram.json}
     */
    static String documentName(Path diagramFile) {
        String fileName = diagramFile.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
