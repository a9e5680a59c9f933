package com.classlayout.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramFilesTest {

    @Test
    void documentName_stripsEverythingAfterFirstDot() {
        assertThat(DiagramFiles.documentName(Path.of("dir", "animals.classdiagram.json"))).isEqualTo("animals");
        assertThat(DiagramFiles.documentName(Path.of("animals"))).isEqualTo("animals");
        assertThat(DiagramFiles.documentName(Path.of(".hidden.json"))).isEqualTo(".hidden");
    }
}
