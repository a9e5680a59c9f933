package com.classlayout.core.io;

import com.classlayout.core.model.ClassDiagram;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.ClassifierType;
import com.classlayout.core.model.Relationship;
import com.classlayout.core.model.RelationshipType;
import com.classlayout.core.model.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ClassDiagramJson}.
 */
class ClassDiagramJsonTest {

    @TempDir
    Path tempDir;

    private static Path fixture(String resource) throws URISyntaxException {
        return Path.of(ClassDiagramJsonTest.class.getClassLoader().getResource(resource).toURI());
    }

    @Test
    void read_fixture_parsesAllSections() throws Exception {
        ClassDiagram diagram = ClassDiagramJson.read(fixture("diagrams/animals.json"));

        assertThat(diagram.title()).isEqualTo("Animals");
        assertThat(diagram.classifiers()).extracting(Classifier::name).containsExactly("Animal", "Dog", "Cat");
        assertThat(diagram.relationships()).hasSize(3);
        assertThat(diagram.packages()).hasSize(1);
        assertThat(diagram.packages().get(0).classifiers().get(0).type()).isEqualTo(ClassifierType.ENTITY);
    }

    @Test
    void read_fixture_resolvesEnumsAndMembers() throws Exception {
        ClassDiagram diagram = ClassDiagramJson.read(fixture("diagrams/animals.json"));

        Classifier animal = diagram.classifiers().get(0);
        assertThat(animal.type()).isEqualTo(ClassifierType.ABSTRACT_CLASS);
        assertThat(animal.fields().get(0).visibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(animal.methods().get(0).abstractMember()).isTrue();
        assertThat(diagram.classifiers().get(2).stereotype()).isEqualTo("pet");

        Relationship dependency = diagram.relationships().get(2);
        assertThat(dependency.type()).isEqualTo(RelationshipType.DEPENDENCY);
        assertThat(dependency.toCardinality()).isEqualTo("*");
    }

    @Test
    void readFromString_missingLists_defaultToEmpty() throws IOException {
        ClassDiagram diagram = ClassDiagramJson.readFromString("{\"classifiers\":[{\"name\":\"Solo\"}]}");

        assertThat(diagram.relationships()).isEmpty();
        assertThat(diagram.packages()).isEmpty();
        assertThat(diagram.classifiers().get(0).type()).isEqualTo(ClassifierType.CLASS);
    }

    @Test
    void readFromString_missingRequiredName_throwsIOException() {
        assertThatThrownBy(() -> ClassDiagramJson.readFromString("{\"classifiers\":[{\"type\":\"class\"}]}"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void readFromString_blank_throwsException() {
        assertThatThrownBy(() -> ClassDiagramJson.readFromString("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_missingFile_throwsIOException() {
        assertThatThrownBy(() -> ClassDiagramJson.read(tempDir.resolve("absent.json")))
            .isInstanceOf(IOException.class);
    }
}
