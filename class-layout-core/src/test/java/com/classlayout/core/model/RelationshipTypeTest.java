package com.classlayout.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RelationshipType} and {@link ClassifierType} parsing.
 */
class RelationshipTypeTest {

    @Test
    void isHierarchical_onlyForGeneralizationKinds() {
        assertThat(RelationshipType.INHERITANCE.isHierarchical()).isTrue();
        assertThat(RelationshipType.REALIZATION.isHierarchical()).isTrue();
        assertThat(RelationshipType.COMPOSITION.isHierarchical()).isFalse();
        assertThat(RelationshipType.AGGREGATION.isHierarchical()).isFalse();
        assertThat(RelationshipType.ASSOCIATION.isHierarchical()).isFalse();
        assertThat(RelationshipType.DEPENDENCY.isHierarchical()).isFalse();
        assertThat(RelationshipType.LINK.isHierarchical()).isFalse();
    }

    @Test
    void fromArrow_mapsPlantUmlTokens() {
        assertThat(RelationshipType.fromArrow("<|--")).contains(RelationshipType.INHERITANCE);
        assertThat(RelationshipType.fromArrow("..|>")).contains(RelationshipType.REALIZATION);
        assertThat(RelationshipType.fromArrow("*--")).contains(RelationshipType.COMPOSITION);
        assertThat(RelationshipType.fromArrow("o--")).contains(RelationshipType.AGGREGATION);
        assertThat(RelationshipType.fromArrow("-->")).contains(RelationshipType.ASSOCIATION);
        assertThat(RelationshipType.fromArrow("..>")).contains(RelationshipType.DEPENDENCY);
        assertThat(RelationshipType.fromArrow("--")).contains(RelationshipType.LINK);
    }

    @Test
    void fromArrow_unknownToken_returnsEmpty() {
        assertThat(RelationshipType.fromArrow("==>")).isEmpty();
        assertThat(RelationshipType.fromArrow(null)).isEmpty();
    }

    @Test
    void classifierTypeParse_acceptsKeywords() {
        assertThat(ClassifierType.parse("abstract class")).contains(ClassifierType.ABSTRACT_CLASS);
        assertThat(ClassifierType.parse("Interface")).contains(ClassifierType.INTERFACE);
        assertThat(ClassifierType.parse("diamond")).contains(ClassifierType.DIAMOND);
        assertThat(ClassifierType.parse("struct")).isEmpty();
    }
}
