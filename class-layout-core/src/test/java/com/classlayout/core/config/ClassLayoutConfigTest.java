package com.classlayout.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ClassLayoutConfig}.
 */
class ClassLayoutConfigTest {

    @Test
    void defaults_matchDocumentedValues() {
        ClassLayoutConfig config = ClassLayoutConfig.defaults();

        assertThat(config.margin()).isEqualTo(20.0);
        assertThat(config.minClassWidth()).isEqualTo(120.0);
        assertThat(config.minClassHeight()).isEqualTo(60.0);
        assertThat(config.classPadding()).isEqualTo(10.0);
        assertThat(config.charWidth()).isEqualTo(8.0);
        assertThat(config.lineHeight()).isEqualTo(20.0);
        assertThat(config.classHeaderHeight()).isEqualTo(30.0);
        assertThat(config.layerVerticalSpacing()).isEqualTo(80.0);
        assertThat(config.nodeHorizontalSpacing()).isEqualTo(50.0);
    }

    @Test
    void layerPitch_isVerticalSpacingPlusMinHeight() {
        assertThat(ClassLayoutConfig.defaults().layerPitch()).isEqualTo(140.0);
    }

    @Test
    void withNodeSpacing_replacesOnlySpacing() {
        ClassLayoutConfig config = ClassLayoutConfig.defaults().withNodeSpacing(30, 40);

        assertThat(config.nodeHorizontalSpacing()).isEqualTo(30.0);
        assertThat(config.layerVerticalSpacing()).isEqualTo(40.0);
        assertThat(config.margin()).isEqualTo(20.0);
    }

    @Test
    void constructor_negativeValue_throwsException() {
        assertThatThrownBy(() -> ClassLayoutConfig.defaults().withMargin(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("margin");
    }

    @Test
    void constructor_nonFiniteValue_throwsException() {
        assertThatThrownBy(() -> ClassLayoutConfig.defaults().withNodeSpacing(Double.NaN, 80))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClassLayoutConfig.defaults().withNodeSpacing(50, Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
