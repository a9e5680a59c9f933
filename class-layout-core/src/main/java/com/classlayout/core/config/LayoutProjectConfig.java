package com.classlayout.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for ClassLayout runs.
 *
 * <p>Loaded from {@code classlayout.yaml}. Every key is optional; missing layout
 * settings fall back to {@link ClassLayoutConfig#defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * layout:
 *   margin: 30
 *   nodeHorizontalSpacing: 60
 *   layerVerticalSpacing: 100
 *
 * output:
 *   directory: "./build/layout"
 *   renderers:
 *     - filesystem
 *     - console
 *   consoleColors: false
 * }</pre>
 *
 * @param layout layout settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutProjectConfig(
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling absent sections.
     */
    public LayoutProjectConfig {
        if (layout == null) {
            layout = LayoutSettings.unset();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static LayoutProjectConfig defaults() {
        return new LayoutProjectConfig(LayoutSettings.unset(), OutputConfig.defaults());
    }

    /**
     * Resolves the effective layout configuration.
     *
     * @return layout config with defaults for unset keys
     */
    public ClassLayoutConfig toLayoutConfig() {
        return layout.applyTo(ClassLayoutConfig.defaults());
    }

    /**
     * Optional overrides for {@link ClassLayoutConfig}; null means "use the default".
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LayoutSettings(
        @JsonProperty("margin") Double margin,
        @JsonProperty("minClassWidth") Double minClassWidth,
        @JsonProperty("minClassHeight") Double minClassHeight,
        @JsonProperty("classPadding") Double classPadding,
        @JsonProperty("charWidth") Double charWidth,
        @JsonProperty("lineHeight") Double lineHeight,
        @JsonProperty("classHeaderHeight") Double classHeaderHeight,
        @JsonProperty("layerVerticalSpacing") Double layerVerticalSpacing,
        @JsonProperty("nodeHorizontalSpacing") Double nodeHorizontalSpacing
    ) {
        public static LayoutSettings unset() {
            return new LayoutSettings(null, null, null, null, null, null, null, null, null);
        }

        /**
         * Overlays the set values on a base configuration.
         *
         * @param base configuration supplying unset values
         * @return merged configuration
         * @throws IllegalArgumentException if a set value is invalid
         */
        public ClassLayoutConfig applyTo(ClassLayoutConfig base) {
            return new ClassLayoutConfig(
                orElse(margin, base.margin()),
                orElse(minClassWidth, base.minClassWidth()),
                orElse(minClassHeight, base.minClassHeight()),
                orElse(classPadding, base.classPadding()),
                orElse(charWidth, base.charWidth()),
                orElse(lineHeight, base.lineHeight()),
                orElse(classHeaderHeight, base.classHeaderHeight()),
                orElse(layerVerticalSpacing, base.layerVerticalSpacing()),
                orElse(nodeHorizontalSpacing, base.nodeHorizontalSpacing())
            );
        }

        private static double orElse(Double value, double fallback) {
            return value != null ? value : fallback;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory for written layouts
     * @param renderers renderer ids to run, in order
     * @param consoleColors whether the console renderer uses ANSI colours
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("renderers") List<String> renderers,
        @JsonProperty("consoleColors") Boolean consoleColors
    ) {
        public static final String DEFAULT_DIRECTORY = "./build/layout";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
            renderers = renderers == null || renderers.isEmpty() ? List.of("filesystem") : List.copyOf(renderers);
            if (consoleColors == null) {
                consoleColors = Boolean.TRUE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY, List.of("filesystem"), Boolean.TRUE);
        }
    }
}
