package com.classlayout.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading ClassLayout configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code classlayout.yaml} into {@link LayoutProjectConfig}.
 * If the file is missing, unreadable or invalid (including out-of-range layout values),
 * returns {@link LayoutProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LayoutProjectConfig config = ConfigLoader.load(Path.of("classlayout.yaml"));
 * ClassLayoutEngine engine = new ClassLayoutEngine(config.toLayoutConfig());
 * }</pre>
 */
public final class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "classlayout.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code classlayout.yaml}
     * @return loaded configuration, or defaults if unavailable
     */
    public static LayoutProjectConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using default layout settings.", configPath);
            return LayoutProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return LayoutProjectConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            LayoutProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), LayoutProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return LayoutProjectConfig.defaults();
            }
            // Surface invalid numeric values now rather than at layout time.
            config.toLayoutConfig();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return LayoutProjectConfig.defaults();
        }
    }
}
