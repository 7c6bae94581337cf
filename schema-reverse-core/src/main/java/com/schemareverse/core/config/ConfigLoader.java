package com.schemareverse.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading reverse-engineering configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code schema-reverse.yaml} into {@link ReverseConfig} records.
 * If the config file is missing or invalid, returns {@link ReverseConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReverseConfig config = ConfigLoader.load(Paths.get("schema-reverse.yaml"));
 * double threshold = config.confidence().minimum();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "schema-reverse.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be read or can't be parsed, logs a warning and
     * returns {@link ReverseConfig#defaults()}.
     *
     * @param configPath path to {@code schema-reverse.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ReverseConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ReverseConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ReverseConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ReverseConfig config = YAML_MAPPER.readValue(configPath.toFile(), ReverseConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ReverseConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ReverseConfig.defaults();
        }
    }
}
