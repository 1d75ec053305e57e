package com.solv.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading solv configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code solv.yaml} into {@link SolvConfig} records.
 * If the config file is missing or invalid, returns {@link SolvConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SolvConfig config = ConfigLoader.load(Paths.get("solv.yaml"));
 * String extension = config.scan().extension();
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "solv.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>A missing file silently yields defaults. An unreadable or malformed file is logged
     * and also yields defaults.
     *
     * @param configPath path to {@code solv.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SolvConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return SolvConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SolvConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SolvConfig config = YAML_MAPPER.readValue(configPath.toFile(), SolvConfig.class);
            if (config == null) {
                log.debug("Configuration file is empty: {}. Using defaults.", configPath);
                return SolvConfig.defaults();
            }
            log.debug("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SolvConfig.defaults();
        }
    }
}
