package com.todotracker.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Utility for loading todo-tracker configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code .todo-tracker.yaml} into {@link TrackerConfig} records.
 * If the config file is missing or invalid, returns {@link TrackerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TrackerConfig config = ConfigLoader.find(projectRoot)
 *     .map(ConfigLoader::load)
 *     .orElseGet(TrackerConfig::defaults);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link TrackerConfig#defaults()}.
     *
     * @param configPath path to {@code .todo-tracker.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static TrackerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return TrackerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TrackerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TrackerConfig config = YAML_MAPPER.readValue(configPath.toFile(), TrackerConfig.class);
            if (config == null) {
                // empty document
                return TrackerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return TrackerConfig.defaults();
        }
    }

    /**
     * Looks for {@code .todo-tracker.yaml} in a directory and its ancestors.
     *
     * @param start directory to start from
     * @return nearest configuration file, or empty if there is none
     */
    public static Optional<Path> find(Path start) {
        Path dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            Path candidate = dir.resolve(TrackerConfig.FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    /**
     * Loads the nearest configuration for a directory, or defaults if none is found.
     *
     * <p>Convenience method that never throws - always returns a valid config.
     *
     * @param start directory to start from
     * @return loaded configuration or defaults
     */
    public static TrackerConfig loadNearest(Path start) {
        return find(start).map(ConfigLoader::load).orElseGet(() -> {
            log.debug("No {} found from {}, using defaults", TrackerConfig.FILE_NAME, start);
            return TrackerConfig.defaults();
        });
    }
}
