package com.uimigrator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading migration configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code ui-migrator.yaml} into {@link MigrationConfig} records.
 * If the config file is missing or invalid, returns {@link MigrationConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MigrationConfig config = ConfigLoader.load(Path.of("ui-migrator.yaml"));
 * MigrationManager manager = MigrationManager.create(config);
 * }</pre>
 */
public class ConfigLoader {

    /** Default config file name, resolved against the working directory. */
    public static final String DEFAULT_CONFIG_FILE = "ui-migrator.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link MigrationConfig#defaults()}.
     *
     * @param configPath path to {@code ui-migrator.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static MigrationConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return MigrationConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return MigrationConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            MigrationConfig config = YAML_MAPPER.readValue(configPath.toFile(), MigrationConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return MigrationConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return MigrationConfig.defaults();
        }
    }
}
