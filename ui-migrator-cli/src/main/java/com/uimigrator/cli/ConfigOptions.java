package com.uimigrator.cli;

import com.uimigrator.core.config.ConfigLoader;
import com.uimigrator.core.config.MigrationConfig;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options shared by every command that works on a migration: config file and its overrides.
 */
public class ConfigOptions {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_CONFIG_FILE
    )
    Path configPath;

    @Option(names = {"-s", "--store"}, description = "Store file (overrides config)")
    Path storePath;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory for generated components (overrides config)")
    Path outputDir;

    /**
     * Loads the configuration file, if present, and applies command line overrides.
     *
     * @return effective configuration
     */
    MigrationConfig load() {
        MigrationConfig config = Files.exists(configPath)
            ? ConfigLoader.load(configPath)
            : MigrationConfig.defaults();
        if (storePath != null) {
            config = config.withStorePath(storePath.toString());
        }
        if (outputDir != null) {
            config = config.withOutputDir(outputDir.toString());
        }
        return config;
    }
}
