package com.uimigrator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration of a migration run.
 *
 * <p>Loaded from {@code ui-migrator.yaml} in the working directory. Every field is optional;
 * missing fields take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * storePath: migration_tracker.json
 * outputDir: generated/leptos
 * sourceRoots:
 *   - ./frontend/src
 *   - ./legacy/app
 * autoDetectDependencies: true
 * skipOnError: true
 * batchSize: 10
 * }</pre>
 *
 * @param storePath store file location
 * @param outputDir root directory for generated components
 * @param sourceRoots directories searched for components
 * @param autoDetectDependencies whether discovery rebuilds the dependency graph
 * @param skipOnError mark failing components Skipped and continue instead of aborting
 * @param batchSize maximum number of components per batch
 * @param prioritization plan scoring weights
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MigrationConfig(
    @JsonProperty("storePath") String storePath,
    @JsonProperty("outputDir") String outputDir,
    @JsonProperty("sourceRoots") List<String> sourceRoots,
    @JsonProperty("autoDetectDependencies") Boolean autoDetectDependencies,
    @JsonProperty("skipOnError") Boolean skipOnError,
    @JsonProperty("batchSize") Integer batchSize,
    @JsonProperty("prioritization") PrioritizationFactors prioritization
) {
    public static final String DEFAULT_STORE_PATH = "migration_tracker.json";
    public static final String DEFAULT_OUTPUT_DIR = "generated/leptos";
    public static final int DEFAULT_BATCH_SIZE = 10;

    public MigrationConfig {
        storePath = storePath == null || storePath.isBlank() ? DEFAULT_STORE_PATH : storePath;
        outputDir = outputDir == null || outputDir.isBlank() ? DEFAULT_OUTPUT_DIR : outputDir;
        sourceRoots = sourceRoots == null ? List.of() : List.copyOf(sourceRoots);
        autoDetectDependencies = autoDetectDependencies == null || autoDetectDependencies;
        skipOnError = skipOnError == null || skipOnError;
        if (batchSize == null) {
            batchSize = DEFAULT_BATCH_SIZE;
        } else if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        prioritization = prioritization == null ? PrioritizationFactors.defaults() : prioritization;
    }

    /**
     * Creates the default configuration: no source roots, auto-detection and skip-on-error on.
     *
     * @return default configuration
     */
    public static MigrationConfig defaults() {
        return new MigrationConfig(null, null, null, null, null, null, null);
    }

    public Path storeFile() {
        return Path.of(storePath);
    }

    public Path outputDirectory() {
        return Path.of(outputDir);
    }

    public List<Path> sourceRootPaths() {
        return sourceRoots.stream().map(Path::of).toList();
    }

    public MigrationConfig withStorePath(String newStorePath) {
        return new MigrationConfig(newStorePath, outputDir, sourceRoots, autoDetectDependencies,
            skipOnError, batchSize, prioritization);
    }

    public MigrationConfig withOutputDir(String newOutputDir) {
        return new MigrationConfig(storePath, newOutputDir, sourceRoots, autoDetectDependencies,
            skipOnError, batchSize, prioritization);
    }

    public MigrationConfig withSourceRoots(List<String> newSourceRoots) {
        return new MigrationConfig(storePath, outputDir, newSourceRoots, autoDetectDependencies,
            skipOnError, batchSize, prioritization);
    }

    public MigrationConfig withSkipOnError(boolean newSkipOnError) {
        return new MigrationConfig(storePath, outputDir, sourceRoots, autoDetectDependencies,
            newSkipOnError, batchSize, prioritization);
    }

    public MigrationConfig withAutoDetectDependencies(boolean newAutoDetect) {
        return new MigrationConfig(storePath, outputDir, sourceRoots, newAutoDetect,
            skipOnError, batchSize, prioritization);
    }

    public MigrationConfig withBatchSize(int newBatchSize) {
        return new MigrationConfig(storePath, outputDir, sourceRoots, autoDetectDependencies,
            skipOnError, newBatchSize, prioritization);
    }
}
