package com.uimigrator.core.config;

import com.uimigrator.core.model.ComponentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("ui-migrator.yaml");
        Files.writeString(configFile, """
            storePath: "state/tracker.json"
            outputDir: "out/leptos"
            sourceRoots:
              - "./frontend/src"
              - "./legacy/app"
            autoDetectDependencies: false
            skipOnError: false
            batchSize: 25
            prioritization:
              complexityWeight: 0.5
              typeWeights:
                React: 0.2
            """);

        MigrationConfig config = ConfigLoader.load(configFile);

        assertThat(config.storePath()).isEqualTo("state/tracker.json");
        assertThat(config.outputDir()).isEqualTo("out/leptos");
        assertThat(config.sourceRoots()).containsExactly("./frontend/src", "./legacy/app");
        assertThat(config.autoDetectDependencies()).isFalse();
        assertThat(config.skipOnError()).isFalse();
        assertThat(config.batchSize()).isEqualTo(25);
        assertThat(config.prioritization().complexityWeight()).isEqualTo(0.5);
        assertThat(config.prioritization().dependentsWeight()).isEqualTo(0.4);
        assertThat(config.prioritization().typeWeight(ComponentType.REACT)).isEqualTo(0.2);
        assertThat(config.prioritization().typeWeight(ComponentType.VUE)).isZero();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("ui-migrator.yaml");
        Files.writeString(configFile, """
            sourceRoots:
              - "src"
            """);

        MigrationConfig config = ConfigLoader.load(configFile);

        assertThat(config.storePath()).isEqualTo(MigrationConfig.DEFAULT_STORE_PATH);
        assertThat(config.outputDir()).isEqualTo(MigrationConfig.DEFAULT_OUTPUT_DIR);
        assertThat(config.batchSize()).isEqualTo(MigrationConfig.DEFAULT_BATCH_SIZE);
        assertThat(config.skipOnError()).isTrue();
        assertThat(config.autoDetectDependencies()).isTrue();
        assertThat(config.prioritization()).isEqualTo(PrioritizationFactors.defaults());
    }

    @Test
    void load_missingFile_returnsDefaults() {
        MigrationConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(MigrationConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("ui-migrator.yaml");
        Files.writeString(configFile, """
            sourceRoots: [unclosed
            batchSize: : :
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(MigrationConfig.defaults());
    }

    @Test
    void load_invalidBatchSize_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("ui-migrator.yaml");
        Files.writeString(configFile, "batchSize: 0\n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(MigrationConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("ui-migrator.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(MigrationConfig.defaults());
    }

    @Test
    void withBatchSize_belowOne_throwsException() {
        assertThatThrownBy(() -> MigrationConfig.defaults().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
    }
}
