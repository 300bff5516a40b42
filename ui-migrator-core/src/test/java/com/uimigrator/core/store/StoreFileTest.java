package com.uimigrator.core.store;

import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.MigrationStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StoreFile}.
 */
class StoreFileTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_returnsEmptyStore() {
        ComponentStore store = StoreFile.load(tempDir.resolve("migration_tracker.json"));

        assertThat(store.isEmpty()).isTrue();
    }

    @Test
    void load_malformedFile_returnsEmptyStore() throws Exception {
        Path file = tempDir.resolve("migration_tracker.json");
        Files.writeString(file, "{ this is not json");

        assertThat(StoreFile.load(file).isEmpty()).isTrue();
    }

    @Test
    void load_malformedFile_keepsCopyThatLaterSavesDoNotOverwrite() throws Exception {
        // Given
        Path file = tempDir.resolve("migration_tracker.json");
        Files.writeString(file, "{ this is not json");

        // When
        ComponentStore store = StoreFile.load(file);
        store.add(ComponentMetadata.discovered("a1", "UserCard", "src/UserCard.jsx", "src",
            ComponentType.REACT, 5, List.of()));
        StoreFile.save(store, file);

        // Then
        Path corrupt = tempDir.resolve("migration_tracker.json.corrupt");
        assertThat(corrupt).exists();
        assertThat(Files.readString(corrupt)).isEqualTo("{ this is not json");
        assertThat(StoreFile.load(file).contains("a1")).isTrue();
    }

    @Test
    void save_thenLoad_preservesComponents() throws Exception {
        Path file = tempDir.resolve("state/migration_tracker.json");
        ComponentStore store = new ComponentStore();
        store.add(ComponentMetadata.discovered("a1", "UserCard", "src/UserCard.jsx", "src",
            ComponentType.REACT, 17, List.of("Avatar")).withDependencies(Set.of("b2")));
        store.add(ComponentMetadata.discovered("b2", "Avatar", "src/Avatar.vue", "src",
            ComponentType.other("svelte"), 3, List.of()).withDependents(Set.of("a1")));
        store.updateStatus("b2", MigrationStatus.skipped("parse error"));
        store.updateMigratedPath("a1", "out/user_card.rs");

        StoreFile.save(store, file);
        ComponentStore loaded = StoreFile.load(file);

        assertThat(loaded.getAll()).containsExactlyElementsOf(store.getAll());
        assertThat(loaded.require("b2").status().reason()).isEqualTo("parse error");
        assertThat(loaded.require("b2").componentType()).isEqualTo(ComponentType.other("svelte"));
        assertThat(loaded.startedAt()).isEqualTo(store.startedAt());
    }

    @Test
    void save_writesReadableJsonWithoutTempFile() throws Exception {
        Path file = tempDir.resolve("migration_tracker.json");
        ComponentStore store = new ComponentStore();
        store.add(ComponentMetadata.discovered("a1", "UserCard", "src/UserCard.jsx", "src",
            ComponentType.REACT, 5, List.of()));

        StoreFile.save(store, file);

        String json = Files.readString(file);
        assertThat(json)
            .contains("\"components\"")
            .contains("\"componentType\" : \"React\"")
            .contains("\"stats\"")
            .contains("\"NOT_STARTED\"");
        assertThat(tempDir.resolve("migration_tracker.json.tmp")).doesNotExist();
    }

    @Test
    void load_ignoresUnknownFields() throws Exception {
        Path file = tempDir.resolve("migration_tracker.json");
        Files.writeString(file, """
            {
              "components": {
                "a1": {
                  "id": "a1",
                  "name": "UserCard",
                  "filePath": "src/UserCard.jsx",
                  "componentType": "React",
                  "status": {"state": "COMPLETED"},
                  "complexity": 500,
                  "legacyField": true
                }
              },
              "version": 2
            }
            """);

        ComponentStore store = StoreFile.load(file);

        assertThat(store.size()).isEqualTo(1);
        ComponentMetadata component = store.require("a1");
        assertThat(component.status().isCompleted()).isTrue();
        assertThat(component.complexity()).isEqualTo(ComponentMetadata.MAX_COMPLEXITY);
        assertThat(component.dependencies()).isEmpty();
    }
}
