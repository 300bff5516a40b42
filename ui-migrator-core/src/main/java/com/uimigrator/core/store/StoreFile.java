package com.uimigrator.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.uimigrator.core.model.ComponentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads and saves a {@link ComponentStore} as pretty-printed JSON.
 *
 * <p>Saves go to a temporary sibling file that is then moved over the target, so a crash never
 * leaves a half-written store behind.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentStore store = StoreFile.load(Path.of("migration_tracker.json"));
 * store.updateStatus(id, MigrationStatus.inProgress());
 * StoreFile.save(store, Path.of("migration_tracker.json"));
 * }</pre>
 */
public final class StoreFile {

    private static final Logger log = LoggerFactory.getLogger(StoreFile.class);

    private static final String CORRUPT_SUFFIX = ".corrupt";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private StoreFile() {
        // Utility class
    }

    /**
     * Loads a store from disk.
     *
     * <p>A missing, unreadable or malformed file yields an empty store and a logged warning.
     * A malformed file is first renamed to {@code <name>.corrupt} so it can be recovered by hand.
     * Entries whose key disagrees with their {@code id} are keyed by {@code id}.
     *
     * @param path store file
     * @return loaded store, never null
     */
    public static ComponentStore load(Path path) {
        if (!Files.exists(path)) {
            log.info("Store file not found: {}. Starting with an empty store.", path);
            return new ComponentStore();
        }

        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.warn("Store file is not readable: {}. Starting with an empty store.", path);
            return new ComponentStore();
        }

        try {
            StoreDocument document = JSON_MAPPER.readValue(path.toFile(), StoreDocument.class);
            if (document == null) {
                log.warn("Store file is empty: {}. Starting with an empty store.", path);
                return new ComponentStore();
            }
            ComponentStore store = new ComponentStore(document.startedAt(), document.lastUpdated());
            for (ComponentMetadata component : document.components().values()) {
                if (component != null && !store.add(component)) {
                    log.warn("Duplicate component ID in store file: {}", component.id());
                }
            }
            log.debug("Loaded {} components from {}", store.size(), path);
            return store;
        } catch (IOException | RuntimeException e) {
            Path corrupt = setAside(path);
            log.warn("Failed to parse store file: {}. Moved it to {} and starting with an empty store. Error: {}",
                path, corrupt, e.getMessage());
            return new ComponentStore();
        }
    }

    /**
     * Moves an unparseable store file out of the way so the next save cannot overwrite it.
     *
     * @throws UncheckedIOException if the file cannot be moved
     */
    private static Path setAside(Path path) {
        Path corrupt = path.resolveSibling(path.getFileName() + CORRUPT_SUFFIX);
        try {
            return Files.move(path, corrupt, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Store file " + path + " is malformed and could not be moved to " + corrupt, e);
        }
    }

    /**
     * Writes a store to disk, creating parent directories as needed.
     *
     * @param store store to save
     * @param path target file
     * @throws IOException if writing or moving the file fails
     */
    public static void save(ComponentStore store, Path path) throws IOException {
        Map<String, ComponentMetadata> components = new LinkedHashMap<>();
        for (ComponentMetadata component : store.getAll()) {
            components.put(component.id(), component);
        }
        StoreDocument document = new StoreDocument(components, store.startedAt(), store.lastUpdated(), store.stats());

        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        JSON_MAPPER.writeValue(temp.toFile(), document);
        try {
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {} components to {}", components.size(), absolute);
    }
}
