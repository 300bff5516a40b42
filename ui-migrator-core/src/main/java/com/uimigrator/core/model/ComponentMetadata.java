package com.uimigrator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tracked state of one discovered component.
 *
 * <p>Identity fields ({@code id}, {@code name}, {@code filePath}, {@code sourceRoot},
 * {@code componentType}) never change after discovery. Every other field is replaced through
 * the {@code with*} methods; the store swaps in the new instance.
 *
 * <p>Sets are kept sorted so the store file is stable between saves.
 *
 * @param id deterministic identifier derived from name, normalized path and type
 * @param name component name
 * @param filePath path of the component source file as discovered
 * @param sourceRoot source root the component was discovered under
 * @param componentType source technology
 * @param status current migration status
 * @param complexity heuristic complexity score, always in [1, 100]
 * @param dependencies IDs this component references
 * @param dependents IDs that reference this component
 * @param dependencyHints raw textual references recorded at discovery
 * @param lastUpdated time of the last status change
 * @param migratedPath generated output location, only set once completed
 * @param notes optional free text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComponentMetadata(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("filePath") String filePath,
    @JsonProperty("sourceRoot") String sourceRoot,
    @JsonProperty("componentType") ComponentType componentType,
    @JsonProperty("status") MigrationStatus status,
    @JsonProperty("complexity") int complexity,
    @JsonProperty("dependencies") Set<String> dependencies,
    @JsonProperty("dependents") Set<String> dependents,
    @JsonProperty("dependencyHints") Set<String> dependencyHints,
    @JsonProperty("lastUpdated") Instant lastUpdated,
    @JsonProperty("migratedPath") String migratedPath,
    @JsonProperty("notes") String notes
) {
    public static final int MIN_COMPLEXITY = 1;
    public static final int MAX_COMPLEXITY = 100;

    /**
     * Compact constructor with validation and defaults for fields missing from older files.
     */
    public ComponentMetadata {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (sourceRoot == null) {
            sourceRoot = "";
        }
        if (componentType == null) {
            componentType = ComponentType.other("Unknown");
        }
        if (status == null) {
            status = MigrationStatus.notStarted();
        }
        complexity = clampComplexity(complexity);
        dependencies = sortedCopy(dependencies);
        dependents = sortedCopy(dependents);
        dependencyHints = sortedCopy(dependencyHints);
        if (lastUpdated == null) {
            lastUpdated = Instant.now();
        }
    }

    /**
     * Creates a freshly discovered component in {@link MigrationState#NOT_STARTED}.
     *
     * @param id derived ID
     * @param name component name
     * @param filePath source file path
     * @param sourceRoot source root
     * @param componentType source technology
     * @param complexity complexity score
     * @param dependencyHints raw dependency hints
     * @return new metadata record
     */
    public static ComponentMetadata discovered(
            String id,
            String name,
            String filePath,
            String sourceRoot,
            ComponentType componentType,
            int complexity,
            Collection<String> dependencyHints) {
        return new ComponentMetadata(
            id,
            name,
            filePath,
            sourceRoot,
            componentType,
            MigrationStatus.notStarted(),
            complexity,
            Set.of(),
            Set.of(),
            dependencyHints == null ? Set.of() : Set.copyOf(dependencyHints),
            Instant.now(),
            null,
            null
        );
    }

    public ComponentMetadata withStatus(MigrationStatus newStatus, Instant when) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, newStatus, complexity,
            dependencies, dependents, dependencyHints, when, migratedPath, notes);
    }

    public ComponentMetadata withMigratedPath(String newMigratedPath) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, status, complexity,
            dependencies, dependents, dependencyHints, lastUpdated, newMigratedPath, notes);
    }

    public ComponentMetadata withNotes(String newNotes) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, status, complexity,
            dependencies, dependents, dependencyHints, lastUpdated, migratedPath, newNotes);
    }

    public ComponentMetadata withDependencyHints(Collection<String> hints) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, status, complexity,
            dependencies, dependents, Set.copyOf(hints), lastUpdated, migratedPath, notes);
    }

    public ComponentMetadata withDependencies(Collection<String> newDependencies) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, status, complexity,
            Set.copyOf(newDependencies), dependents, dependencyHints, lastUpdated, migratedPath, notes);
    }

    public ComponentMetadata withDependents(Collection<String> newDependents) {
        return new ComponentMetadata(id, name, filePath, sourceRoot, componentType, status, complexity,
            dependencies, Set.copyOf(newDependents), dependencyHints, lastUpdated, migratedPath, notes);
    }

    /**
     * Clamps a raw score into [{@value #MIN_COMPLEXITY}, {@value #MAX_COMPLEXITY}].
     *
     * @param raw raw score
     * @return clamped score
     */
    public static int clampComplexity(int raw) {
        return Math.max(MIN_COMPLEXITY, Math.min(MAX_COMPLEXITY, raw));
    }

    private static SortedSet<String> sortedCopy(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
