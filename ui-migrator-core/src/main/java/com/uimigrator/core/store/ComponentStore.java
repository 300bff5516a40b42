package com.uimigrator.core.store;

import com.uimigrator.core.exceptions.ComponentNotFoundException;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.MigrationState;
import com.uimigrator.core.model.MigrationStats;
import com.uimigrator.core.model.MigrationStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory map of tracked components keyed by ID.
 *
 * <p>Components are immutable; every update replaces the entry. Iteration order is by ID, so
 * listings and the saved file are deterministic. The store is not thread-safe and is meant to be
 * owned by one {@code MigrationManager} on one thread.
 *
 * <p>Persistence is handled by {@link StoreFile}.
 */
public class ComponentStore {

    private final Map<String, ComponentMetadata> components = new TreeMap<>();
    private Instant startedAt;
    private Instant lastUpdated;

    public ComponentStore() {
        this(Instant.now(), null);
    }

    ComponentStore(Instant startedAt, Instant lastUpdated) {
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.lastUpdated = lastUpdated == null ? this.startedAt : lastUpdated;
    }

    /**
     * Adds a component unless its ID is already tracked.
     *
     * @param component component to add
     * @return true if added, false if the ID already existed (the store is unchanged)
     */
    public boolean add(ComponentMetadata component) {
        Objects.requireNonNull(component, "component must not be null");
        if (components.containsKey(component.id())) {
            return false;
        }
        components.put(component.id(), component);
        touch();
        return true;
    }

    public Optional<ComponentMetadata> get(String id) {
        return Optional.ofNullable(components.get(id));
    }

    /**
     * Returns a component or fails.
     *
     * @param id component ID
     * @return tracked component
     * @throws ComponentNotFoundException if the ID is unknown
     */
    public ComponentMetadata require(String id) throws ComponentNotFoundException {
        ComponentMetadata component = components.get(id);
        if (component == null) {
            throw new ComponentNotFoundException(id);
        }
        return component;
    }

    public boolean contains(String id) {
        return components.containsKey(id);
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public int size() {
        return components.size();
    }

    public Collection<ComponentMetadata> getAll() {
        return Collections.unmodifiableCollection(components.values());
    }

    public List<ComponentMetadata> getByStatus(MigrationState state) {
        return components.values().stream()
            .filter(component -> component.status().is(state))
            .toList();
    }

    public List<ComponentMetadata> getByType(ComponentType type) {
        return components.values().stream()
            .filter(component -> component.componentType().equals(type))
            .toList();
    }

    /**
     * Sets the status and refreshes {@code lastUpdated}.
     *
     * <p>The store does not validate transitions; the manager does.
     *
     * @param id component ID
     * @param status new status
     * @return updated component
     * @throws ComponentNotFoundException if the ID is unknown
     */
    public ComponentMetadata updateStatus(String id, MigrationStatus status) throws ComponentNotFoundException {
        Objects.requireNonNull(status, "status must not be null");
        return replace(require(id).withStatus(status, Instant.now()));
    }

    public ComponentMetadata updateMigratedPath(String id, String migratedPath) throws ComponentNotFoundException {
        return replace(require(id).withMigratedPath(migratedPath));
    }

    public ComponentMetadata updateNotes(String id, String notes) throws ComponentNotFoundException {
        return replace(require(id).withNotes(notes));
    }

    public ComponentMetadata updateDependencyHints(String id, Collection<String> hints)
            throws ComponentNotFoundException {
        return replace(require(id).withDependencyHints(hints));
    }

    /**
     * Replaces a tracked component with a new version of itself.
     *
     * <p>Used by the graph builder, which rewrites dependency sets in bulk.
     *
     * @param component new version; its ID must already be tracked
     * @return the component
     */
    public ComponentMetadata replace(ComponentMetadata component) {
        if (!components.containsKey(component.id())) {
            throw new IllegalArgumentException("Component with ID " + component.id() + " is not tracked");
        }
        components.put(component.id(), component);
        touch();
        return component;
    }

    public MigrationStats stats() {
        return MigrationStats.of(components.values());
    }

    public String progressSummary() {
        return stats().progressSummary();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    private void touch() {
        lastUpdated = Instant.now();
    }
}
