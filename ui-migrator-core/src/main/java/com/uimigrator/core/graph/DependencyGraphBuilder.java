package com.uimigrator.core.graph;

import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.store.ComponentStore;
import com.uimigrator.core.util.NameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves raw dependency hints into edges between tracked components.
 *
 * <p>A hint resolves to a component whose name matches it ignoring case and {@code -}/{@code _}
 * separators. Candidates of the same type as the referencing component win over other types;
 * remaining ties prefer the same source root, then the smallest ID. Hints that match nothing,
 * and hints that only match the component itself, are dropped.
 *
 * <p>After every build {@code B in A.dependencies} holds exactly when {@code A in B.dependents},
 * and every referenced ID is tracked.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final Comparator<String> BY_ID = Comparator.naturalOrder();

    /**
     * Rebuilds every edge in the store from the current hints.
     *
     * @param store store to update
     * @return build summary
     */
    public GraphBuildResult build(ComponentStore store) {
        List<String> all = store.getAll().stream().map(ComponentMetadata::id).toList();
        return rebuild(store, all, true);
    }

    /**
     * Rebuilds the outgoing edges of some components.
     *
     * <p>Previous edges of the affected components are removed first, together with the matching
     * {@code dependents} entries on their targets, so repeated rebuilds never accumulate edges.
     *
     * @param store store to update
     * @param affectedIds components whose hints changed; unknown IDs are ignored
     * @return build summary
     */
    public GraphBuildResult rebuild(ComponentStore store, Collection<String> affectedIds) {
        return rebuild(store, affectedIds, false);
    }

    private GraphBuildResult rebuild(ComponentStore store, Collection<String> affectedIds, boolean full) {
        SortedMap<String, Set<String>> dependencies = new TreeMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        for (ComponentMetadata component : store.getAll()) {
            dependencies.put(component.id(), new TreeSet<>(component.dependencies()));
            dependents.put(component.id(), new TreeSet<>(full ? Set.of() : component.dependents()));
        }

        Set<String> affected = new TreeSet<>();
        for (String id : affectedIds) {
            if (store.contains(id)) {
                affected.add(id);
            }
        }

        // clear stale edges
        for (String id : affected) {
            for (String target : dependencies.get(id)) {
                Set<String> incoming = dependents.get(target);
                if (incoming != null) {
                    incoming.remove(id);
                }
            }
            dependencies.get(id).clear();
        }
        if (full) {
            dependencies.values().forEach(Set::clear);
        }

        Map<String, List<ComponentMetadata>> nameIndex = nameIndex(store.getAll());
        int edgeCount = 0;
        int unresolved = 0;
        for (String id : affected) {
            ComponentMetadata component = store.get(id).orElseThrow();
            for (String hint : component.dependencyHints()) {
                Optional<String> target = resolve(component, hint, nameIndex);
                if (target.isEmpty()) {
                    unresolved++;
                    log.debug("Unresolved dependency hint {} in {}", hint, component.name());
                    continue;
                }
                if (dependencies.get(id).add(target.get())) {
                    dependents.get(target.get()).add(id);
                    edgeCount++;
                }
            }
        }

        for (ComponentMetadata component : new ArrayList<>(store.getAll())) {
            Set<String> newDependencies = dependencies.get(component.id());
            Set<String> newDependents = dependents.get(component.id());
            if (!newDependencies.equals(component.dependencies()) || !newDependents.equals(component.dependents())) {
                store.replace(component.withDependencies(newDependencies).withDependents(newDependents));
            }
        }

        List<List<String>> cycles = CycleDetector.findCycles(dependencies);
        if (!cycles.isEmpty()) {
            log.warn("Found {} dependency cycles; members are ordered by fewest unmet dependencies", cycles.size());
        }
        log.info("Built dependency graph: {} edges for {} components, {} unresolved hints",
            edgeCount, affected.size(), unresolved);
        return new GraphBuildResult(edgeCount, unresolved, cycles);
    }

    private static Map<String, List<ComponentMetadata>> nameIndex(Collection<ComponentMetadata> components) {
        Map<String, List<ComponentMetadata>> index = new HashMap<>();
        for (ComponentMetadata component : components) {
            index.computeIfAbsent(NameUtils.matchKey(component.name()), key -> new ArrayList<>()).add(component);
        }
        return index;
    }

    private static Optional<String> resolve(ComponentMetadata source, String hint,
                                            Map<String, List<ComponentMetadata>> nameIndex) {
        List<ComponentMetadata> candidates = nameIndex.getOrDefault(NameUtils.matchKey(hint), List.of()).stream()
            .filter(candidate -> !candidate.id().equals(source.id()))
            .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<ComponentMetadata> sameType = candidates.stream()
            .filter(candidate -> candidate.componentType().equals(source.componentType()))
            .toList();
        List<ComponentMetadata> pool = sameType.isEmpty() ? candidates : sameType;
        return pool.stream()
            .min(Comparator.comparing((ComponentMetadata candidate) -> !candidate.sourceRoot().equals(source.sourceRoot()))
                .thenComparing(ComponentMetadata::id, BY_ID))
            .map(ComponentMetadata::id);
    }
}
