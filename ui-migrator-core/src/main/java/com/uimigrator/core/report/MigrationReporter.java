package com.uimigrator.core.report;

import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.MigrationState;
import com.uimigrator.core.store.ComponentStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds {@link MigrationReport} snapshots. Never mutates the store.
 */
public class MigrationReporter {

    private static final Comparator<ComponentMetadata> BY_NAME =
        Comparator.comparing(ComponentMetadata::name).thenComparing(ComponentMetadata::id);

    public MigrationReport report(ComponentStore store) {
        Map<String, int[]> typeCounts = new TreeMap<>();
        for (ComponentMetadata component : store.getAll()) {
            int[] counts = typeCounts.computeIfAbsent(component.componentType().label(), label -> new int[2]);
            counts[0]++;
            if (component.status().isCompleted()) {
                counts[1]++;
            }
        }
        List<MigrationReport.TypeSummary> types = new ArrayList<>();
        typeCounts.forEach((label, counts) -> types.add(new MigrationReport.TypeSummary(label, counts[0], counts[1])));

        List<MigrationReport.CompletedRow> completed = store.getByStatus(MigrationState.COMPLETED).stream()
            .sorted(BY_NAME)
            .map(component -> new MigrationReport.CompletedRow(
                component.id(),
                component.name(),
                component.componentType().label(),
                component.filePath(),
                component.migratedPath()))
            .toList();

        List<MigrationReport.Edge> edges = new ArrayList<>();
        for (ComponentMetadata component : store.getAll()) {
            for (String dependencyId : component.dependencies()) {
                store.get(dependencyId).ifPresent(dependency -> edges.add(new MigrationReport.Edge(
                    component.id(), component.name(), dependency.id(), dependency.name())));
            }
        }

        return new MigrationReport(
            Instant.now(),
            store.stats(),
            types,
            completed,
            problems(store, MigrationState.FAILED),
            problems(store, MigrationState.SKIPPED),
            edges
        );
    }

    private static List<MigrationReport.ProblemRow> problems(ComponentStore store, MigrationState state) {
        return store.getByStatus(state).stream()
            .sorted(BY_NAME)
            .map(component -> new MigrationReport.ProblemRow(
                component.id(),
                component.name(),
                component.componentType().label(),
                component.status().reason()))
            .toList();
    }
}
