package com.uimigrator.core.report;

import com.uimigrator.core.model.MigrationStats;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of a migration, assembled by {@link MigrationReporter}.
 *
 * @param generatedAt time the snapshot was taken
 * @param stats status counts
 * @param types per-type counts, ordered by type label
 * @param completed completed components, ordered by name
 * @param failed failed components, ordered by name
 * @param skipped skipped components, ordered by name
 * @param edges dependency edges, ordered by source then target ID
 */
public record MigrationReport(
    Instant generatedAt,
    MigrationStats stats,
    List<TypeSummary> types,
    List<CompletedRow> completed,
    List<ProblemRow> failed,
    List<ProblemRow> skipped,
    List<Edge> edges
) {
    public MigrationReport {
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(stats, "stats must not be null");
        types = types == null ? List.of() : List.copyOf(types);
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Counts for one component type.
     *
     * @param type type label
     * @param total tracked components of the type
     * @param completed completed components of the type
     */
    public record TypeSummary(String type, int total, int completed) {}

    /**
     * A migrated component.
     *
     * @param id component ID
     * @param name component name
     * @param type type label
     * @param sourcePath original file path
     * @param migratedPath generated file path
     */
    public record CompletedRow(String id, String name, String type, String sourcePath, String migratedPath) {}

    /**
     * A failed or skipped component.
     *
     * @param id component ID
     * @param name component name
     * @param type type label
     * @param reason failure reason
     */
    public record ProblemRow(String id, String name, String type, String reason) {}

    /**
     * A dependency edge: {@code source} depends on {@code target}.
     *
     * @param sourceId dependent component ID
     * @param sourceName dependent component name
     * @param targetId dependency ID
     * @param targetName dependency name
     */
    public record Edge(String sourceId, String sourceName, String targetId, String targetName) {}
}
