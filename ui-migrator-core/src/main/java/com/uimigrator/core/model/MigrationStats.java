package com.uimigrator.core.model;

import java.util.Collection;
import java.util.Locale;

/**
 * Aggregate component counts per migration state.
 *
 * @param totalComponents number of tracked components
 * @param notStarted components waiting to be migrated
 * @param inProgress components currently being migrated
 * @param completed migrated components
 * @param failed components whose migration failed
 * @param skipped components skipped after an error
 * @param completionPercentage completed share of all components (0-100)
 */
public record MigrationStats(
    int totalComponents,
    int notStarted,
    int inProgress,
    int completed,
    int failed,
    int skipped,
    double completionPercentage
) {
    /**
     * Creates statistics for an empty store.
     *
     * @return all-zero statistics
     */
    public static MigrationStats empty() {
        return new MigrationStats(0, 0, 0, 0, 0, 0, 0.0);
    }

    /**
     * Counts components by state.
     *
     * @param components components to count
     * @return statistics
     */
    public static MigrationStats of(Collection<ComponentMetadata> components) {
        int notStarted = 0;
        int inProgress = 0;
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (ComponentMetadata component : components) {
            switch (component.status().state()) {
                case NOT_STARTED -> notStarted++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        int total = components.size();
        double percentage = total > 0 ? (completed * 100.0) / total : 0.0;
        return new MigrationStats(total, notStarted, inProgress, completed, failed, skipped, percentage);
    }

    /**
     * Returns the count for a single state.
     *
     * @param state migration state
     * @return number of components in that state
     */
    public int count(MigrationState state) {
        return switch (state) {
            case NOT_STARTED -> notStarted;
            case IN_PROGRESS -> inProgress;
            case COMPLETED -> completed;
            case FAILED -> failed;
            case SKIPPED -> skipped;
        };
    }

    /**
     * Formats a multi-line progress summary.
     *
     * @return human-readable progress text
     */
    public String progressSummary() {
        return String.format(Locale.ROOT,
            "Migration Progress: %.1f%% (%d/%d components)%n"
                + "- Not Started: %d%n"
                + "- In Progress: %d%n"
                + "- Completed: %d%n"
                + "- Failed: %d%n"
                + "- Skipped: %d%n",
            completionPercentage, completed, totalComponents,
            notStarted, inProgress, completed, failed, skipped);
    }
}
