package com.uimigrator.core.migration;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one migration batch.
 *
 * @param attempted IDs taken from the plan, in order
 * @param completed IDs migrated successfully
 * @param skipped IDs that failed and were skipped, with their reasons
 */
public record BatchResult(
    List<String> attempted,
    List<String> completed,
    Map<String, String> skipped
) {
    public BatchResult {
        attempted = attempted == null ? List.of() : List.copyOf(attempted);
        completed = completed == null ? List.of() : List.copyOf(completed);
        skipped = skipped == null ? Map.of() : Map.copyOf(skipped);
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), List.of(), Map.of());
    }

    public boolean isEmpty() {
        return attempted.isEmpty();
    }
}
