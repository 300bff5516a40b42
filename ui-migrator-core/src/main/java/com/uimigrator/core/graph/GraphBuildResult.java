package com.uimigrator.core.graph;

import java.util.List;

/**
 * Outcome of a dependency graph build.
 *
 * @param edgeCount edges derived for the rebuilt components
 * @param unresolvedHints hints that matched no tracked component
 * @param cycles dependency cycles in the whole graph, each a sorted list of component IDs
 */
public record GraphBuildResult(
    int edgeCount,
    int unresolvedHints,
    List<List<String>> cycles
) {
    public GraphBuildResult {
        cycles = cycles == null ? List.of() : cycles.stream().map(List::copyOf).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
