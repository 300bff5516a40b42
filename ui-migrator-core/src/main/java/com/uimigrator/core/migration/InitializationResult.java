package com.uimigrator.core.migration;

import com.uimigrator.core.discovery.DiscoveryReport;
import com.uimigrator.core.graph.GraphBuildResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link MigrationManager#initialize()}.
 *
 * @param reconciled components reset from an interrupted run
 * @param discovery discovery summary
 * @param graph graph build summary, null when dependency detection is disabled
 */
public record InitializationResult(
    int reconciled,
    DiscoveryReport discovery,
    GraphBuildResult graph
) {
    public InitializationResult {
        Objects.requireNonNull(discovery, "discovery must not be null");
    }

    public Optional<GraphBuildResult> graphIfBuilt() {
        return Optional.ofNullable(graph);
    }
}
