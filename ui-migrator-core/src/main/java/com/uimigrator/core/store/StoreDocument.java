package com.uimigrator.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.MigrationStats;

import java.time.Instant;
import java.util.Map;

/**
 * On-disk layout of the store file.
 *
 * <p>{@code stats} is written for readers of the file and ignored on load; counts are always
 * recomputed from the components.
 *
 * @param components components keyed by ID
 * @param startedAt time the store was first created
 * @param lastUpdated time of the last change
 * @param stats status counts at save time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoreDocument(
    @JsonProperty("components") Map<String, ComponentMetadata> components,
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("lastUpdated") Instant lastUpdated,
    @JsonProperty("stats") MigrationStats stats
) {
    StoreDocument {
        if (components == null) {
            components = Map.of();
        }
    }
}
