package com.uimigrator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authoritative lifecycle state of a component, with the reason carried by
 * {@link MigrationState#FAILED} and {@link MigrationState#SKIPPED}.
 *
 * @param state lifecycle state
 * @param reason failure or skip reason; null for the other states
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MigrationStatus(
    @JsonProperty("state") MigrationState state,
    @JsonProperty("reason") String reason
) {
    private static final MigrationStatus NOT_STARTED = new MigrationStatus(MigrationState.NOT_STARTED, null);
    private static final MigrationStatus IN_PROGRESS = new MigrationStatus(MigrationState.IN_PROGRESS, null);
    private static final MigrationStatus COMPLETED = new MigrationStatus(MigrationState.COMPLETED, null);

    /**
     * Compact constructor with validation.
     */
    public MigrationStatus {
        if (state == null) {
            state = MigrationState.NOT_STARTED;
        }
        if (state == MigrationState.FAILED || state == MigrationState.SKIPPED) {
            if (reason == null || reason.isBlank()) {
                reason = "Unknown error";
            }
        } else {
            reason = null;
        }
    }

    public static MigrationStatus notStarted() {
        return NOT_STARTED;
    }

    public static MigrationStatus inProgress() {
        return IN_PROGRESS;
    }

    public static MigrationStatus completed() {
        return COMPLETED;
    }

    public static MigrationStatus failed(String reason) {
        return new MigrationStatus(MigrationState.FAILED, reason);
    }

    public static MigrationStatus skipped(String reason) {
        return new MigrationStatus(MigrationState.SKIPPED, reason);
    }

    /**
     * Checks the state tag, ignoring any reason.
     *
     * @param other state to compare with
     * @return true if this status is in the given state
     */
    public boolean is(MigrationState other) {
        return state == other;
    }

    @JsonIgnore
    public boolean isNotStarted() {
        return state == MigrationState.NOT_STARTED;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return state == MigrationState.COMPLETED;
    }

    @Override
    public String toString() {
        return reason == null
            ? state.displayName()
            : state.displayName() + "(" + reason + ")";
    }
}
