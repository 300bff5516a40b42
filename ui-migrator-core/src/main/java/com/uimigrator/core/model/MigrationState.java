package com.uimigrator.core.model;

import java.util.Set;

/**
 * Lifecycle states of a component migration.
 *
 * <p>Automatic transitions only ever move forward:
 * <pre>
 * NOT_STARTED -> IN_PROGRESS -> COMPLETED | FAILED | SKIPPED
 * </pre>
 * Moving a component back to {@link #NOT_STARTED} is an operator action and is not a
 * transition of this state machine.
 */
public enum MigrationState {

    /** Discovered, waiting to be planned */
    NOT_STARTED("Not Started"),

    /** Dequeued by the executor, not yet finished */
    IN_PROGRESS("In Progress"),

    /** Generated output recorded */
    COMPLETED("Completed"),

    /** Migration error with skip-on-error disabled */
    FAILED("Failed"),

    /** Migration error with skip-on-error enabled */
    SKIPPED("Skipped");

    private final String displayName;

    MigrationState(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether the executor may move a component from this state to {@code next}.
     *
     * @param next target state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(MigrationState next) {
        return switch (this) {
            case NOT_STARTED -> next == IN_PROGRESS;
            case IN_PROGRESS -> Set.of(COMPLETED, FAILED, SKIPPED).contains(next);
            case COMPLETED, FAILED, SKIPPED -> false;
        };
    }

    /**
     * Terminal states are never picked up again without an operator re-queue.
     *
     * @return true for completed, failed and skipped
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
