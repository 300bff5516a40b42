package com.uimigrator.core.exceptions;

import com.uimigrator.core.model.MigrationState;

/**
 * Thrown when a status change would break the forward-only migration state machine.
 */
public class InvalidTransitionException extends MigrationException {

    private final String componentId;
    private final MigrationState from;
    private final MigrationState to;

    /**
     * Creates a new exception describing the rejected transition.
     *
     * @param componentId component the transition was requested for
     * @param from current state
     * @param to requested state
     */
    public InvalidTransitionException(String componentId, MigrationState from, MigrationState to) {
        super("Component " + componentId + " cannot move from " + from.displayName()
            + " to " + to.displayName());
        this.componentId = componentId;
        this.from = from;
        this.to = to;
    }

    public String getComponentId() {
        return componentId;
    }

    public MigrationState getFrom() {
        return from;
    }

    public MigrationState getTo() {
        return to;
    }
}
