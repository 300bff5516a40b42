package com.uimigrator.core.exceptions;

/**
 * Thrown when an operation names a component ID the store does not track.
 *
 * <p>The store is left untouched when this exception is raised.
 */
public class ComponentNotFoundException extends MigrationException {

    private final String componentId;

    /**
     * Creates a new exception for the given component ID.
     *
     * @param componentId the unknown ID
     */
    public ComponentNotFoundException(String componentId) {
        super("Component with ID " + componentId + " not found");
        this.componentId = componentId;
    }

    public String getComponentId() {
        return componentId;
    }
}
