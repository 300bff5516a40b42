package com.uimigrator.core.exceptions;

/**
 * Thrown when analyzing or generating a single component fails.
 *
 * <p>The failure has already been recorded in the component's status by the time this
 * exception reaches the caller.
 */
public class ComponentMigrationException extends MigrationException {

    private final String componentId;

    /**
     * Creates a new exception for a failed component.
     *
     * @param componentId the component that failed
     * @param message failure reason
     * @param cause underlying analyzer or generator error, may be null
     */
    public ComponentMigrationException(String componentId, String message, Throwable cause) {
        super(message, cause);
        this.componentId = componentId;
    }

    public String getComponentId() {
        return componentId;
    }
}
