package com.uimigrator.core.exceptions;

/**
 * Base class for recoverable errors raised while tracking or migrating components.
 *
 * <p>Errors scoped to a single component are reported through a subclass of this exception
 * and recorded in that component's status. Store I/O failures are not wrapped; they surface
 * as {@link java.io.IOException}.
 *
 * @see ComponentNotFoundException
 * @see InvalidTransitionException
 * @see ComponentMigrationException
 */
public class MigrationException extends Exception {

    /**
     * Creates a new migration exception with the specified message.
     *
     * @param message a description of the failure
     */
    public MigrationException(String message) { super(message); }

    /**
     * Creates a new migration exception with the specified message and cause.
     *
     * @param message a description of the failure
     * @param cause the underlying exception
     */
    public MigrationException(String message, Throwable cause) { super(message, cause); }
}
