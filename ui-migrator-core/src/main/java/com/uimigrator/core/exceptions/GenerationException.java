package com.uimigrator.core.exceptions;

/**
 * Thrown by a generator that cannot emit target code for a parsed component.
 */
public class GenerationException extends MigrationException {

    public GenerationException(String message) { super(message); }

    public GenerationException(String message, Throwable cause) { super(message, cause); }
}
