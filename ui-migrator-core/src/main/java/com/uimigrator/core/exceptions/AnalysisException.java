package com.uimigrator.core.exceptions;

/**
 * Thrown by an analyzer that cannot parse a component it was asked to re-read.
 */
public class AnalysisException extends MigrationException {

    public AnalysisException(String message) { super(message); }

    public AnalysisException(String message, Throwable cause) { super(message, cause); }
}
