package com.embedded.testgen.exception;

/**
 * Raised when a source file cannot be turned into a generation context
 * (unreadable, empty, or the prompt template fails to render).
 * Fatal for the file it concerns only.
 */
public class ContextBuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ContextBuildException(String message) {
        super(message);
    }

    public ContextBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
