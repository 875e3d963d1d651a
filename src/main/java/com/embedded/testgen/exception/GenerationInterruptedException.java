package com.embedded.testgen.exception;

/**
 * The thread was interrupted while waiting on a backend or a backoff delay.
 * Aborts the whole run; the interrupted file never reaches an accepted state.
 */
public class GenerationInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
