package com.embedded.testgen.exception;

/**
 * Terminal failure of one generation call: either a non-throttling backend error
 * or every configured backend exhausted.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
