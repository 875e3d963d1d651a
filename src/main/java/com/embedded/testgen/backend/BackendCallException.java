package com.embedded.testgen.backend;

import java.util.OptionalInt;

/**
 * A failed call to one backend. Carries the HTTP status when the failure came from a response.
 */
public class BackendCallException extends Exception {

    private static final long serialVersionUID = 1L;
    private static final int NO_STATUS = -1;

    private final int statusCode;

    public BackendCallException(String message) {
        this(message, NO_STATUS, null);
    }

    public BackendCallException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public BackendCallException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt getStatusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
