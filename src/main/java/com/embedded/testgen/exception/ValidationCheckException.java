package com.embedded.testgen.exception;

/**
 * Internal failure of a single validation check.
 */
public class ValidationCheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String checkName;

    public ValidationCheckException(String checkName, Throwable cause) {
        super("Validation check '" + checkName + "' failed: " + cause.getMessage(), cause);
        this.checkName = checkName;
    }

    public String getCheckName() {
        return checkName;
    }
}
