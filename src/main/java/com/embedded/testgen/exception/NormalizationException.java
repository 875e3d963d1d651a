package com.embedded.testgen.exception;

/**
 * Unexpected fault inside one rewrite step of the output normalizer.
 */
public class NormalizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String step;

    public NormalizationException(String step, Throwable cause) {
        super("Normalization step '" + step + "' failed: " + cause.getMessage(), cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
