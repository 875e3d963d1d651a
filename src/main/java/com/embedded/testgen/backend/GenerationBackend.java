package com.embedded.testgen.backend;

/**
 * One external text-generation service or model.
 */
public interface GenerationBackend {

    /**
     * Name used in logs and run summaries, e.g. the model id.
     */
    String getName();

    /**
     * Sends a single prompt and returns the generated text.
     *
     * @throws BackendCallException when the call fails for any reason the caller may classify
     */
    String generate(String prompt) throws BackendCallException;
}
