package com.embedded.testgen.regen;

import com.embedded.testgen.context.GenerationContext;
import com.embedded.testgen.validation.ValidationReport;

import lombok.Builder;
import lombok.Value;

/**
 * One generate, normalize and validate cycle for a single file.
 */
@Value
@Builder
public class GenerationAttempt {
    int attemptIndex;
    GenerationContext context;
    String rawOutput;
    String normalizedOutput;
    ValidationReport report;
}
