package com.embedded.testgen.validation;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of validating one generated test file. The tier is derived from the other fields.
 */
@Value
@Builder(toBuilder = true)
public class ValidationReport {

    /** Source file the test was generated for, e.g. {@code sensor.c}. */
    @NonNull
    String subjectFile;

    boolean compiles;
    boolean realistic;

    @Singular
    List<String> issues;

    public QualityTier getQuality() {
        return QualityTier.of(compiles, realistic, issues);
    }

    public boolean meets(QualityTier threshold) {
        return getQuality().isAtLeast(threshold);
    }
}
