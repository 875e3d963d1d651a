package com.embedded.testgen.runner;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a test generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private Path reportPath;

    private int filesDiscovered;
    private int filesProcessed;
    private int accepted;

    /** Accepted files whose final report is still below the quality threshold. */
    @Singular
    private List<String> belowThresholdFiles;

    /** Files for which no test could be produced. */
    @Singular
    private List<String> failedFiles;

    private int attemptsIssued;
    private int regenerations;
    private int successfulRegenerations;
    private double regenerationSuccessRate;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
