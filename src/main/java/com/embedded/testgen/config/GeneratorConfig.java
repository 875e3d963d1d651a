package com.embedded.testgen.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.embedded.testgen.backend.RetryPolicy;
import com.embedded.testgen.regen.RegenerationSettings;
import com.embedded.testgen.validation.QualityTier;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one test generation run.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final String REPORT_DIR_NAME = "compilation_report";

    private Path repoPath;
    private Path sourcePath;
    private Path outputPath;

    private String apiKey;
    private List<String> models;
    private String baseUrl;
    private Duration requestTimeout;

    private int maxRetries;
    private long backoffMillis;

    private int maxRegenerationAttempts;
    private boolean regenerateOnLowQuality;
    private QualityTier qualityThreshold;

    private boolean redactSensitive;

    public Path getReportPath() {
        return outputPath.resolve(REPORT_DIR_NAME);
    }

    public RegenerationSettings toRegenerationSettings() {
        return RegenerationSettings.of(maxRegenerationAttempts, qualityThreshold, regenerateOnLowQuality);
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxTries(maxRetries)
                .baseDelayMillis(backoffMillis)
                .build();
    }
}
