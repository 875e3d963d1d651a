package com.embedded.testgen.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.config.GeneratorConfig;
import com.embedded.testgen.runner.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GeneratorConfig config) {
        log.info("=================================================");
        log.info("C Unit Test Generator");
        log.info("=================================================");
        log.info("Repository: {}", config.getRepoPath());
        log.info("Source Directory: {}", config.getSourcePath());
        log.info("Output Directory: {}", config.getOutputPath());
        log.info("Models: {}", String.join(", ", config.getModels()));
        log.info("Quality Threshold: {}", config.getQualityThreshold().getDisplayName());
        if (config.isRegenerateOnLowQuality()) {
            log.info("Regeneration: enabled, up to {} attempt(s)", config.getMaxRegenerationAttempts());
        } else {
            log.info("Regeneration: disabled");
        }
        log.info("Redact Sensitive Content: {}", config.isRedactSensitive());
        log.info("=================================================");
    }

    public void printSummary(GeneratorConfig config, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION COMPLETE");
        log.info("=================================================");
        log.info("Generated: {}/{} files", result.getAccepted(), result.getFilesProcessed());
        log.info("Tests saved to: {}", result.getOutputPath());
        log.info("Reports saved to: {}", result.getReportPath());
        log.info("Backend attempts: {}", result.getAttemptsIssued());

        if (config.isRegenerateOnLowQuality()) {
            log.info("Regenerations: {}/{} successful", result.getSuccessfulRegenerations(), result.getRegenerations());
            if (result.getRegenerations() > 0) {
                log.info("Regeneration success rate: {}%", String.format("%.1f", result.getRegenerationSuccessRate()));
            }
        }

        if (!result.getFailedFiles().isEmpty()) {
            log.info("");
            log.info("Failed files:");
            result.getFailedFiles().forEach(f -> log.info("  - {}", f));
        }

        if (!result.getBelowThresholdFiles().isEmpty()) {
            log.info("");
            String threshold = config.getQualityThreshold().getDisplayName();
            if (config.isRegenerateOnLowQuality()) {
                log.warn("{} test(s) still below {} quality threshold after regeneration:",
                        result.getBelowThresholdFiles().size(), threshold);
                result.getBelowThresholdFiles().forEach(f -> log.warn("  - {}", f));
                log.info("Consider increasing --max-regeneration-attempts or relaxing --quality-threshold");
            } else {
                log.error("{} test(s) failed to meet {} quality threshold:",
                        result.getBelowThresholdFiles().size(), threshold);
                result.getBelowThresholdFiles().forEach(f -> log.error("  - {}", f));
                log.info("Use --regenerate-on-low-quality to automatically improve test quality");
            }
        }
        log.info("=================================================");
    }
}
