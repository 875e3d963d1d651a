package com.embedded.testgen.cli;

import java.time.Duration;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.cli.exception.OptionsValidationException;
import com.embedded.testgen.cli.model.GenerateOptions;
import com.embedded.testgen.cli.model.ValidatedGenerateOptions;
import com.embedded.testgen.cli.output.GenerateResultsPrinter;
import com.embedded.testgen.cli.validation.GenerateOptionsValidator;
import com.embedded.testgen.config.GeneratorConfig;
import com.embedded.testgen.runner.GeneratorResult;
import com.embedded.testgen.runner.TestGenerationRunner;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating Unity unit tests for the C files of a repository.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "c-unit-testgen 1.0.0",
        description = "Generates, validates and regenerates Unity unit tests for embedded C sources."
)
public class GenerateTestsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateTestsCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator;
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    public GenerateTestsCommand() {
        this(new GenerateOptionsValidator());
    }

    GenerateTestsCommand(GenerateOptionsValidator validator) {
        this.validator = validator;
    }

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        GeneratorConfig config = toConfig(options, validated);
        printer.printBanner(config);

        try {
            GeneratorResult result = new TestGenerationRunner(config).run();
            if (!result.isSuccess()) {
                log.error("Generation failed: {}", result.getErrorMessage());
                return 1;
            }
            printer.printSummary(config, result);
            return exitCodeFor(result, config.isRegenerateOnLowQuality());
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    static GeneratorConfig toConfig(GenerateOptions o, ValidatedGenerateOptions v) {
        return GeneratorConfig.builder()
                .repoPath(v.getRepoPath())
                .sourcePath(v.getSourcePath())
                .outputPath(v.getOutputPath())
                .apiKey(v.getApiKey())
                .models(o.getModels().stream().map(String::trim).filter(m -> !m.isEmpty()).toList())
                .baseUrl(o.getBaseUrl())
                .requestTimeout(Duration.ofSeconds(o.getRequestTimeoutSeconds()))
                .maxRetries(o.getMaxRetries())
                .backoffMillis(o.getBackoffMillis())
                .maxRegenerationAttempts(o.getMaxRegenerationAttempts())
                .regenerateOnLowQuality(o.isRegenerateOnLowQuality())
                .qualityThreshold(o.getQualityThreshold())
                .redactSensitive(o.isRedactSensitive())
                .build();
    }

    /**
     * Non-zero when nothing was generated, when a file failed, or when files stay below the
     * threshold without regeneration enabled.
     */
    static int exitCodeFor(GeneratorResult result, boolean regenerationEnabled) {
        if (!result.isSuccess() || result.getAccepted() == 0) {
            return 1;
        }
        if (!result.getBelowThresholdFiles().isEmpty() && !regenerationEnabled) {
            return 1;
        }
        return result.getFailedFiles().isEmpty() ? 0 : 1;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
