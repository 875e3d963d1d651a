package com.embedded.testgen.cli;

import com.embedded.testgen.cli.model.GenerateOptions;
import com.embedded.testgen.cli.model.ValidatedGenerateOptions;
import com.embedded.testgen.cli.validation.GenerateOptionsValidator;
import com.embedded.testgen.config.GeneratorConfig;
import com.embedded.testgen.runner.GeneratorResult;
import com.embedded.testgen.validation.QualityTier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class GenerateTestsCommandTest {

    @TempDir
    Path tempDir;

    private static GeneratorResult.GeneratorResultBuilder succeeded() {
        return GeneratorResult.builder().success(true).accepted(2);
    }

    @Test
    void testExitCodeZeroWhenAllFilesAccepted() {
        assertThat(GenerateTestsCommand.exitCodeFor(succeeded().build(), false)).isZero();
    }

    @Test
    void testExitCodeForFailedRun() {
        assertThat(GenerateTestsCommand.exitCodeFor(GeneratorResult.failure("boom"), true)).isEqualTo(1);
        assertThat(GenerateTestsCommand.exitCodeFor(succeeded().accepted(0).build(), true)).isEqualTo(1);
    }

    @Test
    void testExitCodeForFailedFile() {
        assertThat(GenerateTestsCommand.exitCodeFor(succeeded().failedFile("sensor.c").build(), true)).isEqualTo(1);
    }

    @Test
    void testBelowThresholdFailsOnlyWithoutRegeneration() {
        GeneratorResult result = succeeded().belowThresholdFile("sensor.c").build();

        assertThat(GenerateTestsCommand.exitCodeFor(result, false)).isEqualTo(1);
        assertThat(GenerateTestsCommand.exitCodeFor(result, true)).isZero();
    }

    @Test
    void testToConfig() {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(
                "--models", "m1, m2 ,", "--quality-threshold", "low", "--regenerate-on-low-quality",
                "--max-regeneration-attempts", "4", "--request-timeout-seconds", "30", "--redact-sensitive");
        ValidatedGenerateOptions validated = new ValidatedGenerateOptions(
                tempDir, tempDir.resolve("src"), tempDir.resolve("tests"), "key");

        GeneratorConfig config = GenerateTestsCommand.toConfig(options, validated);

        assertThat(config.getModels()).containsExactly("m1", "m2");
        assertThat(config.getApiKey()).isEqualTo("key");
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getQualityThreshold()).isEqualTo(QualityTier.LOW);
        assertThat(config.isRedactSensitive()).isTrue();
        assertThat(config.getReportPath()).isEqualTo(tempDir.resolve("tests").resolve("compilation_report"));
        assertThat(config.toRegenerationSettings().getMaxAttempts()).isEqualTo(5);
        assertThat(config.toRetryPolicy().getMaxTries()).isEqualTo(3);
        assertThat(config.toRetryPolicy().getBaseDelayMillis()).isEqualTo(1000);
    }

    @Test
    void testInvalidOptionsExitWithOne() {
        GenerateTestsCommand command = new GenerateTestsCommand(new GenerateOptionsValidator(name -> null));

        int exitCode = new CommandLine(command).execute("--repo-path", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
