package com.embedded.testgen.regen;

import com.embedded.testgen.SampleSources;
import com.embedded.testgen.backend.BackendCallException;
import com.embedded.testgen.backend.FailureClassifier;
import com.embedded.testgen.backend.GenerationBackend;
import com.embedded.testgen.backend.GenerationService;
import com.embedded.testgen.backend.RetryPolicy;
import com.embedded.testgen.backend.ScriptedBackend;
import com.embedded.testgen.context.ContextBuilder;
import com.embedded.testgen.context.PromptRenderer;
import com.embedded.testgen.exception.GenerationInterruptedException;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.FunctionSignature;
import com.embedded.testgen.index.SymbolTable;
import com.embedded.testgen.normalize.OutputNormalizer;
import com.embedded.testgen.validation.QualityTier;
import com.embedded.testgen.validation.StaticValidator;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RegenerationControllerTest {

    private static final Path SENSOR_PATH = Path.of("src", "sensor.c");

    private static final FileAnalysis SENSOR = FileAnalysis.builder()
            .filePath(SENSOR_PATH)
            .sourceText(SampleSources.SENSOR_C)
            .function(signature("scale_reading"))
            .function(signature("sensor_read_scaled"))
            .calledButUndefined("adc_read")
            .include("adc.h")
            .build();

    private static final SymbolTable SYMBOLS = SymbolTable.builder()
            .define(signature("adc_read"), Path.of("src", "adc.c"))
            .define(signature("scale_reading"), SENSOR_PATH)
            .define(signature("sensor_read_scaled"), SENSOR_PATH)
            .build();

    private final RegenerationStats stats = new RegenerationStats();

    private static FunctionSignature signature(String name) {
        return FunctionSignature.builder().name(name).returnType("int").signature("int " + name + "(int x)").build();
    }

    private RegenerationController controller(GenerationBackend backend, RegenerationSettings settings) {
        GenerationService service = new GenerationService(List.of(backend), RetryPolicy.defaults(),
                new FailureClassifier(), millis -> { });
        return new RegenerationController(new ContextBuilder(), new PromptRenderer(), service,
                new OutputNormalizer(), new StaticValidator(), settings, stats);
    }

    @Test
    void testFirstAttemptAccepted() {
        ScriptedBackend backend = new ScriptedBackend("model").answer(SampleSources.SENSOR_TEST);

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.isMeetsThreshold()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getTestCode()).contains(SampleSources.SENSOR_TEST);
        assertThat(backend.getPrompts().get(0)).contains("- adc_read\n").contains("NONE - First generation attempt");
        assertThat(stats.getAttemptsIssued()).isEqualTo(1);
        assertThat(stats.getRegenerations()).isZero();
    }

    @Test
    void testRegeneratesWithFeedbackUntilThresholdMet() {
        ScriptedBackend backend = new ScriptedBackend("model")
                .answer(SampleSources.SENSOR_TEST_WITHOUT_UNITY)
                .answer(SampleSources.SENSOR_TEST);

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.getFinalState()).isEqualTo(RegenerationState.ACCEPTED);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        assertThat(outcome.getReport().orElseThrow().getQuality()).isEqualTo(QualityTier.HIGH);
        assertThat(outcome.getFinalAttempt().orElseThrow().getAttemptIndex()).isEqualTo(2);
        assertThat(backend.getPrompts()).hasSize(2);
        assertThat(backend.getPrompts().get(1))
                .contains("PREVIOUS ATTEMPT FAILED WITH THESE SPECIFIC ISSUES - FIX THEM:")
                .contains("Missing required Unity include");
        assertThat(stats.getAttemptsIssued()).isEqualTo(2);
        assertThat(stats.getRegenerations()).isEqualTo(1);
        assertThat(stats.getSuccessfulRegenerations()).isEqualTo(1);
        assertThat(stats.getSuccessRate()).isEqualTo(100.0);
    }

    @Test
    void testAttemptsAreBounded() {
        ScriptedBackend backend = new ScriptedBackend("model").answer(SampleSources.SENSOR_TEST_WITHOUT_UNITY);

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.isMeetsThreshold()).isFalse();
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(backend.getCalls()).isEqualTo(3);
        assertThat(outcome.getTestCode()).isPresent();
        assertThat(stats.getRegenerations()).isEqualTo(2);
        assertThat(stats.getSuccessfulRegenerations()).isZero();
        assertThat(stats.getSuccessRate()).isZero();
    }

    @Test
    void testRegenerationDisabledKeepsFirstAttempt() {
        ScriptedBackend backend = new ScriptedBackend("model").answer(SampleSources.SENSOR_TEST_WITHOUT_UNITY);

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, false))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.isMeetsThreshold()).isFalse();
        assertThat(backend.getCalls()).isEqualTo(1);
        assertThat(outcome.getReport().orElseThrow().getQuality()).isEqualTo(QualityTier.LOW);
    }

    @Test
    void testLowerThresholdAcceptsMediumQuality() {
        String medium = SampleSources.SENSOR_TEST.replace(
                "TEST_ASSERT_EQUAL_INT(0, scale_reading(0));",
                "float temperature = 130.0f;\n    TEST_ASSERT_EQUAL_INT(0, scale_reading(0));");
        ScriptedBackend backend = new ScriptedBackend("model").answer(medium);

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.MEDIUM, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.isMeetsThreshold()).isTrue();
        assertThat(backend.getCalls()).isEqualTo(1);
    }

    @Test
    void testGenerationFailureExhaustsFile() {
        ScriptedBackend backend = new ScriptedBackend("model")
                .fail(new BackendCallException("model returned HTTP 403: permission denied", 403, null));

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.getFinalState()).isEqualTo(RegenerationState.EXHAUSTED);
        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.getFinalAttempt()).isEmpty();
        assertThat(outcome.getTestCode()).isEmpty();
        assertThat(outcome.getFailureReason().orElseThrow()).contains("permission denied");
        assertThat(stats.getAttemptsIssued()).isEqualTo(1);
    }

    @Test
    void testFailureAfterRegenerationKeepsPreviousAttempt() {
        ScriptedBackend backend = new ScriptedBackend("model")
                .answer(SampleSources.SENSOR_TEST_WITHOUT_UNITY)
                .fail(new BackendCallException("model returned HTTP 400: bad request", 400, null));

        FileOutcome outcome = controller(backend, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS);

        assertThat(outcome.getFinalState()).isEqualTo(RegenerationState.EXHAUSTED);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        assertThat(outcome.getFinalAttempt().orElseThrow().getAttemptIndex()).isEqualTo(1);
        assertThat(outcome.getTestCode()).isEmpty();
    }

    @Test
    void testInterruptPropagates() {
        GenerationBackend interrupted = new GenerationBackend() {
            @Override
            public String getName() {
                return "model";
            }

            @Override
            public String generate(String prompt) {
                throw new GenerationInterruptedException("Interrupted while waiting for model", new InterruptedException());
            }
        };

        assertThatThrownBy(() -> controller(interrupted, RegenerationSettings.of(2, QualityTier.HIGH, true))
                .process(SENSOR, SYMBOLS))
                .isInstanceOf(GenerationInterruptedException.class);
    }
}
