package com.embedded.testgen.context;

import com.embedded.testgen.SampleSources;
import com.embedded.testgen.exception.ContextBuildException;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.FunctionSignature;
import com.embedded.testgen.index.SymbolTable;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContextBuilderTest {

    private static final Path SENSOR = Path.of("src", "sensor.c");
    private static final Path ADC = Path.of("src", "adc.c");

    private static FunctionSignature function(String name) {
        return FunctionSignature.builder().name(name).returnType("int").signature("int " + name + "(int x)").build();
    }

    private static FileAnalysis sensorAnalysis() {
        return FileAnalysis.builder()
                .filePath(SENSOR)
                .sourceText(SampleSources.SENSOR_C)
                .function(function("scale_reading"))
                .function(function("sensor_read_scaled"))
                .calledButUndefined("adc_read")
                .calledButUndefined("printf")
                .include("adc.h")
                .build();
    }

    private static SymbolTable symbols() {
        return SymbolTable.builder()
                .define(function("adc_read"), ADC)
                .define(function("scale_reading"), SENSOR)
                .define(function("sensor_read_scaled"), SENSOR)
                .build();
    }

    @Test
    void testStubsOnlyFunctionsOwnedByOtherFiles() {
        GenerationContext context = new ContextBuilder().build(sensorAnalysis(), symbols(), FeedbackSection.none());

        assertThat(context.getNeedsStub()).containsExactly("adc_read");
        assertThat(context.getSourceName()).isEqualTo("sensor");
        assertThat(context.getTestFileName()).isEqualTo("test_sensor.c");
        assertThat(context.getSourceText()).isEqualTo(SampleSources.SENSOR_C);
        assertThat(context.getFeedback().isFirstAttempt()).isTrue();
    }

    @Test
    void testSymbolOwnedBySameFileIsNotStubbed() {
        FileAnalysis analysis = sensorAnalysis().toBuilder().calledButUndefined("local_helper").build();
        SymbolTable table = SymbolTable.builder()
                .define(function("adc_read"), ADC)
                .define(function("local_helper"), SENSOR.toAbsolutePath())
                .build();

        assertThat(ContextBuilder.needsStub(analysis, table)).containsExactly("adc_read");
    }

    @Test
    void testEmptySymbolTableNeedsNoStubs() {
        assertThat(ContextBuilder.needsStub(sensorAnalysis(), SymbolTable.empty())).isEmpty();
    }

    @Test
    void testBlankSourceIsRejected() {
        FileAnalysis blank = FileAnalysis.builder().filePath(Path.of("src", "empty.c")).sourceText("  \n").build();

        assertThatThrownBy(() -> new ContextBuilder().build(blank, symbols(), FeedbackSection.none()))
                .isInstanceOf(ContextBuildException.class)
                .hasMessageContaining("empty.c");
    }

    @Test
    void testFeedbackIsCarried() {
        FeedbackSection feedback = FeedbackSection.fromIssues(List.of("Missing required Unity include"));

        GenerationContext context = new ContextBuilder().build(sensorAnalysis(), symbols(), feedback);

        assertThat(context.getFeedback()).isSameAs(feedback);
    }

    @Test
    void testRedactorIsApplied() {
        FileAnalysis analysis = sensorAnalysis().toBuilder()
                .sourceText("// owner: dev@example.com\nint scale_reading(int raw) { return raw; }\n")
                .build();

        GenerationContext context = new ContextBuilder(new SourceRedactor())
                .build(analysis, symbols(), FeedbackSection.none());

        assertThat(context.getSourceText())
                .doesNotContain("dev@example.com")
                .contains(SourceRedactor.COMMENT_LINE)
                .contains("int scale_reading(int raw)");
    }

    @Test
    void testEmbeddedPatternsAreDetected() {
        FileAnalysis analysis = sensorAnalysis().toBuilder()
                .sourceText("void UART_ISR(void) { rx_count++; }\n")
                .build();

        GenerationContext context = new ContextBuilder().build(analysis, symbols(), FeedbackSection.none());

        assertThat(context.getEmbeddedPatterns())
                .contains(EmbeddedPattern.INTERRUPT_HANDLERS, EmbeddedPattern.COMMUNICATION_PROTOCOLS);
    }
}
