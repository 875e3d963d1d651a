package com.embedded.testgen.context;

import com.embedded.testgen.SampleSources;
import com.embedded.testgen.exception.ContextBuildException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer();

    private static GenerationContext.GenerationContextBuilder sensorContext() {
        return GenerationContext.builder()
                .sourceName("sensor")
                .sourceText(SampleSources.SENSOR_C);
    }

    @Test
    void testFirstAttemptPrompt() {
        String prompt = renderer.render(sensorContext().stub("adc_read").build());

        assertThat(prompt)
                .contains("/* ==== BEGIN src/sensor.c ==== */\n" + SampleSources.SENSOR_C)
                .contains("- adc_read\n")
                .contains("Start with /* test_sensor.c - Auto-generated Unity Tests */")
                .contains("VALIDATION FEEDBACK (ADDRESS THESE ISSUES):\nNONE - First generation attempt")
                .doesNotContain("EMBEDDED CONCEPTS")
                .endsWith("Generate ONLY the complete test_sensor.c C code now.\n");
    }

    @Test
    void testNoStubs() {
        String prompt = renderer.render(sensorContext().build());

        assertThat(prompt).contains("EXTERNAL FUNCTIONS TO STUB").contains("\n- None\n");
    }

    @Test
    void testFeedbackAndHints() {
        GenerationContext context = sensorContext()
                .embeddedPattern(EmbeddedPattern.STATE_MACHINES)
                .feedback(FeedbackSection.fromIssues(List.of("Missing required Unity include")))
                .build();

        String prompt = renderer.render(context);

        assertThat(prompt)
                .contains("EMBEDDED CONCEPTS IN THIS FILE\nState machines:\n- Test valid state transitions")
                .contains("PREVIOUS ATTEMPT FAILED WITH THESE SPECIFIC ISSUES - FIX THEM:\n- Missing required Unity include");
    }

    @Test
    void testSourceWithTemplateSyntaxIsNotInterpreted() {
        String source = "const char *fmt = \"${value}\";\nint f(void) { return 0; }\n";

        String prompt = renderer.render(sensorContext().sourceText(source).build());

        assertThat(prompt).contains(source);
    }

    @Test
    void testMissingTemplate() {
        PromptRenderer broken = new PromptRenderer("missing.ftl");

        assertThatThrownBy(() -> broken.render(sensorContext().build()))
                .isInstanceOf(ContextBuildException.class)
                .hasMessageContaining("missing.ftl");
    }
}
