package com.embedded.testgen.validation;

import com.embedded.testgen.SampleSources;
import com.embedded.testgen.index.FileAnalysis;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StaticValidatorTest {

    private static final FileAnalysis SENSOR = FileAnalysis.builder()
            .filePath(Path.of("src", "sensor.c"))
            .sourceText(SampleSources.SENSOR_C)
            .include("adc.h")
            .build();

    @Test
    void testCleanTestIsHighQuality() {
        ValidationReport report = new StaticValidator().validate(SampleSources.SENSOR_TEST, SENSOR);

        assertThat(report.getSubjectFile()).isEqualTo("sensor.c");
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.isCompiles()).isTrue();
        assertThat(report.isRealistic()).isTrue();
        assertThat(report.getQuality()).isEqualTo(QualityTier.HIGH);
    }

    @Test
    void testMissingUnityIncludeIsLow() {
        ValidationReport report = new StaticValidator().validate(SampleSources.SENSOR_TEST_WITHOUT_UNITY, SENSOR);

        assertThat(report.isCompiles()).isFalse();
        assertThat(report.getIssues()).containsExactly("Missing required Unity include: #include \"unity.h\"");
        assertThat(report.getQuality()).isEqualTo(QualityTier.LOW);
    }

    @Test
    void testUnrealisticValueIsMedium() {
        String test = SampleSources.SENSOR_TEST.replace(
                "TEST_ASSERT_EQUAL_INT(0, scale_reading(0));",
                "float temperature = 130.0f;\n    TEST_ASSERT_EQUAL_INT(0, scale_reading(0));");

        ValidationReport report = new StaticValidator().validate(test, SENSOR);

        assertThat(report.isCompiles()).isTrue();
        assertThat(report.isRealistic()).isFalse();
        assertThat(report.getIssues()).hasSize(1);
        assertThat(report.getIssues().get(0)).startsWith("Temperature value 130.0");
        assertThat(report.getQuality()).isEqualTo(QualityTier.MEDIUM);
    }

    @Test
    void testIssuesFollowRegistrationOrder() {
        CheckRegistry registry = CheckRegistry.of(List.of(
                ValidationCheck.of("second", input -> CheckResult.issue("b")),
                ValidationCheck.of("first", input -> CheckResult.issue("a"))));

        ValidationReport report = new StaticValidator(registry).validate("", SENSOR);

        assertThat(report.getIssues()).containsExactly("b", "a");
        assertThat(report.getQuality()).isEqualTo(QualityTier.MEDIUM);
    }

    @Test
    void testFailingCheckBecomesIssueAndLowersTier() {
        CheckRegistry registry = CheckRegistry.of(List.of(
                ValidationCheck.of("explodes", input -> {
                    throw new IllegalStateException("bad regex state");
                }),
                ValidationCheck.of("after", input -> CheckResult.issue("still runs"))));

        ValidationReport report = new StaticValidator(registry).validate("void test_a(void) {}", SENSOR);

        assertThat(report.getIssues()).hasSize(2);
        assertThat(report.getIssues().get(0)).startsWith("Validation error: ").contains("explodes");
        assertThat(report.getIssues().get(1)).isEqualTo("still runs");
        assertThat(report.isCompiles()).isFalse();
        assertThat(report.getQuality()).isEqualTo(QualityTier.LOW);
    }

    @Test
    void testReportMeetsThreshold() {
        ValidationReport medium = ValidationReport.builder()
                .subjectFile("x.c").compiles(true).realistic(false).build();

        assertThat(medium.meets(QualityTier.LOW)).isTrue();
        assertThat(medium.meets(QualityTier.MEDIUM)).isTrue();
        assertThat(medium.meets(QualityTier.HIGH)).isFalse();
    }
}
