package com.embedded.testgen.report;

import com.embedded.testgen.validation.ValidationReport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class TextReportWriterTest {

    @TempDir
    Path tempDir;

    private static final ValidationReport BROKEN = ValidationReport.builder()
            .subjectFile("sensor.c")
            .compiles(false)
            .realistic(true)
            .issue("Missing required Unity include: #include \"unity.h\"")
            .issue("Missing edge case tests (min/max/zero/negative/boundary values)")
            .build();

    @Test
    void testFileNameReflectsCompilation() {
        assertThat(TextReportWriter.fileNameFor(BROKEN)).isEqualTo("test_sensor_compiles_no.txt");
        assertThat(TextReportWriter.fileNameFor(BROKEN.toBuilder().compiles(true).build()))
                .isEqualTo("test_sensor_compiles_yes.txt");
    }

    @Test
    void testFormat() {
        assertThat(TextReportWriter.format(BROKEN)).isEqualTo("""
                Validation Report for test_sensor.c
                Quality: Low
                Compiles: false
                Realistic: true
                Issues: 2

                Issues:
                - Missing required Unity include: #include "unity.h"
                - Missing edge case tests (min/max/zero/negative/boundary values)
                """);
    }

    @Test
    void testWritesReportIntoDirectory() throws IOException {
        Path reportDir = tempDir.resolve("tests").resolve("compilation_report");
        TextReportWriter writer = new TextReportWriter(reportDir);

        writer.accept(BROKEN);

        Path written = reportDir.resolve("test_sensor_compiles_no.txt");
        assertThat(Files.exists(written)).isTrue();
        assertThat(Files.readString(written)).startsWith("Validation Report for test_sensor.c\nQuality: Low\n");
    }
}
