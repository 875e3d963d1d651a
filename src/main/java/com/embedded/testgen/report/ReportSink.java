package com.embedded.testgen.report;

import java.io.IOException;

import com.embedded.testgen.validation.ValidationReport;

/**
 * Receives the final validation report of each accepted file.
 */
public interface ReportSink {

    void accept(ValidationReport report) throws IOException;
}
