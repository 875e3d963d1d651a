package com.embedded.testgen.report;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.util.FileWriteUtil;
import com.embedded.testgen.validation.ValidationReport;

/**
 * Writes one plain-text report per file, named {@code test_<name>_compiles_yes.txt}
 * or {@code test_<name>_compiles_no.txt}.
 */
public class TextReportWriter implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(TextReportWriter.class);

    private final Path reportDir;

    public TextReportWriter(Path reportDir) {
        this.reportDir = reportDir;
    }

    @Override
    public void accept(ValidationReport report) throws IOException {
        Path target = reportDir.resolve(fileNameFor(report));
        FileWriteUtil.safeWriteString(target, format(report));
        log.debug("Wrote validation report {}", target);
    }

    public Path getReportDir() {
        return reportDir;
    }

    static String fileNameFor(ValidationReport report) {
        return testBaseName(report.getSubjectFile()) + (report.isCompiles() ? "_compiles_yes" : "_compiles_no") + ".txt";
    }

    static String format(ValidationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation Report for ").append(testBaseName(report.getSubjectFile())).append(".c\n");
        sb.append("Quality: ").append(report.getQuality().getDisplayName()).append('\n');
        sb.append("Compiles: ").append(report.isCompiles()).append('\n');
        sb.append("Realistic: ").append(report.isRealistic()).append('\n');
        sb.append("Issues: ").append(report.getIssues().size()).append('\n');
        sb.append("\nIssues:\n");
        for (String issue : report.getIssues()) {
            sb.append("- ").append(issue).append('\n');
        }
        return sb.toString();
    }

    private static String testBaseName(String subjectFile) {
        int dot = subjectFile.lastIndexOf('.');
        String base = dot > 0 ? subjectFile.substring(0, dot) : subjectFile;
        return UnityConventions.TEST_PREFIX + base;
    }
}
