package com.embedded.testgen.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.exception.ValidationCheckException;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.SymbolTable;

import lombok.RequiredArgsConstructor;

/**
 * Runs every registered check against a normalized test file and folds the results into one report.
 * A check that throws is recorded as a single issue and marks the file as not compiling, which
 * forces the tier to LOW without stopping the remaining checks.
 */
@RequiredArgsConstructor
public class StaticValidator {

    private static final Logger log = LoggerFactory.getLogger(StaticValidator.class);

    private final CheckRegistry registry;

    public StaticValidator() {
        this(CheckRegistry.defaults());
    }

    public ValidationReport validate(String testCode, FileAnalysis source, SymbolTable symbols) {
        CheckInput input = new CheckInput(testCode, source, symbols);
        ValidationReport.ValidationReportBuilder report = ValidationReport.builder()
                .subjectFile(source.getFileName());
        boolean compiles = true;
        boolean realistic = true;

        for (ValidationCheck check : registry.getChecks()) {
            CheckResult result;
            try {
                result = check.apply(input);
            } catch (RuntimeException e) {
                ValidationCheckException failure = new ValidationCheckException(check.name(), e);
                log.warn("{} ({})", failure.getMessage(), source.getFileName(), e);
                report.issue("Validation error: " + failure.getMessage());
                compiles = false;
                continue;
            }
            if (!result.isPassed()) {
                log.debug("Check {} on {}: {}", check.name(), source.getFileName(), result.getIssues());
            }
            report.issues(result.getIssues());
            compiles &= !result.isBreaksCompilation();
            realistic &= !result.isUnrealistic();
        }

        return report.compiles(compiles).realistic(realistic).build();
    }

    public ValidationReport validate(String testCode, FileAnalysis source) {
        return validate(testCode, source, SymbolTable.empty());
    }
}
