package com.embedded.testgen.runner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.backend.GeminiBackend;
import com.embedded.testgen.backend.GenerationBackend;
import com.embedded.testgen.backend.FailureClassifier;
import com.embedded.testgen.backend.GenerationService;
import com.embedded.testgen.backend.Sleeper;
import com.embedded.testgen.config.GeneratorConfig;
import com.embedded.testgen.context.ContextBuilder;
import com.embedded.testgen.context.PromptRenderer;
import com.embedded.testgen.context.SourceRedactor;
import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.exception.GenerationInterruptedException;
import com.embedded.testgen.index.DependencyIndexer;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.RegexDependencyIndexer;
import com.embedded.testgen.index.SymbolTable;
import com.embedded.testgen.normalize.OutputNormalizer;
import com.embedded.testgen.regen.FileOutcome;
import com.embedded.testgen.regen.RegenerationController;
import com.embedded.testgen.regen.RegenerationStats;
import com.embedded.testgen.report.ReportSink;
import com.embedded.testgen.report.TextReportWriter;
import com.embedded.testgen.util.FileWriteUtil;
import com.embedded.testgen.validation.StaticValidator;
import com.embedded.testgen.validation.ValidationReport;

/**
 * Generates Unity tests for every C file of a source tree, one file at a time.
 */
public class TestGenerationRunner {

    private static final Logger log = LoggerFactory.getLogger(TestGenerationRunner.class);

    /** Application entry points are not unit tested. */
    public static final String SKIPPED_FILE = "main.c";

    private final GeneratorConfig config;
    private final DependencyIndexer indexer;
    private final RegenerationController controller;
    private final ReportSink reportSink;

    public TestGenerationRunner(GeneratorConfig config) {
        this(config, new RegexDependencyIndexer(), GeminiBackend.forModels(config.getModels(), config.getApiKey(),
                config.getBaseUrl(), config.getRequestTimeout()), Sleeper.THREAD);
    }

    public TestGenerationRunner(GeneratorConfig config, DependencyIndexer indexer, List<GenerationBackend> backends,
            Sleeper sleeper) {
        this.config = config;
        this.indexer = indexer;
        this.controller = new RegenerationController(
                new ContextBuilder(config.isRedactSensitive() ? new SourceRedactor() : null),
                new PromptRenderer(),
                new GenerationService(backends, config.toRetryPolicy(), new FailureClassifier(), sleeper),
                new OutputNormalizer(),
                new StaticValidator(),
                config.toRegenerationSettings(),
                new RegenerationStats());
        this.reportSink = new TextReportWriter(config.getReportPath());
    }

    public GeneratorResult run() {
        try {
            log.info("Starting test generation...");

            // Step 1: Index sources
            log.info("Step 1: Indexing C sources in {}...", config.getSourcePath());
            List<Path> sourceFiles = indexer.listSourceFiles(config.getSourcePath());
            if (sourceFiles.isEmpty()) {
                return GeneratorResult.failure("No C files found in " + config.getSourcePath());
            }
            SymbolTable symbols = indexer.buildSymbolTable(sourceFiles);
            log.info("Indexed {} function(s) from {} file(s)", symbols.size(), sourceFiles.size());
            if (!symbols.getAmbiguousNames().isEmpty()) {
                log.warn("Functions defined in more than one file (last indexed wins): {}", symbols.getAmbiguousNames());
            }

            List<Path> targets = sourceFiles.stream()
                    .filter(p -> !SKIPPED_FILE.equals(p.getFileName().toString()))
                    .toList();
            if (targets.size() < sourceFiles.size()) {
                log.debug("Skipping {} (application entry point)", SKIPPED_FILE);
            }

            // Step 2: Prepare output
            log.info("Step 2: Preparing output directory {}...", config.getOutputPath());
            FileWriteUtil.recreateDirectory(config.getReportPath());

            // Step 3: Generate
            log.info("Step 3: Generating tests for {} file(s)...", targets.size());
            GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                    .outputPath(config.getOutputPath())
                    .reportPath(config.getReportPath())
                    .filesDiscovered(sourceFiles.size())
                    .filesProcessed(targets.size());
            int accepted = 0;
            for (Path file : targets) {
                if (processFile(file, symbols, result)) {
                    accepted++;
                }
            }

            RegenerationStats stats = controller.getStats();
            log.info("Test generation complete!");
            return result
                    .success(true)
                    .accepted(accepted)
                    .attemptsIssued(stats.getAttemptsIssued())
                    .regenerations(stats.getRegenerations())
                    .successfulRegenerations(stats.getSuccessfulRegenerations())
                    .regenerationSuccessRate(stats.getSuccessRate())
                    .build();

        } catch (GenerationInterruptedException e) {
            log.error("Interrupted: {}", e.getMessage());
            return GeneratorResult.failure("Interrupted: " + e.getMessage());
        } catch (IOException e) {
            log.error("Test generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Failures stay with {@code file}; only an interrupt ends the run.
     *
     * @return whether a test file was written for {@code file}
     */
    private boolean processFile(Path file, SymbolTable symbols, GeneratorResult.GeneratorResultBuilder result) {
        String name = file.getFileName().toString();
        log.info("Processing: {}", displayPath(file));
        try {
            return generateFor(file, symbols, result);
        } catch (GenerationInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[FAIL] {}: unexpected error", name, e);
            result.failedFile(name);
            return false;
        }
    }

    private boolean generateFor(Path file, SymbolTable symbols, GeneratorResult.GeneratorResultBuilder result) {
        String name = file.getFileName().toString();
        FileAnalysis analysis;
        try {
            analysis = indexer.analyzeFileDependencies(file);
        } catch (IOException e) {
            log.error("[FAIL] {}: cannot read source: {}", name, e.getMessage());
            result.failedFile(name);
            return false;
        }

        FileOutcome outcome = controller.process(analysis, symbols);
        if (!outcome.isAccepted()) {
            log.error("[FAIL] {}: {}", name, outcome.getFailureReason().orElse("no acceptable test produced"));
            result.failedFile(name);
            return false;
        }

        ValidationReport report = outcome.getReport().orElseThrow();
        Path testFile = config.getOutputPath().resolve(UnityConventions.TEST_PREFIX + analysis.getBaseName() + ".c");
        try {
            FileWriteUtil.safeWriteString(testFile, outcome.getTestCode().orElseThrow());
            reportSink.accept(report);
        } catch (IOException e) {
            log.error("[FAIL] {}: cannot write {}: {}", name, testFile, e.getMessage());
            result.failedFile(name);
            return false;
        }

        logStatus(name, outcome, report);
        if (!outcome.isMeetsThreshold()) {
            result.belowThresholdFile(name);
        }
        return true;
    }

    private Path displayPath(Path file) {
        Path repo = config.getRepoPath().toAbsolutePath().normalize();
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(repo) ? repo.relativize(absolute) : absolute;
    }

    private void logStatus(String name, FileOutcome outcome, ValidationReport report) {
        String status = report.isCompiles() && report.isRealistic() ? "[OK]" : "[WARN]";
        String regenerated = outcome.getAttempts() > 1 ? " - regenerated" : "";
        log.info("{} {}: {} quality ({}, {}), {} issue(s){}", status, name,
                report.getQuality().getDisplayName(),
                report.isCompiles() ? "Compiles" : "Broken",
                report.isRealistic() ? "Realistic" : "Unrealistic",
                report.getIssues().size(), regenerated);
        report.getIssues().stream().limit(3).forEach(issue -> log.debug("    - {}", issue));
    }
}
