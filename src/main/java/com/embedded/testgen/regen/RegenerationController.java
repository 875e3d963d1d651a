package com.embedded.testgen.regen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.backend.GenerationService;
import com.embedded.testgen.context.ContextBuilder;
import com.embedded.testgen.context.FeedbackSection;
import com.embedded.testgen.context.GenerationContext;
import com.embedded.testgen.context.PromptRenderer;
import com.embedded.testgen.exception.ContextBuildException;
import com.embedded.testgen.exception.GenerationException;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.SymbolTable;
import com.embedded.testgen.normalize.OutputNormalizer;
import com.embedded.testgen.validation.StaticValidator;
import com.embedded.testgen.validation.ValidationReport;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Drives one file through generate, normalize, validate and decide until it is accepted
 * or generation fails. Issues of a rejected attempt become the next attempt's feedback.
 * <p>
 * Context and generation failures end the file; an interrupt propagates and ends the run.
 */
@RequiredArgsConstructor
public class RegenerationController {

    private static final Logger log = LoggerFactory.getLogger(RegenerationController.class);

    @NonNull
    private final ContextBuilder contextBuilder;
    @NonNull
    private final PromptRenderer promptRenderer;
    @NonNull
    private final GenerationService generationService;
    @NonNull
    private final OutputNormalizer normalizer;
    @NonNull
    private final StaticValidator validator;
    @NonNull
    @Getter
    private final RegenerationSettings settings;
    @NonNull
    @Getter
    private final RegenerationStats stats;

    public FileOutcome process(FileAnalysis analysis, SymbolTable symbols) {
        RegenerationState state = RegenerationState.INIT;
        FeedbackSection feedback = FeedbackSection.none();
        int attempt = 0;
        GenerationContext context = null;
        String raw = null;
        GenerationAttempt current = null;
        String failureReason = null;

        while (!state.isTerminal()) {
            switch (state) {
                case INIT, REGENERATING -> state = RegenerationStateMachine.next(state, null, attempt, settings);
                case GENERATING -> {
                    attempt++;
                    stats.recordAttempt();
                    log.debug("{}: attempt {}/{}", analysis.getFileName(), attempt, settings.getMaxAttempts());
                    try {
                        context = contextBuilder.build(analysis, symbols, feedback);
                        raw = generationService.generate(promptRenderer.render(context));
                        state = RegenerationStateMachine.next(state, null, attempt, settings);
                    } catch (ContextBuildException | GenerationException e) {
                        log.error("{}: attempt {} failed: {}", analysis.getFileName(), attempt, e.getMessage());
                        failureReason = e.getMessage();
                        state = RegenerationStateMachine.onGenerationFailure(state);
                    }
                }
                case VALIDATING -> {
                    String normalized = normalizer.normalize(raw, analysis);
                    ValidationReport report = validator.validate(normalized, analysis, symbols);
                    current = GenerationAttempt.builder()
                            .attemptIndex(attempt)
                            .context(context)
                            .rawOutput(raw)
                            .normalizedOutput(normalized)
                            .report(report)
                            .build();
                    log.debug("{}: attempt {} scored {} with {} issue(s)", analysis.getFileName(), attempt,
                            report.getQuality().getDisplayName(), report.getIssues().size());
                    state = RegenerationStateMachine.next(state, report, attempt, settings);
                }
                case DECIDING -> {
                    ValidationReport report = current.getReport();
                    state = RegenerationStateMachine.next(state, report, attempt, settings);
                    if (state == RegenerationState.REGENERATING) {
                        log.info("{}: {} quality below {}, regenerating (attempt {}/{})", analysis.getFileName(),
                                report.getQuality().getDisplayName(), settings.getThreshold().getDisplayName(),
                                attempt + 1, settings.getMaxAttempts());
                        feedback = FeedbackSection.fromIssues(report.getIssues());
                        stats.recordRegeneration();
                    } else if (attempt > 1 && report.meets(settings.getThreshold())) {
                        stats.recordSuccessfulRegeneration();
                    }
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }

        return FileOutcome.builder()
                .sourceFile(analysis.getFilePath())
                .finalState(state)
                .attempts(attempt)
                .finalAttempt(current)
                .failureReason(failureReason)
                .meetsThreshold(state == RegenerationState.ACCEPTED && current.getReport().meets(settings.getThreshold()))
                .build();
    }
}
