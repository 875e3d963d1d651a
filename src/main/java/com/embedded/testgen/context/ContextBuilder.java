package com.embedded.testgen.context;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.exception.ContextBuildException;
import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.SymbolTable;

/**
 * Assembles the per-attempt generation context from the file's facts, the run's symbol
 * table and the previous attempt's feedback. Has no side effects beyond logging.
 */
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    private final SourceRedactor redactor;

    public ContextBuilder() {
        this(null);
    }

    /**
     * @param redactor applied to the source text before it is placed in the context, or {@code null}
     */
    public ContextBuilder(SourceRedactor redactor) {
        this.redactor = redactor;
    }

    /**
     * @throws ContextBuildException when the file has no content to test
     */
    public GenerationContext build(FileAnalysis analysis, SymbolTable symbols, FeedbackSection feedback) {
        if (analysis.getSourceText().isBlank()) {
            throw new ContextBuildException("Source file " + analysis.getFilePath() + " is empty");
        }

        List<String> needsStub = needsStub(analysis, symbols);
        List<EmbeddedPattern> patterns = EmbeddedPattern.detect(analysis.getSourceText());
        log.debug("Context for {}: stubs={}, patterns={}, feedback issues={}",
                analysis.getFileName(), needsStub, patterns, feedback.getShownIssues().size());

        String text = redactor == null ? analysis.getSourceText() : redactor.redact(analysis.getSourceText());
        return GenerationContext.builder()
                .sourceName(analysis.getBaseName())
                .sourceText(text)
                .needsStub(needsStub)
                .embeddedPatterns(patterns)
                .feedback(feedback)
                .build();
    }

    /**
     * Called-but-undefined symbols owned by a different indexed file. Symbols the table does not
     * know are left to the linker.
     */
    public static List<String> needsStub(FileAnalysis analysis, SymbolTable symbols) {
        Path self = normalize(analysis.getFilePath());
        return analysis.getCalledButUndefinedSymbols().stream()
                .filter(name -> symbols.ownerOf(name)
                        .map(owner -> !normalize(owner).equals(self))
                        .orElse(false))
                .toList();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
