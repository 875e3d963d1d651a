package com.embedded.testgen.normalize;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.exception.NormalizationException;
import com.embedded.testgen.index.FileAnalysis;

/**
 * Turns raw backend output into a self-contained Unity test candidate.
 * <p>
 * The transform is deterministic and idempotent. If any step fails the raw text is returned
 * unchanged, and the validator reports whatever is wrong with it.
 */
public class OutputNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OutputNormalizer.class);

    private final List<NormalizationStep> steps;

    public OutputNormalizer() {
        this(NormalizationSteps.all());
    }

    public OutputNormalizer(List<NormalizationStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public String normalize(String raw, FileAnalysis source) {
        String text = raw;
        for (NormalizationStep step : steps) {
            try {
                text = step.apply(text, source);
            } catch (RuntimeException e) {
                NormalizationException failure = new NormalizationException(step.name(), e);
                log.warn("{} for {}; keeping generated text as-is", failure.getMessage(), source.getFileName(), failure);
                return raw;
            }
        }
        return text;
    }

    public List<NormalizationStep> getSteps() {
        return steps;
    }
}
