package com.embedded.testgen.context;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything one generation attempt needs to know about the file under test.
 */
@Value
@Builder(toBuilder = true)
public class GenerationContext {

    /** Source file name without extension, e.g. {@code sensor}. */
    @NonNull
    String sourceName;

    /** Source text as sent to the backend, redacted when redaction is enabled. */
    @NonNull
    String sourceText;

    /** Functions owned by other indexed files that the tests must stub, in call order. */
    @Singular("stub")
    List<String> needsStub;

    @Singular
    List<EmbeddedPattern> embeddedPatterns;

    @NonNull
    @Builder.Default
    FeedbackSection feedback = FeedbackSection.none();

    public String getTestFileName() {
        return "test_" + sourceName + ".c";
    }
}
