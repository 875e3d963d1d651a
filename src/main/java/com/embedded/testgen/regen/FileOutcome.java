package com.embedded.testgen.regen;

import java.nio.file.Path;
import java.util.Optional;

import com.embedded.testgen.validation.ValidationReport;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Final result of processing one source file.
 */
@Value
@Builder
public class FileOutcome {

    @NonNull
    Path sourceFile;

    @NonNull
    RegenerationState finalState;

    int attempts;

    /** Last completed attempt; absent when the first attempt never produced output. */
    GenerationAttempt finalAttempt;

    String failureReason;

    boolean meetsThreshold;

    public boolean isAccepted() {
        return finalState == RegenerationState.ACCEPTED;
    }

    public Optional<GenerationAttempt> getFinalAttempt() {
        return Optional.ofNullable(finalAttempt);
    }

    public Optional<ValidationReport> getReport() {
        return getFinalAttempt().map(GenerationAttempt::getReport);
    }

    public Optional<String> getTestCode() {
        return isAccepted() ? getFinalAttempt().map(GenerationAttempt::getNormalizedOutput) : Optional.empty();
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }
}
