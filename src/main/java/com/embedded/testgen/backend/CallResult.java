package com.embedded.testgen.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a single backend call, as seen by the retry policy.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallResult {

    String text;
    FailureKind failureKind;
    BackendCallException error;

    public static CallResult success(String text) {
        return new CallResult(text, null, null);
    }

    public static CallResult failure(FailureKind kind, BackendCallException error) {
        return new CallResult(null, kind, error);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }
}
