package com.embedded.testgen.backend;

import lombok.Builder;
import lombok.Value;

/**
 * Pure retry rule for one backend: a function of the try index and the call outcome.
 * <p>
 * Throttling before the last try waits {@code min(baseDelay * multiplier^tryIndex, maxDelay)} and
 * retries; throttling on the last try switches backend; any other failure is terminal.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    /** Tries against the current backend before falling back (R). */
    @Builder.Default
    int maxTries = 3;

    @Builder.Default
    long baseDelayMillis = 1000;

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    long maxDelayMillis = 30_000;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * @param tryIndex zero-based index of the try that produced {@code result}
     */
    public RetryDecision decide(int tryIndex, CallResult result) {
        if (result.isSuccess()) {
            return RetryDecision.succeed(result.getText());
        }
        if (result.getFailureKind() != FailureKind.THROTTLING) {
            String message = result.getError() == null ? "unknown error" : result.getError().getMessage();
            return RetryDecision.terminal("Non-retryable backend failure: " + message);
        }
        if (tryIndex + 1 < maxTries) {
            return RetryDecision.retrySameBackend(delayFor(tryIndex));
        }
        return RetryDecision.switchBackend();
    }

    public long delayFor(int tryIndex) {
        double delay = baseDelayMillis * Math.pow(multiplier, tryIndex);
        return (long) Math.min(delay, maxDelayMillis);
    }
}
