package com.embedded.testgen.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What the adapter does after one call. Only the fields relevant to {@link #getAction()} are set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryDecision {

    public enum Action {
        SUCCEED,
        RETRY_SAME_BACKEND,
        SWITCH_BACKEND,
        TERMINAL
    }

    Action action;
    String text;
    long delayMillis;
    String reason;

    public static RetryDecision succeed(String text) {
        return new RetryDecision(Action.SUCCEED, text, 0, null);
    }

    public static RetryDecision retrySameBackend(long delayMillis) {
        return new RetryDecision(Action.RETRY_SAME_BACKEND, null, delayMillis, null);
    }

    public static RetryDecision switchBackend() {
        return new RetryDecision(Action.SWITCH_BACKEND, null, 0, null);
    }

    public static RetryDecision terminal(String reason) {
        return new RetryDecision(Action.TERMINAL, null, 0, reason);
    }
}
