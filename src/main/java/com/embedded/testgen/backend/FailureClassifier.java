package com.embedded.testgen.backend;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a backend failure is throttling by looking at its status code and at the
 * messages along its cause chain.
 */
public class FailureClassifier {

    public static final List<String> DEFAULT_SIGNALS = List.of(
            "rate limit", "quota", "limit exceeded", "resource exhausted", "resource_exhausted",
            "429", "too many requests", "overloaded");

    private static final Set<Integer> THROTTLING_STATUS = Set.of(429, 503);

    private final List<String> signals;

    public FailureClassifier() {
        this(DEFAULT_SIGNALS);
    }

    public FailureClassifier(List<String> signals) {
        this.signals = signals.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    public FailureKind classify(BackendCallException failure) {
        if (failure.getStatusCode().isPresent() && THROTTLING_STATUS.contains(failure.getStatusCode().getAsInt())) {
            return FailureKind.THROTTLING;
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t.getMessage() != null && matchesSignal(t.getMessage())) {
                return FailureKind.THROTTLING;
            }
        }
        return FailureKind.OTHER;
    }

    private boolean matchesSignal(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return signals.stream().anyMatch(lower::contains);
    }
}
