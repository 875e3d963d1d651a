package com.embedded.testgen.validation;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Issues raised by one check and the flags it downgrades.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckResult {

    private static final CheckResult PASSED = new CheckResult(List.of(), false, false);

    List<String> issues;
    boolean breaksCompilation;
    boolean unrealistic;

    public static CheckResult passed() {
        return PASSED;
    }

    public static CheckResult issue(String issue) {
        return new CheckResult(List.of(issue), false, false);
    }

    public static CheckResult compileIssue(String issue) {
        return new CheckResult(List.of(issue), true, false);
    }

    public static CheckResult realismIssue(String issue) {
        return new CheckResult(List.of(issue), false, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPassed() {
        return issues.isEmpty() && !breaksCompilation && !unrealistic;
    }

    /**
     * Accumulates several issues from one check.
     */
    public static final class Builder {
        private final List<String> issues = new ArrayList<>();
        private boolean breaksCompilation;
        private boolean unrealistic;

        private Builder() {
        }

        public Builder issue(String issue) {
            issues.add(issue);
            return this;
        }

        public Builder compileIssue(String issue) {
            breaksCompilation = true;
            return issue(issue);
        }

        public Builder realismIssue(String issue) {
            unrealistic = true;
            return issue(issue);
        }

        public CheckResult build() {
            return issues.isEmpty() && !breaksCompilation && !unrealistic
                    ? PASSED
                    : new CheckResult(List.copyOf(issues), breaksCompilation, unrealistic);
        }
    }
}
