package com.embedded.testgen.validation;

import java.util.function.Function;

/**
 * One named, stateless validation rule.
 */
public interface ValidationCheck {

    /**
     * Stable identifier used in logs and when a check fails internally.
     */
    String name();

    CheckResult apply(CheckInput input);

    /**
     * Wraps a lambda as a named check.
     */
    static ValidationCheck of(String name, Function<CheckInput, CheckResult> rule) {
        return new ValidationCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CheckResult apply(CheckInput input) {
                return rule.apply(input);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
