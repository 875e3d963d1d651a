package com.embedded.testgen.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CheckRegistryTest {

    @Test
    void testDuplicateNamesAreRejected() {
        List<ValidationCheck> checks = List.of(
                ValidationCheck.of("same", input -> CheckResult.passed()),
                ValidationCheck.of("same", input -> CheckResult.passed()));

        assertThatThrownBy(() -> CheckRegistry.of(checks))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate check name: same");
    }

    @Test
    void testDefaultsStartWithCompilationSafety() {
        CheckRegistry registry = CheckRegistry.defaults();

        assertThat(registry.names()).startsWith("unity-include", "formatting-markers");
        assertThat(registry.names()).endsWith("register-access-coverage");
        assertThat(registry.find("domain-range")).isPresent();
        assertThat(registry.find("nope")).isEmpty();
    }

    @Test
    void testChecksAreReadOnly() {
        CheckRegistry registry = CheckRegistry.of(List.of(ValidationCheck.of("a", input -> CheckResult.passed())));

        assertThatThrownBy(() -> registry.getChecks().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testCheckResultBuilder() {
        CheckResult result = CheckResult.builder().issue("x").realismIssue("y").build();

        assertThat(result.getIssues()).containsExactly("x", "y");
        assertThat(result.isUnrealistic()).isTrue();
        assertThat(result.isBreaksCompilation()).isFalse();
        assertThat(CheckResult.builder().build()).isSameAs(CheckResult.passed());
    }
}
