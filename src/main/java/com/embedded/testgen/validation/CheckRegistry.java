package com.embedded.testgen.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.embedded.testgen.validation.checks.CompilationSafetyChecks;
import com.embedded.testgen.validation.checks.DomainFeatureChecks;
import com.embedded.testgen.validation.checks.LogicalConsistencyChecks;
import com.embedded.testgen.validation.checks.QualityHeuristicChecks;
import com.embedded.testgen.validation.checks.RealityChecks;

/**
 * Ordered set of uniquely named checks. Checks run in registration order, so issue order is stable.
 */
public final class CheckRegistry {

    private final List<ValidationCheck> checks;

    private CheckRegistry(List<ValidationCheck> checks) {
        Set<String> names = new HashSet<>();
        for (ValidationCheck check : checks) {
            if (!names.add(check.name())) {
                throw new IllegalArgumentException("Duplicate check name: " + check.name());
            }
        }
        this.checks = List.copyOf(checks);
    }

    public static CheckRegistry of(List<ValidationCheck> checks) {
        return new CheckRegistry(checks);
    }

    /**
     * Compilation safety, reality, quality heuristics, logical consistency, then domain-feature coverage.
     */
    public static CheckRegistry defaults() {
        List<ValidationCheck> all = new ArrayList<>();
        all.addAll(CompilationSafetyChecks.all());
        all.addAll(RealityChecks.all());
        all.addAll(QualityHeuristicChecks.all());
        all.addAll(LogicalConsistencyChecks.all());
        all.addAll(DomainFeatureChecks.all());
        return new CheckRegistry(all);
    }

    public List<ValidationCheck> getChecks() {
        return checks;
    }

    public List<String> names() {
        return checks.stream().map(ValidationCheck::name).toList();
    }

    public Optional<ValidationCheck> find(String name) {
        return checks.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
