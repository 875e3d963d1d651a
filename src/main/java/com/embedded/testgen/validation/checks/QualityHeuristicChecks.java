package com.embedded.testgen.validation.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.index.CFunctionDefinition;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.validation.CheckInput;
import com.embedded.testgen.validation.CheckResult;
import com.embedded.testgen.validation.ValidationCheck;

import lombok.experimental.UtilityClass;

/**
 * Structural expectations of a useful test suite.
 */
@UtilityClass
public class QualityHeuristicChecks {

    private static final List<String> EDGE_CASE_WORDS = List.of(
            "min", "max", "zero", "negative", "boundary", "edge", "limit");

    /** File-scope {@code static} variables holding stub or global state. */
    private static final Pattern STUB_STATE = Pattern.compile(
            "(?m)^\\s*static\\s+(?!const\\b)[\\w\\s*]*?\\b((?:g|stub)_\\w*)\\s*(?:\\[[^\\]]*\\])?\\s*(?:=[^;]*)?;");

    private static final Pattern RESET_CALL = Pattern.compile("(?i)\\b(?:memset|\\w*reset\\w*)\\s*\\(");
    private static final Pattern ZERO_ASSIGNMENT = Pattern.compile(
            "(?<![=!<>])=\\s*(?:0|0\\.0[fF]?|NULL|false|\\{\\s*0\\s*\\}|\\([\\w\\s]+\\)\\s*\\{\\s*0\\s*\\})\\s*;");

    public static List<ValidationCheck> all() {
        return List.of(
                ValidationCheck.of("test-presence", QualityHeuristicChecks::testPresence),
                ValidationCheck.of("edge-case-coverage", QualityHeuristicChecks::edgeCaseCoverage),
                ValidationCheck.of("fixture-isolation", QualityHeuristicChecks::fixtureIsolation),
                ValidationCheck.of("stub-state-reset", QualityHeuristicChecks::stubStateReset));
    }

    public static CheckResult testPresence(CheckInput input) {
        if (UnityConventions.testFunctions(input.getTestCode()).isEmpty()) {
            return CheckResult.issue("No test functions found (functions should start with 'test_')");
        }
        return CheckResult.passed();
    }

    public static CheckResult edgeCaseCoverage(CheckInput input) {
        List<CFunctionDefinition> tests = UnityConventions.testFunctions(input.getTestCode());
        if (tests.size() <= 1) {
            return CheckResult.passed();
        }
        boolean hasEdgeCase = tests.stream()
                .map(t -> t.getName().toLowerCase(Locale.ROOT))
                .anyMatch(name -> EDGE_CASE_WORDS.stream().anyMatch(name::contains));
        return hasEdgeCase ? CheckResult.passed()
                : CheckResult.issue("Missing edge case tests (min/max/zero/negative/boundary values)");
    }

    public static CheckResult fixtureIsolation(CheckInput input) {
        List<CFunctionDefinition> definitions = CSourceScanner.findFunctionDefinitions(input.getTestCode());
        long tests = definitions.stream().filter(UnityConventions::isTestFunction).count();
        if (tests <= 1) {
            return CheckResult.passed();
        }
        boolean hasSetUp = definitions.stream().anyMatch(d -> d.getName().equals("setUp"));
        boolean hasTearDown = definitions.stream().anyMatch(d -> d.getName().equals("tearDown"));
        if (hasSetUp && hasTearDown) {
            return CheckResult.passed();
        }
        return CheckResult.issue("Multiple tests without setUp/tearDown - tests may not be properly isolated");
    }

    /**
     * When the file keeps stub or global state, tearDown must put it back: by memset, a reset
     * helper, or assigning zero-like values.
     */
    public static CheckResult stubStateReset(CheckInput input) {
        String code = input.getTestCode();
        List<String> state = stubStateVariables(code);
        if (state.isEmpty()) {
            return CheckResult.passed();
        }
        Optional<CFunctionDefinition> tearDown = CSourceScanner.findFunctionDefinitions(code).stream()
                .filter(d -> d.getName().equals("tearDown"))
                .findFirst();
        if (tearDown.isEmpty()) {
            return CheckResult.issue("tearDown() missing - stub state " + state + " is never reset");
        }
        String body = CSourceScanner.stripComments(tearDown.get().getBody());
        if (RESET_CALL.matcher(body).find() || ZERO_ASSIGNMENT.matcher(body).find()) {
            return CheckResult.passed();
        }
        return CheckResult.issue("tearDown() function should reset stub variables " + state);
    }

    static List<String> stubStateVariables(String code) {
        Matcher m = STUB_STATE.matcher(CSourceScanner.maskCommentsAndLiterals(code));
        List<String> names = new ArrayList<>();
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }
}
