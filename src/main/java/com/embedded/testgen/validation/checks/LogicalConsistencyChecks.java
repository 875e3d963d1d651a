package com.embedded.testgen.validation.checks;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.index.CFunctionDefinition;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.index.CallSite;
import com.embedded.testgen.validation.CheckInput;
import com.embedded.testgen.validation.CheckResult;
import com.embedded.testgen.validation.ValidationCheck;

import lombok.experimental.UtilityClass;

/**
 * Assertions that contradict each other or cannot plausibly hold.
 */
@UtilityClass
public class LogicalConsistencyChecks {

    static final BigInteger IMPLAUSIBLE_DIFFERENCE = BigInteger.valueOf(1000);

    private static final List<String> INTEGER_EQUALITY_MACROS = List.of(
            "TEST_ASSERT_EQUAL", "TEST_ASSERT_EQUAL_INT", "TEST_ASSERT_EQUAL_INT8", "TEST_ASSERT_EQUAL_INT16",
            "TEST_ASSERT_EQUAL_INT32", "TEST_ASSERT_EQUAL_UINT", "TEST_ASSERT_EQUAL_UINT8",
            "TEST_ASSERT_EQUAL_UINT16", "TEST_ASSERT_EQUAL_UINT32");

    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d+[uUlL]*");

    public static List<ValidationCheck> all() {
        return List.of(
                ValidationCheck.of("contradictory-assertions", LogicalConsistencyChecks::contradictoryAssertions),
                ValidationCheck.of("implausible-equality", LogicalConsistencyChecks::implausibleEquality));
    }

    public static CheckResult contradictoryAssertions(CheckInput input) {
        CheckResult.Builder result = CheckResult.builder();
        for (CFunctionDefinition test : UnityConventions.testFunctions(input.getTestCode())) {
            Set<String> assertedTrue = firstArguments(test.getBody(), "TEST_ASSERT_TRUE");
            Set<String> assertedFalse = firstArguments(test.getBody(), "TEST_ASSERT_FALSE");
            assertedTrue.retainAll(assertedFalse);
            for (String expression : assertedTrue) {
                result.issue("Test " + test.getName() + ": contradictory assertions - '" + expression
                        + "' asserted both TRUE and FALSE");
            }
        }
        return result.build();
    }

    public static CheckResult implausibleEquality(CheckInput input) {
        String code = input.getTestCode();
        CheckResult.Builder result = CheckResult.builder();
        for (String macro : INTEGER_EQUALITY_MACROS) {
            for (CallSite call : CSourceScanner.findCalls(code, macro)) {
                List<String> args = call.getArguments();
                if (args.size() < 2 || !isIntegerLiteral(args.get(0)) || !isIntegerLiteral(args.get(1))) {
                    continue;
                }
                BigInteger expected = parse(args.get(0));
                BigInteger actual = parse(args.get(1));
                if (expected.subtract(actual).abs().compareTo(IMPLAUSIBLE_DIFFERENCE) > 0) {
                    result.issue("Line " + CSourceScanner.lineOf(code, call.getStart()) + ": " + macro + "("
                            + args.get(0) + ", " + args.get(1) + ") compares values that differ by more than "
                            + IMPLAUSIBLE_DIFFERENCE);
                }
            }
        }
        return result.build();
    }

    private static Set<String> firstArguments(String body, String macro) {
        Set<String> expressions = new LinkedHashSet<>();
        for (CallSite call : CSourceScanner.findCalls(body, macro)) {
            if (!call.getArguments().isEmpty()) {
                expressions.add(call.getArguments().get(0).replaceAll("\\s+", ""));
            }
        }
        return expressions;
    }

    private static boolean isIntegerLiteral(String arg) {
        return INTEGER_LITERAL.matcher(arg.trim()).matches();
    }

    /** Literals of any length; C constants wider than 64 bits still compare. */
    private static BigInteger parse(String literal) {
        return new BigInteger(literal.trim().replaceAll("[uUlL]+$", ""));
    }
}
