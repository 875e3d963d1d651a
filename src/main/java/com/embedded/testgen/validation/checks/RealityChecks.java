package com.embedded.testgen.validation.checks;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.embedded.testgen.domain.BoundedQuantity;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.index.CallSite;
import com.embedded.testgen.validation.CheckInput;
import com.embedded.testgen.validation.CheckResult;
import com.embedded.testgen.validation.ValidationCheck;

import lombok.experimental.UtilityClass;

/**
 * Checks that the values and assertions in a test describe something physically possible.
 */
@UtilityClass
public class RealityChecks {

    private static final Pattern FLOAT_EQUALITY = Pattern.compile("\\bTEST_ASSERT_EQUAL_(?:FLOAT|DOUBLE)\\s*\\(");
    private static final Pattern HUGE_MAGNITUDE = Pattern.compile("(?<![\\w.])\\d+(?:\\.\\d+)?[eE]\\+?[1-9]\\d+[fF]?\\b");

    /** First literal argument of a call, e.g. {@code validate_temperature(130.0f)}. */
    private static final Pattern LITERAL_ARGUMENT = Pattern.compile(
            "\\b([A-Za-z_]\\w*)\\s*\\(\\s*(-?\\d+(?:\\.\\d+)?)[fF]?\\s*[,)]");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    public static List<ValidationCheck> all() {
        return List.of(
                ValidationCheck.of("float-equality", RealityChecks::floatEquality),
                ValidationCheck.of("impossible-literals", RealityChecks::impossibleLiterals),
                ValidationCheck.of("domain-range", RealityChecks::domainRange));
    }

    public static CheckResult floatEquality(CheckInput input) {
        if (FLOAT_EQUALITY.matcher(CSourceScanner.maskCommentsAndLiterals(input.getTestCode())).find()) {
            return CheckResult.realismIssue(
                    "Uses TEST_ASSERT_EQUAL_FLOAT - should use TEST_ASSERT_FLOAT_WITHIN for floating point comparisons");
        }
        return CheckResult.passed();
    }

    public static CheckResult impossibleLiterals(CheckInput input) {
        CheckResult.Builder result = CheckResult.builder();
        String[] lines = CSourceScanner.maskCommentsAndLiterals(input.getTestCode()).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (BoundedQuantity.ABSOLUTE_ZERO.matcher(lines[i]).find()) {
                result.realismIssue("Line " + (i + 1) + ": Absolute zero temperature - unrealistic test scenario");
            }
            if (HUGE_MAGNITUDE.matcher(lines[i]).find()) {
                result.realismIssue("Line " + (i + 1) + ": Extremely large value - unrealistic test scenario");
            }
        }
        return result.build();
    }

    /**
     * Flags literals bound to a recognized quantity that fall outside its range. Literals are
     * looked at in three positions: assignments, the expected value of a float assertion, and
     * the first argument of a call. Temperature readings in the raw counter range are skipped when
     * their line talks about raw, random or counted values.
     */
    public static CheckResult domainRange(CheckInput input) {
        String code = CSourceScanner.stripComments(input.getTestCode());
        CheckResult.Builder result = CheckResult.builder();

        Matcher assignment = CSourceScanner.LITERAL_ASSIGNMENT.matcher(code);
        while (assignment.find()) {
            inspect(code, assignment.start(2), assignment.group(2), BoundedQuantity.classify(assignment.group(1)), result);
        }

        for (CallSite call : CSourceScanner.findCalls(code, "TEST_ASSERT_FLOAT_WITHIN")) {
            List<String> args = call.getArguments();
            if (args.size() == 3 && isLiteral(args.get(1))) {
                inspect(code, call.getStart(), stripSuffix(args.get(1)), BoundedQuantity.classify(args.get(2)), result);
            }
        }

        Matcher argument = LITERAL_ARGUMENT.matcher(code);
        while (argument.find()) {
            String callee = argument.group(1);
            if (callee.startsWith("TEST_ASSERT")) {
                continue;
            }
            inspect(code, argument.start(2), argument.group(2), BoundedQuantity.classifyArgumentOf(callee), result);
        }
        return result.build();
    }

    private static void inspect(String code, int offset, String literal, Optional<BoundedQuantity> quantity,
            CheckResult.Builder result) {
        if (quantity.isEmpty()) {
            return;
        }
        double value = Double.parseDouble(literal);
        BoundedQuantity q = quantity.get();
        if (q.contains(value)) {
            return;
        }
        if (q == BoundedQuantity.TEMPERATURE_CELSIUS
                && BoundedQuantity.RAW_ADC_COUNT.contains(value)
                && BoundedQuantity.isRawCounterContext(CSourceScanner.lineAt(code, offset))) {
            return;
        }
        result.realismIssue(q.describeViolation(literal, value));
    }

    private static boolean isLiteral(String arg) {
        return NUMBER.matcher(stripSuffix(arg)).matches();
    }

    private static String stripSuffix(String literal) {
        String trimmed = literal.trim();
        return trimmed.endsWith("f") || trimmed.endsWith("F") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
