package com.embedded.testgen.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.embedded.testgen.domain.BoundedQuantity;
import com.embedded.testgen.domain.IncludePolicy;
import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.index.CFunctionDefinition;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.index.CallSite;
import com.embedded.testgen.index.FileAnalysis;

import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * The rewrite steps applied to raw generated test code, in application order.
 */
@UtilityClass
public class NormalizationSteps {

    public static final String FLOAT_TOLERANCE = "0.01f";
    public static final String DOUBLE_TOLERANCE = "0.01";

    private static final Pattern FENCE_LINE = Pattern.compile("(?m)^[ \\t]*```[\\w+-]*[ \\t]*(?:\\n|$)");
    private static final Pattern NON_CANONICAL_COMPARISON = Pattern.compile(
            "\\bTEST_ASSERT_(GREATER|LESS)_(?:THAN_EQUAL|EQUAL)(_\\w+)?\\b");
    private static final Pattern INCLUDE_LINE = Pattern.compile(
            "(?m)^[ \\t]*#[ \\t]*include[ \\t]*[<\"]([^>\"\\n]+)[>\"][^\\n]*(?:\\n|$)");
    private static final List<String> CONSOLE_IO = List.of("printf", "puts", "putchar", "scanf");
    private static final List<String> STREAM_IO = List.of("fprintf", "fputs");
    private static final Pattern STANDARD_STREAM = Pattern.compile("^(?:stdout|stderr|stdin)$");
    private static final int MAX_NESTED_PASSES = 10;
    private static final Pattern VOID_CAST_SUFFIX = Pattern.compile("\\(\\s*void\\s*\\)\\s*$");
    private static final Pattern LABEL_OR_DANGLING_KEYWORD = Pattern.compile(
            "(?:case\\b[^?;:]*|default|[A-Za-z_]\\w*)\\s*:|else|do");
    private static final Pattern CONTROL_KEYWORD_BEFORE = Pattern.compile("\\b(?:if|for|while)\\s*$");

    public static List<NormalizationStep> all() {
        return List.of(
                NormalizationStep.of("code-fences", NormalizationSteps::stripCodeFences),
                NormalizationStep.of("float-tolerance", NormalizationSteps::toleranceFloatAssertions),
                NormalizationStep.of("comparison-macros", NormalizationSteps::canonicalComparisonMacros),
                NormalizationStep.of("domain-clamp", NormalizationSteps::clampDomainLiterals),
                NormalizationStep.of("entry-point", NormalizationSteps::stripEntryPoint),
                NormalizationStep.of("console-io", NormalizationSteps::stripConsoleIo),
                NormalizationStep.of("include-filter", NormalizationSteps::filterIncludes),
                NormalizationStep.of("test-runner", NormalizationSteps::ensureTestRunner),
                NormalizationStep.of("whitespace", NormalizationSteps::tidyWhitespace));
    }

    public static String stripCodeFences(String text, FileAnalysis source) {
        return FENCE_LINE.matcher(text).replaceAll("").replace("```", "");
    }

    public static String toleranceFloatAssertions(String text, FileAnalysis source) {
        String current = text;
        for (int pass = 0; pass < MAX_NESTED_PASSES; pass++) {
            String next = replaceEqualityCalls(current, "TEST_ASSERT_EQUAL_FLOAT", "TEST_ASSERT_FLOAT_WITHIN", FLOAT_TOLERANCE);
            next = replaceEqualityCalls(next, "TEST_ASSERT_EQUAL_DOUBLE", "TEST_ASSERT_DOUBLE_WITHIN", DOUBLE_TOLERANCE);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private static String replaceEqualityCalls(String text, String macro, String replacement, String tolerance) {
        List<Edit> edits = new ArrayList<>();
        for (CallSite call : CSourceScanner.findCalls(text, macro)) {
            List<String> args = call.getArguments();
            if (args.size() == 2) {
                edits.add(new Edit(call.getStart(), call.getEnd(),
                        replacement + "(" + tolerance + ", " + args.get(0) + ", " + args.get(1) + ")"));
            }
        }
        return Edit.applyAll(text, edits);
    }

    public static String canonicalComparisonMacros(String text, FileAnalysis source) {
        return NON_CANONICAL_COMPARISON.matcher(text).replaceAll(m ->
                Matcher.quoteReplacement("TEST_ASSERT_" + m.group(1) + "_OR_EQUAL"
                        + (m.group(2) == null ? "" : m.group(2))));
    }

    /**
     * Moves literals of recognized bounded quantities to the nearest valid bound. Absolute-zero
     * temperatures are replaced first, then literal assignments are clamped by what they assign to.
     */
    public static String clampDomainLiterals(String text, FileAnalysis source) {
        List<Edit> floorEdits = new ArrayList<>();
        Matcher floor = BoundedQuantity.ABSOLUTE_ZERO.matcher(CSourceScanner.maskCommentsAndLiterals(text));
        while (floor.find()) {
            String literal = floor.group();
            String suffix = literal.endsWith("f") || literal.endsWith("F") ? literal.substring(literal.length() - 1) : "";
            floorEdits.add(new Edit(floor.start(), floor.end(),
                    BoundedQuantity.formatLike(BoundedQuantity.TEMPERATURE_CELSIUS.getMin(), literal, suffix)));
        }
        String floored = Edit.applyAll(text, floorEdits);

        List<Edit> clampEdits = new ArrayList<>();
        Matcher assignment = CSourceScanner.LITERAL_ASSIGNMENT.matcher(CSourceScanner.maskCommentsAndLiterals(floored));
        while (assignment.find()) {
            Optional<BoundedQuantity> quantity = BoundedQuantity.classify(assignment.group(1));
            if (quantity.isEmpty()) {
                continue;
            }
            String literal = assignment.group(2);
            double value = Double.parseDouble(literal);
            if (!quantity.get().contains(value)) {
                clampEdits.add(new Edit(assignment.start(2), assignment.end(3),
                        BoundedQuantity.formatLike(quantity.get().clamp(value), literal, assignment.group(3))));
            }
        }
        return Edit.applyAll(floored, clampEdits);
    }

    /**
     * Removes statements that call {@code main} unless it is declared extern, then removes every
     * {@code main} definition that is not the Unity runner.
     */
    public static String stripEntryPoint(String text, FileAnalysis source) {
        String withoutCalls = text;
        if (!UnityConventions.declaresExternMain(text)) {
            withoutCalls = removeStatements(text, UnityConventions.entryPointCalls(text));
        }
        List<Edit> edits = new ArrayList<>();
        for (CFunctionDefinition definition : CSourceScanner.findFunctionDefinitions(withoutCalls)) {
            if (UnityConventions.ENTRY_POINT.equals(definition.getName()) && !UnityConventions.isTestRunner(definition)) {
                edits.add(new Edit(definition.getStart(), lineEndAfter(withoutCalls, definition.getEnd()), ""));
            }
        }
        return Edit.applyAll(withoutCalls, edits);
    }

    public static String stripConsoleIo(String text, FileAnalysis source) {
        List<CallSite> calls = new ArrayList<>();
        for (String name : CONSOLE_IO) {
            calls.addAll(CSourceScanner.findCalls(text, name));
        }
        for (String name : STREAM_IO) {
            for (CallSite call : CSourceScanner.findCalls(text, name)) {
                List<String> args = call.getArguments();
                String stream = name.equals("fputs") ? last(args) : first(args);
                if (STANDARD_STREAM.matcher(stream).matches()) {
                    calls.add(call);
                }
            }
        }
        return removeStatements(text, calls);
    }

    public static String filterIncludes(String text, FileAnalysis source) {
        List<String> sourceIncludes = source.getIncludes();
        return INCLUDE_LINE.matcher(text).replaceAll(m ->
                IncludePolicy.isAllowed(m.group(1).trim(), sourceIncludes) ? Matcher.quoteReplacement(m.group()) : "");
    }

    /**
     * Appends a Unity {@code main} running every test function in file order, unless a runner exists.
     */
    public static String ensureTestRunner(String text, FileAnalysis source) {
        List<CFunctionDefinition> definitions = CSourceScanner.findFunctionDefinitions(text);
        if (definitions.stream().anyMatch(UnityConventions::isTestRunner)) {
            return text;
        }
        List<String> tests = definitions.stream()
                .filter(UnityConventions::isTestFunction)
                .map(CFunctionDefinition::getName)
                .distinct()
                .toList();
        if (tests.isEmpty()) {
            return text;
        }
        StringBuilder runner = new StringBuilder(text.stripTrailing());
        runner.append("\n\nint main(void)\n{\n    UNITY_BEGIN();\n");
        for (String test : tests) {
            runner.append("    RUN_TEST(").append(test).append(");\n");
        }
        runner.append("    return UNITY_END();\n}\n");
        return runner.toString();
    }

    public static String tidyWhitespace(String text, FileAnalysis source) {
        String unix = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder(unix.length());
        for (String line : unix.split("\n", -1)) {
            sb.append(line.stripTrailing()).append('\n');
        }
        String collapsed = sb.toString().replaceAll("\n{3,}", "\n\n").replaceAll("^\n+", "").stripTrailing();
        return collapsed.isEmpty() ? "" : collapsed + "\n";
    }

    /**
     * Removes each call that forms a whole expression statement. A call that is the body of an
     * unbraced {@code if}/{@code for}/{@code while}/{@code else}/{@code do} or follows a label is replaced
     * by an empty statement instead. Calls used as values, or inside parentheses, are left alone.
     */
    private static String removeStatements(String text, List<CallSite> calls) {
        String masked = CSourceScanner.maskCommentsAndLiterals(text);
        List<Edit> edits = new ArrayList<>();
        for (CallSite call : calls) {
            int end = nextNonBlank(masked, call.getEnd());
            if (end >= masked.length() || masked.charAt(end) != ';' || parenDepth(masked, call.getStart()) > 0) {
                continue;
            }
            int start = call.getStart();
            while (start > 0 && ";{}".indexOf(masked.charAt(start - 1)) < 0) {
                start--;
            }
            String head = masked.substring(start, call.getStart());
            Matcher cast = VOID_CAST_SUFFIX.matcher(head);
            int exprStart = cast.find() ? start + cast.start() : call.getStart();
            head = masked.substring(start, exprStart);

            if (head.isBlank()) {
                int stmtStart = start + (head.length() - head.stripLeading().length());
                int stmtEnd = end + 1;
                int lineStart = text.lastIndexOf('\n', stmtStart - 1) + 1;
                int lineEnd = lineEndAfter(text, stmtEnd);
                boolean ownLines = text.substring(lineStart, stmtStart).isBlank()
                        && masked.substring(stmtEnd, Math.min(lineEnd, masked.length())).isBlank();
                edits.add(ownLines ? new Edit(lineStart, lineEnd, "") : new Edit(stmtStart, stmtEnd, ""));
            } else if (endsWithControlHeader(masked, start, exprStart)) {
                edits.add(new Edit(exprStart, end, ""));
            }
        }
        return Edit.applyAll(text, edits);
    }

    /**
     * Whether {@code masked[from, to)} ends with a label, {@code else}, {@code do}, or the closing
     * parenthesis of an {@code if}/{@code for}/{@code while} header. The header may begin before {@code from}.
     */
    private static boolean endsWithControlHeader(String masked, int from, int to) {
        String head = masked.substring(from, to).stripTrailing();
        if (LABEL_OR_DANGLING_KEYWORD.matcher(head.strip()).matches()) {
            return true;
        }
        if (!head.endsWith(")")) {
            return false;
        }
        int depth = 0;
        for (int i = from + head.length() - 1; i >= 0; i--) {
            char c = masked.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(' && --depth == 0) {
                return CONTROL_KEYWORD_BEFORE.matcher(masked.substring(Math.max(0, i - 16), i)).find();
            }
        }
        return false;
    }

    /** Unclosed parentheses before {@code offset}. */
    private static int parenDepth(String masked, int offset) {
        int depth = 0;
        for (int i = 0; i < offset; i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    private static int nextNonBlank(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /** Offset just past the newline ending the line that contains {@code offset}, or the text end. */
    private static int lineEndAfter(String text, int offset) {
        int newline = text.indexOf('\n', offset);
        return newline < 0 ? text.length() : newline + 1;
    }

    private static String first(List<String> args) {
        return args.isEmpty() ? "" : args.get(0).trim();
    }

    private static String last(List<String> args) {
        return args.isEmpty() ? "" : args.get(args.size() - 1).trim();
    }

    /**
     * Replacement of the span [start, end). Overlapping edits keep the earliest.
     */
    @Value
    private static class Edit {
        int start;
        int end;
        String replacement;

        static String applyAll(String text, List<Edit> edits) {
            if (edits.isEmpty()) {
                return text;
            }
            List<Edit> sorted = new ArrayList<>(edits);
            sorted.sort(Comparator.comparingInt(Edit::getStart));
            StringBuilder sb = new StringBuilder(text.length());
            int cursor = 0;
            for (Edit edit : sorted) {
                if (edit.start < cursor) {
                    continue;
                }
                sb.append(text, cursor, edit.start).append(edit.replacement);
                cursor = edit.end;
            }
            sb.append(text, cursor, text.length());
            return sb.toString();
        }
    }
}
