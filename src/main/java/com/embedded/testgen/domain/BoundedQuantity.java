package com.embedded.testgen.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Physical or electrical quantities with a known valid range that generated tests
 * tend to get wrong. Recognized from the identifier or expression a literal is bound to,
 * by whole words of that identifier: {@code ambientTemp} and {@code temp_c} are temperatures,
 * {@code template} and {@code max_attempts} are not.
 */
@Getter
@RequiredArgsConstructor
public enum BoundedQuantity {

    TEMPERATURE_CELSIUS("Temperature", -40, 125, " C",
            Set.of("temp", "temperature", "celsius"),
            "SPECIFIC FIX REQUIRED: Temperature values must be in range -40.0 C to 125.0 C. "
                    + "Check the source code for the exact valid ranges and thresholds."),

    RAW_ADC_COUNT("Raw ADC", 0, 1023, "",
            Set.of("rand", "raw", "adc"),
            "SPECIFIC FIX REQUIRED: Raw ADC readings (e.g. rand() % 1024) must be in range 0-1023. "
                    + "Use values like 0, 512 and 1023 for testing.");

    /** Negative literal at or next to absolute zero in Celsius. */
    public static final Pattern ABSOLUTE_ZERO = Pattern.compile("(?<![\\w.])-27[3-9](?:\\.\\d+)?[fF]?\\b");

    /** Words of identifiers that count or index things rather than measure a bounded quantity. */
    private static final Set<String> COUNTER_VOCABULARY = Set.of(
            "count", "counter", "index", "idx", "tick", "ticks", "len", "length", "size", "num", "calls");

    /** Words on a line that mark a literal as a raw, random or counted value. */
    private static final Set<String> RAW_CONTEXT = Set.of(
            "rand", "random", "raw", "adc", "count", "counter", "index", "idx");

    private static final Pattern WORD_BOUNDARY = Pattern.compile(
            "[^A-Za-z0-9]+|(?<=[a-z])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])|(?<=[A-Za-z])(?=\\d)|(?<=\\d)(?=[A-Za-z])");

    private final String label;
    private final double min;
    private final double max;
    private final String unit;
    private final Set<String> vocabulary;
    private final String correctiveInstruction;

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public String rangeText() {
        return format(min) + " to " + format(max) + unit;
    }

    /**
     * Issue text for a literal outside this quantity's range.
     */
    public String describeViolation(String literal, double value) {
        String direction = value > max ? "high" : "low";
        return label + " value " + literal + " seems unreasonably " + direction
                + " (valid range: " + rangeText() + ")";
    }

    /**
     * Whether an issue string was produced by {@link #describeViolation}.
     */
    public boolean matchesIssue(String issue) {
        return issue.startsWith(label + " value ") && issue.contains("seems unreasonably");
    }

    /**
     * Classifies the value of an expression: an lvalue, a variable, or a call whose result is used.
     * For conversion functions such as {@code convert_raw_to_celsius} the words after {@code to} name the result.
     */
    public static Optional<BoundedQuantity> classify(String expression) {
        List<String> words = words(leadingName(expression));
        int to = words.lastIndexOf("to");
        return classifyWords(to >= 0 ? words.subList(to + 1, words.size()) : words);
    }

    /**
     * Classifies the argument of a function. For conversion functions the words before {@code to}
     * name the input.
     */
    public static Optional<BoundedQuantity> classifyArgumentOf(String function) {
        List<String> words = words(leadingName(function));
        int to = words.indexOf("to");
        return classifyWords(to >= 0 ? words.subList(0, to) : words);
    }

    /**
     * Counter and index names are never bounded quantities; raw readings take precedence
     * over the physical quantity they are later converted into.
     */
    private static Optional<BoundedQuantity> classifyWords(List<String> words) {
        if (words.stream().anyMatch(COUNTER_VOCABULARY::contains)) {
            return Optional.empty();
        }
        if (words.stream().anyMatch(RAW_ADC_COUNT.vocabulary::contains)) {
            return Optional.of(RAW_ADC_COUNT);
        }
        if (words.stream().anyMatch(TEMPERATURE_CELSIUS.vocabulary::contains)) {
            return Optional.of(TEMPERATURE_CELSIUS);
        }
        return Optional.empty();
    }

    private static String leadingName(String expression) {
        int paren = expression.indexOf('(');
        return paren >= 0 ? expression.substring(0, paren) : expression;
    }

    /**
     * Lower-case words of identifiers in {@code text}, split at underscores, punctuation,
     * camelCase humps and letter/digit changes.
     */
    static List<String> words(String text) {
        return Arrays.stream(WORD_BOUNDARY.split(text.trim()))
                .filter(word -> !word.isEmpty())
                .map(word -> word.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * True when the line around a literal suggests a raw counter or index value.
     */
    public static boolean isRawCounterContext(String line) {
        return words(line).stream().anyMatch(RAW_CONTEXT::contains);
    }

    /**
     * Writes {@code bound} in the same literal style as {@code original}: integer,
     * decimal, or decimal with an {@code f} suffix.
     */
    public static String formatLike(double bound, String original, String suffix) {
        boolean decimal = original.contains(".") || !suffix.isEmpty();
        String number = decimal ? BigDecimal.valueOf(bound).setScale(1, RoundingMode.HALF_UP).toPlainString()
                : Long.toString(Math.round(bound));
        return number + suffix;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
