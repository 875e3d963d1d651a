package com.embedded.testgen.context;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * Masks content that should not leave the machine before a source file is sent to a backend.
 * Code structure (identifiers, numbers, operators) is kept so the file still describes
 * what must be tested.
 */
public class SourceRedactor {

    static final String COMMENT_BLOCK = "/* [COMMENT REDACTED] */";
    static final String COMMENT_LINE = "// [COMMENT REDACTED]";
    static final String STRING = "\"[STRING REDACTED]\"";

    /** String literals and comments in one pass, so a {@code //} inside a string is not a comment. */
    private static final Pattern COMMENTS_AND_STRINGS = Pattern.compile(
            "\"(?:\\\\.|[^\"\\\\\\n])*\"|/\\*.*?\\*/|//[^\\n]*", Pattern.DOTALL);

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), "[EMAIL REDACTED]"),
            new Rule(Pattern.compile("https?://[^\\s'\"]+"), "[URL REDACTED]"),
            new Rule(Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"), "[IP REDACTED]"),
            // Base64-like runs that mix letters and digits
            new Rule(Pattern.compile("\\b(?=[A-Za-z0-9+/=]*\\d)(?=[A-Za-z0-9+/=]*[A-Za-z])[A-Za-z0-9+/=]{20,}\\b"),
                    "[CREDENTIAL REDACTED]"));

    public String redact(String source) {
        String text = COMMENTS_AND_STRINGS.matcher(source).replaceAll(m -> {
            String found = m.group();
            if (found.startsWith("\"")) {
                return Matcher.quoteReplacement(STRING);
            }
            return Matcher.quoteReplacement(found.startsWith("//") ? COMMENT_LINE : COMMENT_BLOCK);
        });
        for (Rule rule : RULES) {
            text = rule.getPattern().matcher(text).replaceAll(Matcher.quoteReplacement(rule.getReplacement()));
        }
        return text;
    }

    @Value
    private static class Rule {
        Pattern pattern;
        String replacement;
    }
}
