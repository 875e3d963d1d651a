package com.embedded.testgen.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight structural scanner for C text. Not a parser: it masks comments,
 * literals and preprocessor lines, then matches parentheses and braces to find
 * function definitions and call sites. Offsets always refer to the original text.
 */
public final class CSourceScanner {

    public static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "default", "return",
            "sizeof", "goto", "break", "continue", "typedef", "struct", "union", "enum",
            "defined", "_Alignof", "_Static_assert", "__attribute__", "typeof", "__typeof__",
            "asm", "__asm__");

    private static final Set<String> STORAGE_QUALIFIERS = Set.of(
            "static", "inline", "extern", "__inline", "__inline__", "register", "_Noreturn");

    private static final Pattern IDENTIFIER_CALL = Pattern.compile("\\b([A-Za-z_]\\w*)\\s*\\(");
    /** {@code lvalue = literal;} where lvalue may be a member access. Groups: lvalue, number, float suffix. */
    public static final Pattern LITERAL_ASSIGNMENT = Pattern.compile(
            "\\b([A-Za-z_]\\w*(?:(?:\\.|->)[A-Za-z_]\\w*)*)\\s*(?<![=!<>+\\-*/%&|^])=(?!=)\\s*(-?\\d+(?:\\.\\d+)?)([fF]?)(?=\\s*;)");

    private static final Pattern INCLUDE = Pattern.compile("(?m)^\\s*#\\s*include\\s*[<\"]([^>\"]+)[>\"]");

    private CSourceScanner() {
        // Utility class
    }

    /**
     * Replaces comments and the contents of string and character literals with
     * spaces. Newlines and text length are preserved.
     */
    public static String maskCommentsAndLiterals(String text) {
        char[] out = text.toCharArray();
        int i = 0;
        int n = out.length;
        while (i < n) {
            char c = out[i];
            char next = i + 1 < n ? out[i + 1] : '\0';
            if (c == '/' && next == '/') {
                while (i < n && out[i] != '\n') {
                    out[i++] = ' ';
                }
            } else if (c == '/' && next == '*') {
                out[i++] = ' ';
                out[i++] = ' ';
                while (i < n && !(out[i] == '*' && i + 1 < n && out[i + 1] == '/')) {
                    if (out[i] != '\n') {
                        out[i] = ' ';
                    }
                    i++;
                }
                if (i < n) {
                    out[i++] = ' ';
                    out[i++] = ' ';
                }
            } else if (c == '"' || c == '\'') {
                i++;
                while (i < n && out[i] != c && out[i] != '\n') {
                    if (out[i] == '\\' && i + 1 < n) {
                        out[i++] = ' ';
                    }
                    out[i++] = ' ';
                }
                i++;
            } else {
                i++;
            }
        }
        return new String(out);
    }

    /**
     * Removes comments, keeping literals intact. Used when extracting identifiers.
     */
    public static String stripComments(String text) {
        String masked = maskCommentsAndLiterals(text);
        StringBuilder sb = new StringBuilder(text.length());
        boolean inLiteral = false;
        for (int i = 0; i < text.length(); i++) {
            char original = text.charAt(i);
            char m = masked.charAt(i);
            if (m == '"' || m == '\'') {
                inLiteral = !inLiteral;
            }
            sb.append(inLiteral || m != ' ' ? original : m);
        }
        return sb.toString();
    }

    /**
     * Masks comments, literals and whole preprocessor directives (with line continuations).
     */
    public static String maskCode(String text) {
        char[] out = maskCommentsAndLiterals(text).toCharArray();
        int i = 0;
        boolean lineStart = true;
        while (i < out.length) {
            char c = out[i];
            if (lineStart && c == '#') {
                boolean continued = true;
                while (i < out.length && continued) {
                    if (out[i] == '\n') {
                        continued = i > 0 && text.charAt(i - 1) == '\\';
                        if (continued) {
                            i++;
                        }
                        continue;
                    }
                    out[i++] = ' ';
                }
                lineStart = true;
                continue;
            }
            if (c == '\n') {
                lineStart = true;
            } else if (!Character.isWhitespace(c)) {
                lineStart = false;
            }
            i++;
        }
        return new String(out);
    }

    /**
     * Returns the offset of the bracket matching the one at {@code openIndex}, or -1.
     * The text must already be masked.
     */
    public static int findMatching(String masked, int openIndex) {
        char open = masked.charAt(openIndex);
        char close = switch (open) {
            case '(' -> ')';
            case '{' -> '}';
            case '[' -> ']';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds all top-level function definitions (a parameter list followed by a body).
     * Prototypes, macro invocations and declarations are skipped.
     */
    public static List<CFunctionDefinition> findFunctionDefinitions(String text) {
        String masked = maskCode(text);
        List<CFunctionDefinition> result = new ArrayList<>();
        int depth = 0;
        int boundary = 0;
        int i = 0;
        while (i < masked.length()) {
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
                i++;
                continue;
            }
            if (c == '}') {
                depth = Math.max(0, depth - 1);
                if (depth == 0) {
                    boundary = i + 1;
                }
                i++;
                continue;
            }
            if (c == ';' && depth == 0) {
                boundary = i + 1;
                i++;
                continue;
            }
            if (depth == 0 && isIdentifierStart(c) && (i == 0 || !isIdentifierPart(masked.charAt(i - 1)))) {
                int nameEnd = i;
                while (nameEnd < masked.length() && isIdentifierPart(masked.charAt(nameEnd))) {
                    nameEnd++;
                }
                int paren = skipWhitespace(masked, nameEnd);
                if (paren < masked.length() && masked.charAt(paren) == '(') {
                    int closeParen = findMatching(masked, paren);
                    if (closeParen < 0) {
                        break;
                    }
                    int brace = skipWhitespace(masked, closeParen + 1);
                    if (brace < masked.length() && masked.charAt(brace) == '{') {
                        int closeBrace = findMatching(masked, brace);
                        if (closeBrace < 0) {
                            break;
                        }
                        String name = masked.substring(i, nameEnd);
                        String prefix = text.substring(boundary, i);
                        CFunctionDefinition definition = toDefinition(text, name, prefix, boundary, paren,
                                closeParen, brace, closeBrace);
                        if (definition != null) {
                            result.add(definition);
                        }
                        boundary = closeBrace + 1;
                        i = closeBrace + 1;
                        continue;
                    }
                    i = closeParen + 1;
                    continue;
                }
                i = nameEnd;
                continue;
            }
            i++;
        }
        return result;
    }

    private static CFunctionDefinition toDefinition(String text, String name, String prefix, int start,
            int paren, int closeParen, int brace, int closeBrace) {
        if (KEYWORDS.contains(name)) {
            return null;
        }
        String declaration = stripComments(prefix).replaceAll("(?m)^\\s*#.*$", " ");
        if (declaration.contains("=") || declaration.contains("(") || declaration.contains(")")) {
            return null;
        }
        List<String> words = new ArrayList<>();
        boolean isStatic = false;
        for (String word : declaration.replace("*", " * ").trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (STORAGE_QUALIFIERS.contains(word)) {
                isStatic |= word.equals("static");
                continue;
            }
            words.add(word);
        }
        if (words.isEmpty()) {
            return null;
        }
        String parameters = stripComments(text.substring(paren + 1, closeParen)).replaceAll("\\s+", " ").trim();
        return CFunctionDefinition.builder()
                .name(name)
                .returnType(normalizeType(String.join(" ", words)))
                .parameters(parameters)
                .staticLinkage(isStatic)
                .start(start + leadingWhitespace(prefix))
                .bodyStart(brace)
                .end(closeBrace + 1)
                .body(text.substring(brace + 1, closeBrace))
                .build();
    }

    /**
     * Collapses whitespace and binds pointer stars to the type, e.g. {@code const char *} becomes {@code const char*}.
     */
    public static String normalizeType(String type) {
        return type.replaceAll("\\s+", " ")
                .replaceAll("\\s*\\*\\s*", "*")
                .trim();
    }

    /**
     * Finds calls of {@code name(...)} and splits their arguments at top-level commas.
     * Occurrences with unbalanced parentheses end the scan.
     */
    public static List<CallSite> findCalls(String text, String name) {
        String masked = maskCommentsAndLiterals(text);
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*\\(");
        Matcher m = pattern.matcher(masked);
        List<CallSite> calls = new ArrayList<>();
        int from = 0;
        while (m.find(from)) {
            int open = m.end() - 1;
            int close = findMatching(masked, open);
            if (close < 0) {
                break;
            }
            calls.add(new CallSite(name, m.start(), close + 1, splitArguments(text, masked, open + 1, close)));
            from = close + 1;
        }
        return calls;
    }

    private static List<String> splitArguments(String text, String masked, int from, int to) {
        List<String> args = new ArrayList<>();
        int depth = 0;
        int argStart = from;
        for (int i = from; i < to; i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                args.add(text.substring(argStart, i).trim());
                argStart = i + 1;
            }
        }
        String last = text.substring(argStart, to).trim();
        if (!last.isEmpty() || !args.isEmpty()) {
            args.add(last);
        }
        return args;
    }

    /**
     * Identifiers that appear in call position, in order of first appearance, keywords excluded.
     */
    public static Set<String> calledIdentifiers(String code) {
        Matcher m = IDENTIFIER_CALL.matcher(maskCode(code));
        Set<String> called = new LinkedHashSet<>();
        while (m.find()) {
            String name = m.group(1);
            if (!KEYWORDS.contains(name)) {
                called.add(name);
            }
        }
        return called;
    }

    /**
     * Header names from {@code #include} directives, in order, duplicates removed.
     */
    public static List<String> includes(String text) {
        Matcher m = INCLUDE.matcher(stripComments(text));
        Set<String> names = new LinkedHashSet<>();
        while (m.find()) {
            names.add(m.group(1).trim());
        }
        return List.copyOf(names);
    }

    /**
     * 1-based line number of an offset.
     */
    public static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * The full line containing {@code offset}, without its terminator.
     */
    public static String lineAt(String text, int offset) {
        int start = text.lastIndexOf('\n', Math.max(0, offset - 1)) + 1;
        if (offset == 0) {
            start = 0;
        }
        int end = text.indexOf('\n', offset);
        return text.substring(start, end < 0 ? text.length() : end);
    }

    private static int skipWhitespace(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int leadingWhitespace(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
