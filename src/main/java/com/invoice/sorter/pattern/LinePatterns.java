package com.invoice.sorter.pattern;

import java.util.regex.Pattern;

import static com.invoice.sorter.pattern.LinePattern.MatchMode.FIND;
import static com.invoice.sorter.pattern.LinePattern.MatchMode.FULL;

/**
 * Atomic line predicates shared by field rules and item windows.
 */
public final class LinePatterns {

    private static final LinePattern DECIMAL_NUMBER =
            new LinePattern("decimal", "\\d+(?:\\.\\d+)?|\\.\\d+", FULL);

    private static final LinePattern DATE =
            new LinePattern("date", "\\d{1,2}/\\d{1,2}/(?:\\d{4}|\\d{2})", FULL);

    private static final LinePattern DATE_ANYWHERE =
            new LinePattern("date-anywhere", "\\b\\d{1,2}/\\d{1,2}/(?:\\d{4}|\\d{2})\\b", FIND);

    private static final LinePattern MONEY =
            new LinePattern("money", "(?:\\d{1,3}(?:,\\d{3})+|\\d+)\\.\\d{2}", FULL);

    private static final LinePattern ANY_TEXT =
            new LinePattern("any-text", "(?s).+", FULL);

    private LinePatterns() {
    }

    /** Optional integer part plus optional fractional part, e.g. {@code 65.31}, {@code 9}, {@code .5}. */
    public static LinePattern decimalNumber() {
        return DECIMAL_NUMBER;
    }

    /** MM/DD/YYYY or MM/DD/YY, one or two digit month and day, whole line. */
    public static LinePattern date() {
        return DATE;
    }

    /** Same shape as {@link #date()} but found anywhere in the line. */
    public static LinePattern dateAnywhere() {
        return DATE_ANYWHERE;
    }

    /** Optional thousands separators, exactly two decimals, no currency sign. */
    public static LinePattern money() {
        return MONEY;
    }

    public static LinePattern anyText() {
        return ANY_TEXT;
    }

    /**
     * Bare numeric string of {@code min} to {@code max} digits. {@code max <= 0} means unbounded.
     */
    public static LinePattern digits(int min, int max) {
        String range = max <= 0 ? "{" + min + ",}" : "{" + min + "," + max + "}";
        return new LinePattern("digits" + range, "\\d" + range, FULL);
    }

    /** Upper-case letters and digits only, at least {@code minLength} characters. */
    public static LinePattern upperAlphanumeric(int minLength) {
        return new LinePattern("upper-alnum{" + minLength + ",}", "[A-Z0-9]{" + minLength + ",}", FULL);
    }

    /**
     * Letter/digit code shape: {@code L} = upper-case letter, {@code D} = digit, {@code A} = either.
     * {@code "LLLD"} accepts {@code ABC1} and rejects {@code AB1}.
     */
    public static LinePattern code(String shape) {
        if (shape == null || shape.isEmpty()) {
            throw new IllegalArgumentException("Code shape must not be empty");
        }
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < shape.length()) {
            char c = shape.charAt(i);
            int run = 1;
            while (i + run < shape.length() && shape.charAt(i + run) == c) run++;
            String cls = switch (c) {
                case 'L' -> "[A-Z]";
                case 'D' -> "\\d";
                case 'A' -> "[A-Z0-9]";
                default -> throw new IllegalArgumentException(
                        "Unsupported code shape character '" + c + "' in " + shape);
            };
            regex.append(cls);
            if (run > 1) regex.append('{').append(run).append('}');
            i += run;
        }
        return new LinePattern("code(" + shape + ")", regex.toString(), FULL);
    }

    /** A decimal quantity followed by a unit suffix, e.g. {@code 12.50 TN}. Case-insensitive. */
    public static LinePattern quantityWithUnit(String unit) {
        return new LinePattern("quantity(" + unit + ")",
                "\\d+(?:\\.\\d+)?\\s*" + Pattern.quote(unit), FULL, Pattern.CASE_INSENSITIVE);
    }

    public static LinePattern fullMatch(String name, String regex) {
        return new LinePattern(name, regex, FULL);
    }

    public static LinePattern fullMatchIgnoreCase(String name, String regex) {
        return new LinePattern(name, regex, FULL, Pattern.CASE_INSENSITIVE);
    }

    public static LinePattern find(String name, String regex) {
        return new LinePattern(name, regex, FIND);
    }

    public static LinePattern findIgnoreCase(String name, String regex) {
        return new LinePattern(name, regex, FIND, Pattern.CASE_INSENSITIVE);
    }

    /** Whole line equal to {@code label}, ignoring case. */
    public static LinePattern label(String label) {
        return new LinePattern("label(" + label + ")", Pattern.quote(label), FULL, Pattern.CASE_INSENSITIVE);
    }

    /** Line containing {@code text} anywhere, ignoring case. */
    public static LinePattern containing(String text) {
        return new LinePattern("containing(" + text + ")", Pattern.quote(text), FIND, Pattern.CASE_INSENSITIVE);
    }
}
