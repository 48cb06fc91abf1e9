package com.invoice.sorter.rule;

import com.invoice.sorter.pattern.LinePattern;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Short factories for the rule tables in {@code com.invoice.sorter.vendor}.
 */
public final class FieldRules {

    private FieldRules() {
    }

    public static FieldRule constant(String value) {
        return new ConstantRule(value);
    }

    /** Anchored regex returning capture group 1. */
    public static FieldRule anchored(String regex) {
        return new AnchoredRegexRule(regex, 0, 1);
    }

    public static FieldRule anchoredIgnoreCase(String regex) {
        return new AnchoredRegexRule(regex, Pattern.CASE_INSENSITIVE, 1);
    }

    public static FieldRule lineAfter(String label) {
        return new FirstLineAfterLabelRule(label, true);
    }

    /** Greatest match of {@code regex}; group 0 when the pattern has no capture group. */
    public static FieldRule maxAmount(String regex) {
        return new MaxNumericMatchRule(regex, Pattern.compile(regex).matcher("").groupCount() > 0 ? 1 : 0);
    }

    public static FieldRule lastAmount(String regex) {
        return new LastNumericMatchRule(regex, Pattern.compile(regex).matcher("").groupCount() > 0 ? 1 : 0);
    }

    public static FieldRule firstLine(LinePattern pattern, String... excludedWords) {
        return new FirstLineMatchingRule(pattern, Set.of(excludedWords));
    }

    public static FieldRule firstOf(FieldRule... rules) {
        return new FirstOfRule(List.of(rules));
    }
}
