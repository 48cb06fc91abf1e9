package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for rules that pick one amount out of every money match on the page.
 */
@Getter
@EqualsAndHashCode
public abstract class NumericMatchRule implements FieldRule {

    private final String regex;
    private final int group;

    @EqualsAndHashCode.Exclude
    private final Pattern pattern;

    protected NumericMatchRule(String regex, int group) {
        this.regex = regex;
        this.group = group;
        this.pattern = Pattern.compile(regex);
        if (group > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Pattern " + regex + " has no group " + group);
        }
    }

    /** All matches in reading order, thousands separators removed. */
    protected List<String> collectAmounts(RawPage page) {
        List<String> amounts = new ArrayList<>();
        Matcher m = pattern.matcher(page.text());
        while (m.find()) {
            String raw = m.group(group);
            if (raw != null && !raw.isBlank()) {
                amounts.add(raw.replace(",", "").trim());
            }
        }
        return amounts;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + regex + ")";
    }
}
