package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Searches the whole page text, lines joined by {@code \n}, and returns the capture group of the first match.
 */
@Getter
@EqualsAndHashCode
public final class AnchoredRegexRule implements FieldRule {

    private final String regex;
    private final int flags;
    private final int group;

    @EqualsAndHashCode.Exclude
    private final Pattern pattern;

    public AnchoredRegexRule(String regex, int flags, int group) {
        this.regex = regex;
        this.flags = flags;
        this.group = group;
        this.pattern = Pattern.compile(regex, flags);
        if (group > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Pattern " + regex + " has no group " + group);
        }
    }

    @Override
    public Optional<String> extract(RawPage page) {
        Matcher m = pattern.matcher(page.text());
        if (!m.find()) return Optional.empty();
        String value = m.group(group);
        return Optional.of(value == null ? "" : value.trim());
    }

    @Override
    public RuleKind kind() {
        return RuleKind.ANCHORED_REGEX;
    }

    @Override
    public String toString() {
        return "AnchoredRegex(" + regex + ", group " + group + ")";
    }
}
