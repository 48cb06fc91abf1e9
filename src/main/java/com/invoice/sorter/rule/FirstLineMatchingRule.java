package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.pattern.LinePattern;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * First line on the page matching a pattern and containing none of the excluded words.
 */
@Value
public class FirstLineMatchingRule implements FieldRule {

    LinePattern pattern;
    Set<String> excludedWords;

    public FirstLineMatchingRule(LinePattern pattern, Set<String> excludedWords) {
        this.pattern = pattern;
        this.excludedWords = Set.copyOf(excludedWords);
    }

    @Override
    public Optional<String> extract(RawPage page) {
        for (String line : page.getLines()) {
            if (!pattern.matches(line)) continue;
            if (!excludedWords.isEmpty() && SkipMatch.CONTAINS.matchesAny(line, excludedWords)) continue;
            return Optional.of(line);
        }
        return Optional.empty();
    }

    @Override
    public RuleKind kind() {
        return RuleKind.FIRST_LINE_MATCHING;
    }
}
