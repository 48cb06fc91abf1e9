package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Tries rules in order. The first non-blank value wins; if every rule came back blank or absent,
 * a blank from an applicable rule is still preferred over absence.
 */
@Value
public class FirstOfRule implements FieldRule {

    List<FieldRule> rules;

    public FirstOfRule(List<FieldRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("FirstOf needs at least one rule");
        }
        this.rules = List.copyOf(rules);
    }

    @Override
    public Optional<String> extract(RawPage page) {
        Optional<String> fallback = Optional.empty();
        for (FieldRule rule : rules) {
            Optional<String> value = rule.extract(page);
            if (value.isEmpty()) continue;
            if (!value.get().isBlank()) return value;
            fallback = value;
        }
        return fallback;
    }

    @Override
    public RuleKind kind() {
        return RuleKind.FIRST_OF;
    }
}
