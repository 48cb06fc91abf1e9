package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;

import java.util.List;
import java.util.Optional;

/**
 * Last amount printed on the page, whatever its size. For vendors that print the grand total last.
 */
public final class LastNumericMatchRule extends NumericMatchRule {

    public LastNumericMatchRule(String regex, int group) {
        super(regex, group);
    }

    @Override
    public Optional<String> extract(RawPage page) {
        List<String> amounts = collectAmounts(page);
        return Optional.of(amounts.isEmpty() ? "" : amounts.get(amounts.size() - 1));
    }

    @Override
    public RuleKind kind() {
        return RuleKind.LAST_NUMERIC_MATCH;
    }
}
