package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Greatest amount on the page; the earliest one wins a tie. {@code ""} when the page has no amounts.
 */
public final class MaxNumericMatchRule extends NumericMatchRule {

    public MaxNumericMatchRule(String regex, int group) {
        super(regex, group);
    }

    @Override
    public Optional<String> extract(RawPage page) {
        String best = "";
        BigDecimal bestValue = null;

        for (String amount : collectAmounts(page)) {
            BigDecimal value;
            try {
                value = new BigDecimal(amount);
            } catch (NumberFormatException e) {
                continue; // a loose pattern matched something like "1.2.3"
            }
            if (bestValue == null || value.compareTo(bestValue) > 0) {
                bestValue = value;
                best = amount;
            }
        }
        return Optional.of(best);
    }

    @Override
    public RuleKind kind() {
        return RuleKind.MAX_NUMERIC_MATCH;
    }
}
