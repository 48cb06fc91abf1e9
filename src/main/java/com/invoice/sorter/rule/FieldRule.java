package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;

import java.util.Optional;

/**
 * Extracts one raw header value from a page.
 *
 * Implementations are immutable and total: they never throw for any page.
 * {@link Optional#empty()} means the rule did not apply (its anchor or label is not on the page);
 * an empty string means it applied but found nothing worth returning.
 */
public interface FieldRule {

    Optional<String> extract(RawPage page);

    RuleKind kind();
}
