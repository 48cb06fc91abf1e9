package com.invoice.sorter.rule;

import com.invoice.sorter.model.HeaderField;
import com.invoice.sorter.model.RecordTopology;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to parse one vendor's documents: header rules, the optional item window,
 * and whether each page or the whole document is an invoice.
 */
@Value
@Builder
public class VendorRuleSet {

    @NonNull
    String key;

    @NonNull
    String displayName;

    @NonNull
    RecordTopology topology;

    @Singular
    Map<HeaderField, FieldRule> fieldRules;

    ItemWindowSpec itemWindow;

    public Optional<ItemWindowSpec> itemWindow() {
        return Optional.ofNullable(itemWindow);
    }

    public FieldRule rule(HeaderField field) {
        FieldRule rule = fieldRules.get(field);
        if (rule == null) {
            throw new IllegalStateException("Vendor " + key + " defines no rule for " + field);
        }
        return rule;
    }
}
