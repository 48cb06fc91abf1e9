package com.invoice.sorter.service;

import com.invoice.sorter.model.HeaderField;
import com.invoice.sorter.model.LineItem;
import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.model.RecordTopology;
import com.invoice.sorter.rule.VendorRuleSet;

import java.util.List;
import java.util.Map;

/**
 * {@link VendorParser} driven entirely by a {@link VendorRuleSet}.
 */
public class RuleBasedVendorParser implements VendorParser {

    private final VendorRuleSet ruleSet;
    private final FieldExtractionEngine fieldEngine;
    private final BlockExtractionEngine blockEngine;

    public RuleBasedVendorParser(VendorRuleSet ruleSet,
                                 FieldExtractionEngine fieldEngine,
                                 BlockExtractionEngine blockEngine) {
        this.ruleSet = ruleSet;
        this.fieldEngine = fieldEngine;
        this.blockEngine = blockEngine;
    }

    @Override
    public String key() {
        return ruleSet.getKey();
    }

    @Override
    public String displayName() {
        return ruleSet.getDisplayName();
    }

    @Override
    public RecordTopology topology() {
        return ruleSet.getTopology();
    }

    @Override
    public boolean isItemized() {
        return ruleSet.itemWindow().isPresent();
    }

    @Override
    public Map<HeaderField, String> extractFields(RawPage page) {
        return fieldEngine.extract(page, ruleSet);
    }

    @Override
    public List<LineItem> extractItems(RawPage page) {
        return ruleSet.itemWindow()
                .map(spec -> blockEngine.extract(page, spec))
                .orElse(List.of());
    }

    public VendorRuleSet ruleSet() {
        return ruleSet;
    }
}
