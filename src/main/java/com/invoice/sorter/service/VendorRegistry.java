package com.invoice.sorter.service;

import com.invoice.sorter.model.HeaderField;
import com.invoice.sorter.model.VendorSummary;
import com.invoice.sorter.rule.VendorRuleSet;
import com.invoice.sorter.vendor.SupportedVendor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Read-only table of vendor parsers keyed by vendor key, built once from {@link SupportedVendor}.
 */
@Service
@Slf4j
public class VendorRegistry {

    private final Map<String, VendorParser> parsers;

    public VendorRegistry(FieldExtractionEngine fieldEngine, BlockExtractionEngine blockEngine) {
        Map<String, VendorParser> table = new LinkedHashMap<>();

        for (SupportedVendor vendor : SupportedVendor.values()) {
            VendorRuleSet ruleSet = vendor.ruleSet();
            checkComplete(ruleSet);
            VendorParser previous = table.put(ruleSet.getKey(),
                    new RuleBasedVendorParser(ruleSet, fieldEngine, blockEngine));
            if (previous != null) {
                throw new IllegalStateException("Duplicate vendor key: " + ruleSet.getKey());
            }
        }

        this.parsers = Collections.unmodifiableMap(table);
        log.info("Loaded {} vendor rule sets: {}", parsers.size(), parsers.keySet());
    }

    public Optional<VendorParser> find(String key) {
        return Optional.ofNullable(parsers.get(key));
    }

    public Set<String> keys() {
        return parsers.keySet();
    }

    public List<VendorSummary> summaries() {
        return parsers.values().stream()
                .map(p -> new VendorSummary(p.key(), p.displayName(), p.topology(), p.isItemized()))
                .toList();
    }

    private static void checkComplete(VendorRuleSet ruleSet) {
        for (HeaderField field : HeaderField.values()) {
            // throws when the rule is missing
            ruleSet.rule(field);
        }
        ruleSet.itemWindow().ifPresent(spec -> {
            if (spec.getSlots().isEmpty()) {
                throw new IllegalStateException("Vendor " + ruleSet.getKey() + " declares an empty item window");
            }
        });
    }
}
