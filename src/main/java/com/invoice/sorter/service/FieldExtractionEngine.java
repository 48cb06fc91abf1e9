package com.invoice.sorter.service;

import com.invoice.sorter.model.HeaderField;
import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.rule.FieldRule;
import com.invoice.sorter.rule.VendorRuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@Slf4j
public class FieldExtractionEngine {

    /**
     * Applies every header rule of the vendor to the page.
     * A rule that does not apply yields an empty string; values are otherwise returned as found.
     */
    public Map<HeaderField, String> extract(RawPage page, VendorRuleSet ruleSet) {
        Map<HeaderField, String> fields = new EnumMap<>(HeaderField.class);

        for (HeaderField field : HeaderField.values()) {
            FieldRule rule = ruleSet.rule(field);
            Optional<String> value = rule.extract(page);

            if (value.isEmpty()) {
                log.debug("{} page {}: {} rule {} did not apply",
                        ruleSet.getKey(), page.getPageIndex(), field, rule.kind());
            } else if (value.get().isEmpty()) {
                log.debug("{} page {}: {} rule {} found no value",
                        ruleSet.getKey(), page.getPageIndex(), field, rule.kind());
            }
            fields.put(field, value.map(String::trim).orElse(""));
        }

        return fields;
    }
}
