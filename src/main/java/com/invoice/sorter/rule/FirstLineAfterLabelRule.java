package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Value printed on the line right below a label line, e.g. {@code Invoice #} / {@code 40211}.
 */
@Value
public class FirstLineAfterLabelRule implements FieldRule {

    String label;
    boolean caseInsensitive;

    @Override
    public Optional<String> extract(RawPage page) {
        List<String> lines = page.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean isLabel = caseInsensitive ? line.equalsIgnoreCase(label) : line.equals(label);
            if (isLabel) {
                return i + 1 < lines.size() ? Optional.of(lines.get(i + 1)) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public RuleKind kind() {
        return RuleKind.FIRST_LINE_AFTER_LABEL;
    }
}
