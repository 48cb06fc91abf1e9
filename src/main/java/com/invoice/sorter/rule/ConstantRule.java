package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import lombok.Value;

import java.util.Optional;

@Value
public class ConstantRule implements FieldRule {

    String value;

    @Override
    public Optional<String> extract(RawPage page) {
        return Optional.of(value);
    }

    @Override
    public RuleKind kind() {
        return RuleKind.CONSTANT;
    }
}
