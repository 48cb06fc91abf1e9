package com.invoice.sorter.rule;

public enum RuleKind {
    ANCHORED_REGEX,
    FIRST_LINE_AFTER_LABEL,
    LAST_LINE_BEFORE_LABEL,
    MAX_NUMERIC_MATCH,
    LAST_NUMERIC_MATCH,
    FIRST_LINE_MATCHING,
    FIRST_OF,
    CONSTANT
}
