package com.invoice.sorter.rule;

public enum ScanDirection {
    /** Lines above the label, nearest first. */
    BACKWARD,
    /** Lines below the label, nearest first. */
    FORWARD
}
