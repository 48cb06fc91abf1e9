package com.invoice.sorter.model;

/**
 * How a vendor's documents map to invoices.
 */
public enum RecordTopology {
    /** The whole document is one invoice; items are collected across pages. */
    PER_DOCUMENT,
    /** Every page is a complete invoice of its own. */
    PER_PAGE
}
