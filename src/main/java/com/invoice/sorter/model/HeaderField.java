package com.invoice.sorter.model;

/**
 * Scalar invoice header fields every vendor rule set must define.
 */
public enum HeaderField {
    VENDOR("vendor"),
    INVOICE_NUMBER("invoiceNumber"),
    JOB_NAME("jobName"),
    DATE("date"),
    TOTAL("total");

    private final String jsonName;

    HeaderField(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }
}
