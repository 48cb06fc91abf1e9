package com.invoice.sorter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One assembled invoice. Text fields are never null; a field the rules could not find is {@code ""}.
 * {@code total} holds digits and a single decimal point only.
 */
@Value
@Builder
public class InvoiceRecord {

    String vendor;
    String invoiceNumber;
    String jobName;
    String date;
    String total;
    int page;

    @Singular
    List<LineItem> items;

    public String get(HeaderField field) {
        return switch (field) {
            case VENDOR -> vendor;
            case INVOICE_NUMBER -> invoiceNumber;
            case JOB_NAME -> jobName;
            case DATE -> date;
            case TOTAL -> total;
        };
    }
}
