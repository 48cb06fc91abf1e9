package com.invoice.sorter.service;

import com.invoice.sorter.model.InvoiceRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * File name for the split-out PDF of an invoice: {@code Vendor_Job_Date_Invoice_Total.pdf}.
 */
public final class InvoiceFileNames {

    static final String NO_INVOICE_NUMBER = "NOINV";

    private InvoiceFileNames() {
    }

    public static String forRecord(InvoiceRecord record) {
        String invoice = clean(record.getInvoiceNumber());

        List<String> parts = new ArrayList<>();
        for (String part : List.of(
                clean(record.getVendor()),
                clean(record.getJobName()),
                clean(record.getDate()),
                invoice.isEmpty() ? NO_INVOICE_NUMBER : invoice,
                clean(record.getTotal()))) {
            if (!part.isEmpty()) parts.add(part);
        }
        return String.join("_", parts) + ".pdf";
    }

    static String clean(String value) {
        if (value == null) return "";
        return value.trim()
                .replace("/", "-")
                .replace(" ", "")
                .replaceAll("[\\\\/:*?\"<>|]", "");
    }
}
