package com.invoice.sorter.model;

import lombok.*;

import java.util.*;

/**
 * Response for one parsed document: the assembled invoices plus what the caller should review.
 */
@Data
public class DocumentParseResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String EMPTY = "EMPTY";
    public static final String UNREADABLE = "UNREADABLE";
    public static final String ERROR = "ERROR";

    private String documentId;                       // upload file name or caller supplied id
    private String vendorKey;                        // 'knife_river', 'farwest', ...
    private List<InvoiceRecord> invoices = new ArrayList<>();
    private List<String> fileNames = new ArrayList<>();
    private double completeness;
    private List<String> warnings = new ArrayList<>();
    private String status = SUCCESS;

    /**
     * Completeness is the share of header fields that came back non-empty, over all invoices.
     * Missing fields are listed as warnings, one per invoice and field.
     */
    public void calculateCompleteness() {
        int expected = 0;
        int present = 0;

        for (InvoiceRecord invoice : invoices) {
            for (HeaderField field : HeaderField.values()) {
                expected++;
                String value = invoice.get(field);
                if (value != null && !value.isEmpty()) {
                    present++;
                } else {
                    warnings.add("Missing " + field.jsonName() + " on page " + invoice.getPage());
                }
            }
        }

        this.completeness = expected == 0 ? 0.0 : (present * 100.0) / expected;
        if (invoices.isEmpty() && SUCCESS.equals(status)) {
            status = EMPTY;
        }
    }

    public static DocumentParseResult failed(String documentId, String vendorKey, String status, String reason) {
        DocumentParseResult r = new DocumentParseResult();
        r.documentId = documentId;
        r.vendorKey = vendorKey;
        r.status = status;
        r.warnings.add(reason);
        r.completeness = 0.0;
        return r;
    }
}
