package com.invoice.sorter.exception;

/**
 * Thrown when a vendor key resolves to no registered rule set.
 */
public class UnknownVendorException extends RuntimeException {

    private final String vendorKey;

    public UnknownVendorException(String vendorKey) {
        super("No parser rules registered for vendor '" + vendorKey + "'");
        this.vendorKey = vendorKey;
    }

    public String getVendorKey() {
        return vendorKey;
    }
}
