package com.invoice.sorter.model;

/**
 * Line item fields a window slot can be mapped to.
 */
public enum ItemField {
    DATE(false),
    DESCRIPTION(false),
    QUANTITY(true),
    UNIT_PRICE(true),
    EXTENDED_PRICE(true),
    TICKET_NUMBER(false),
    TRUCK_CODE(false);

    private final boolean numeric;

    ItemField(boolean numeric) {
        this.numeric = numeric;
    }

    public boolean isNumeric() {
        return numeric;
    }
}
