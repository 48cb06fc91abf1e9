package com.invoice.sorter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class LineItem {

    String date;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal extendedPrice;

    // vendor-specific identifiers, null when the vendor does not print them
    String ticketNumber;
    String truckCode;

    /** The window lines the item was built from, in slot order. */
    @Singular
    List<String> sourceLines;
}
