package com.invoice.sorter.service;

import com.invoice.sorter.model.HeaderField;
import com.invoice.sorter.model.LineItem;
import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.model.RecordTopology;

import java.util.List;
import java.util.Map;

/**
 * What the assembler needs from a vendor: header fields and line items for a page.
 */
public interface VendorParser {

    String key();

    String displayName();

    RecordTopology topology();

    boolean isItemized();

    Map<HeaderField, String> extractFields(RawPage page);

    List<LineItem> extractItems(RawPage page);
}
