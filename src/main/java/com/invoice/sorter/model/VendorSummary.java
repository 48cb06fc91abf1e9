package com.invoice.sorter.model;

import lombok.Value;

@Value
public class VendorSummary {
    String key;
    String displayName;
    RecordTopology topology;
    boolean itemized;
}
