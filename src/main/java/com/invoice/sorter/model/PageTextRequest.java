package com.invoice.sorter.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Already-extracted page texts, one entry per page in page order.
 */
@Data
@NoArgsConstructor
public class PageTextRequest {
    private String documentId;
    private List<String> pages = new ArrayList<>();
}
