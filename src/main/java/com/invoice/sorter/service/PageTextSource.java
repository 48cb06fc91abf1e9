package com.invoice.sorter.service;

import com.invoice.sorter.exception.DocumentUnreadableException;
import com.invoice.sorter.model.RawPage;

import java.util.List;

/**
 * Produces the per-page lines of a document.
 */
public interface PageTextSource {

    /**
     * @throws DocumentUnreadableException when the document cannot be opened or has no text at all
     */
    List<RawPage> readPages(String documentId, byte[] content);
}
