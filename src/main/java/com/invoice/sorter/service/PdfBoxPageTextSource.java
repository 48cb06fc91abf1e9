package com.invoice.sorter.service;

import com.invoice.sorter.config.InvoiceParserProperties;
import com.invoice.sorter.exception.DocumentUnreadableException;
import com.invoice.sorter.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.RandomAccessReadBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text-layer extraction with PDFBox, one {@link RawPage} per PDF page.
 * Image-only PDFs have no text layer and are reported as unreadable; there is no OCR.
 */
@Component
@Slf4j
public class PdfBoxPageTextSource implements PageTextSource {

    private final InvoiceParserProperties properties;

    public PdfBoxPageTextSource(InvoiceParserProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<RawPage> readPages(String documentId, byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentUnreadableException(documentId, "Document " + documentId + " is empty");
        }

        try (PDDocument doc = Loader.loadPDF(new RandomAccessReadBuffer(content))) {
            int pageCount = doc.getNumberOfPages();
            int maxPages = properties.getPdf().getMaxPages();
            int last = maxPages > 0 ? Math.min(pageCount, maxPages) : pageCount;

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(properties.getPdf().isSortByPosition());

            List<RawPage> pages = new ArrayList<>(last);
            boolean anyText = false;
            for (int p = 1; p <= last; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                RawPage page = RawPage.fromText(documentId, p, stripper.getText(doc));
                anyText |= !page.isEmpty();
                pages.add(page);
            }

            if (!anyText) {
                throw new DocumentUnreadableException(documentId,
                        "Document " + documentId + " has no extractable text");
            }
            log.debug("Read {} of {} page(s) from {}", last, pageCount, documentId);
            return pages;
        } catch (IOException e) {
            throw new DocumentUnreadableException(documentId,
                    "Could not read PDF " + documentId + ": " + e.getMessage(), e);
        }
    }
}
