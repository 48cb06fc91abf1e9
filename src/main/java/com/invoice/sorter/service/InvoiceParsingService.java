package com.invoice.sorter.service;

import com.invoice.sorter.exception.DocumentUnreadableException;
import com.invoice.sorter.model.DocumentParseResult;
import com.invoice.sorter.model.InvoiceRecord;
import com.invoice.sorter.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.*;

/**
 * Top-level orchestrator: read the document's pages, resolve the vendor, assemble the invoices.
 *
 * The vendor always comes from the caller (usually the folder the file was filed under);
 * documents are never sniffed to guess who sent them.
 */
@Service
@Slf4j
public class InvoiceParsingService {

    private final PageTextSource pageTextSource;
    private final VendorDispatcher dispatcher;
    private final InvoiceAssembler assembler;

    public InvoiceParsingService(PageTextSource pageTextSource,
                                 VendorDispatcher dispatcher,
                                 InvoiceAssembler assembler) {
        this.pageTextSource = pageTextSource;
        this.dispatcher = dispatcher;
        this.assembler = assembler;
    }

    public DocumentParseResult parsePdf(String vendorKey, MultipartFile file) {
        String documentId = documentId(file);
        List<RawPage> pages = pageTextSource.readPages(documentId, bytesOf(file, documentId));
        return parsePages(vendorKey, documentId, pages);
    }

    public DocumentParseResult parseText(String vendorKey, String documentId, List<String> pageTexts) {
        List<RawPage> pages = new ArrayList<>(pageTexts.size());
        for (int i = 0; i < pageTexts.size(); i++) {
            pages.add(RawPage.fromText(documentId, i + 1, pageTexts.get(i)));
        }
        return parsePages(vendorKey, documentId, pages);
    }

    /**
     * Parses several documents of the same vendor. A document that is unreadable or fails to parse is
     * reported in its own result and the rest of the batch carries on; an unknown vendor fails before
     * anything is read.
     */
    public List<DocumentParseResult> parseBatch(String vendorKey, List<MultipartFile> files) {
        VendorParser parser = dispatcher.resolve(vendorKey);

        List<DocumentParseResult> results = new ArrayList<>(files.size());
        int skipped = 0;
        int failed = 0;

        for (MultipartFile file : files) {
            try {
                results.add(parsePdf(parser.key(), file));
            } catch (DocumentUnreadableException e) {
                log.warn("Skipping unreadable document {}: {}", e.getDocumentId(), e.getMessage());
                results.add(DocumentParseResult.failed(
                        e.getDocumentId(), parser.key(), DocumentParseResult.UNREADABLE, e.getMessage()));
                skipped++;
            } catch (RuntimeException e) {
                String documentId = documentId(file);
                log.error("Parsing failed for {} in batch for {}", documentId, parser.key(), e);
                results.add(DocumentParseResult.failed(
                        documentId, parser.key(), DocumentParseResult.ERROR, String.valueOf(e.getMessage())));
                failed++;
            }
        }

        log.info("Batch for {}: {} document(s), {} unreadable, {} failed",
                parser.key(), files.size(), skipped, failed);
        return results;
    }

    private DocumentParseResult parsePages(String vendorKey, String documentId, List<RawPage> pages) {
        VendorParser parser = dispatcher.resolve(vendorKey);
        List<InvoiceRecord> invoices = assembler.parseDocument(parser.key(), pages);

        DocumentParseResult result = new DocumentParseResult();
        result.setDocumentId(documentId);
        result.setVendorKey(parser.key());
        result.setInvoices(new ArrayList<>(invoices));
        result.setFileNames(invoices.stream().map(InvoiceFileNames::forRecord).toList());
        result.calculateCompleteness();

        log.info("Parsed {} as {}: {} invoice(s), {} line item(s), {}% complete",
                documentId, parser.key(), invoices.size(),
                invoices.stream().mapToInt(r -> r.getItems().size()).sum(),
                Math.round(result.getCompleteness()));
        return result;
    }

    private static String documentId(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "upload.pdf" : name;
    }

    private static byte[] bytesOf(MultipartFile file, String documentId) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new DocumentUnreadableException(documentId, "Could not read upload " + documentId, e);
        }
    }
}
