package com.invoice.sorter.controller;

import com.invoice.sorter.exception.DocumentUnreadableException;
import com.invoice.sorter.exception.UnknownVendorException;
import com.invoice.sorter.model.DocumentParseResult;
import com.invoice.sorter.model.PageTextRequest;
import com.invoice.sorter.model.VendorSummary;
import com.invoice.sorter.service.InvoiceParsingService;
import com.invoice.sorter.service.VendorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/invoices")
@Slf4j
public class InvoiceParsingController {

    private final InvoiceParsingService parsingService;
    private final VendorRegistry vendorRegistry;

    public InvoiceParsingController(InvoiceParsingService parsingService, VendorRegistry vendorRegistry) {
        this.parsingService = parsingService;
        this.vendorRegistry = vendorRegistry;
    }

    @GetMapping("/vendors")
    public List<VendorSummary> vendors() {
        return vendorRegistry.summaries();
    }

    /**
     * Upload one invoice PDF filed under {@code vendorKey}.
     */
    @PostMapping("/{vendorKey}/extract")
    public ResponseEntity<DocumentParseResult> extract(@PathVariable String vendorKey,
                                                       @RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(parsingService.parsePdf(vendorKey, file));
        } catch (Exception e) {
            return failure(vendorKey, file.getOriginalFilename(), e);
        }
    }

    @PostMapping("/{vendorKey}/extract-batch")
    public ResponseEntity<List<DocumentParseResult>> extractBatch(@PathVariable String vendorKey,
                                                                  @RequestParam("files") List<MultipartFile> files) {
        try {
            return ResponseEntity.ok(parsingService.parseBatch(vendorKey, files));
        } catch (UnknownVendorException e) {
            log.warn("Batch rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(List.of(
                    DocumentParseResult.failed(null, vendorKey, DocumentParseResult.ERROR, e.getMessage())));
        }
    }

    /**
     * Parse text that was already extracted elsewhere, one string per page.
     */
    @PostMapping("/{vendorKey}/parse-text")
    public ResponseEntity<DocumentParseResult> parseText(@PathVariable String vendorKey,
                                                         @RequestBody PageTextRequest request) {
        try {
            return ResponseEntity.ok(parsingService.parseText(vendorKey, request.getDocumentId(), request.getPages()));
        } catch (Exception e) {
            return failure(vendorKey, request.getDocumentId(), e);
        }
    }

    private ResponseEntity<DocumentParseResult> failure(String vendorKey, String documentId, Exception e) {
        if (e instanceof UnknownVendorException) {
            return ResponseEntity.badRequest().body(
                    DocumentParseResult.failed(documentId, vendorKey, DocumentParseResult.ERROR, e.getMessage()));
        }
        if (e instanceof DocumentUnreadableException) {
            log.warn("Unreadable document {}: {}", documentId, e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
                    DocumentParseResult.failed(documentId, vendorKey, DocumentParseResult.UNREADABLE, e.getMessage()));
        }
        log.error("Parsing failed for {}", documentId, e);
        return ResponseEntity.internalServerError().body(
                DocumentParseResult.failed(documentId, vendorKey, DocumentParseResult.ERROR, e.getMessage()));
    }
}
