package com.invoice.sorter.service;

import com.invoice.sorter.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns a document's pages into invoice records with the vendor's rules.
 *
 * Whether a document yields one record or one per page is the vendor's {@link RecordTopology};
 * it is never guessed from the content. The result is always a list in page order, even for a
 * single invoice.
 */
@Service
@Slf4j
public class InvoiceAssembler {

    private static final Pattern CLEAN_TOTAL = Pattern.compile("\\d+\\.\\d+");

    private final VendorDispatcher dispatcher;

    public InvoiceAssembler(VendorDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public List<InvoiceRecord> parseDocument(String vendorKey, List<RawPage> pages) {
        VendorParser parser = dispatcher.resolve(vendorKey);
        if (pages == null || pages.isEmpty()) return List.of();

        List<RawPage> ordered = new ArrayList<>(pages);
        ordered.sort(Comparator.comparingInt(RawPage::getPageIndex));

        List<InvoiceRecord> records = switch (parser.topology()) {
            case PER_PAGE -> ordered.stream()
                    .map(page -> assemble(parser, page))
                    .toList();
            case PER_DOCUMENT -> List.of(
                    assemble(parser, RawPage.merge(ordered.get(0).getDocumentId(), ordered)));
        };

        log.debug("{}: {} page(s) -> {} invoice(s)", parser.key(), ordered.size(), records.size());
        return records;
    }

    private InvoiceRecord assemble(VendorParser parser, RawPage page) {
        Map<HeaderField, String> fields = parser.extractFields(page);
        List<LineItem> items = parser.extractItems(page);

        return InvoiceRecord.builder()
                .vendor(fields.get(HeaderField.VENDOR))
                .invoiceNumber(fields.get(HeaderField.INVOICE_NUMBER))
                .jobName(fields.get(HeaderField.JOB_NAME))
                .date(fields.get(HeaderField.DATE))
                .total(normalizeTotal(fields.get(HeaderField.TOTAL), page))
                .page(page.getPageIndex())
                .items(items)
                .build();
    }

    /**
     * Drops currency sign, thousands separators and spaces. Whatever is still not
     * {@code digits.digits} is reported and left out.
     */
    String normalizeTotal(String raw, RawPage page) {
        if (raw == null || raw.isEmpty()) return "";

        String cleaned = raw.replace("$", "").replace(",", "").replaceAll("\\s+", "");
        if (CLEAN_TOTAL.matcher(cleaned).matches()) {
            return cleaned;
        }

        log.warn("Dropping malformed total '{}' on page {} of {}", raw, page.getPageIndex(), page.getDocumentId());
        return "";
    }
}
