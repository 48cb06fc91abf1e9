package com.invoice.sorter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import com.invoice.sorter.config.InvoiceParserProperties;
import com.invoice.sorter.exception.DocumentUnreadableException;
import com.invoice.sorter.exception.UnknownVendorException;
import com.invoice.sorter.model.DocumentParseResult;
import com.invoice.sorter.model.RawPage;

class InvoiceParsingServiceTest {

    private static final String KNIFE_RIVER_PAGE = String.join("\n",
            "KNIFE RIVER", "968457", "09/08/25", "GRANT CREEK", "ORIGINAL",
            "123456", "Base Rock", "ABC1", "12.50 TN", "9.82", "122.75",
            "TOTAL", "122.75");

    private PageTextSource pageTextSource;
    private InvoiceParsingService service;

    @BeforeEach
    void setUp() {
        pageTextSource = mock(PageTextSource.class);
        VendorRegistry registry = new VendorRegistry(new FieldExtractionEngine(), new BlockExtractionEngine());
        VendorDispatcher dispatcher = new VendorDispatcher(registry, new InvoiceParserProperties());
        service = new InvoiceParsingService(pageTextSource, dispatcher, new InvoiceAssembler(dispatcher));
    }

    private static MockMultipartFile pdf(String name) {
        return new MockMultipartFile("files", name, "application/pdf", new byte[] {1, 2, 3});
    }

    @Test
    void parseTextBuildsFileNamesAndFullCompleteness() {
        DocumentParseResult result = service.parseText("Knife River", "kr.pdf", List.of(KNIFE_RIVER_PAGE));

        assertThat(result.getStatus()).isEqualTo(DocumentParseResult.SUCCESS);
        assertThat(result.getVendorKey()).isEqualTo("knife_river");
        assertThat(result.getInvoices()).hasSize(1);
        assertThat(result.getInvoices().get(0).getItems()).hasSize(1);
        assertThat(result.getFileNames()).containsExactly("KnifeRiver_GRANTCREEK_09-08-25_968457_122.75.pdf");
        assertThat(result.getCompleteness()).isEqualTo(100.0);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void parsePdfReadsPagesFromSource() {
        given(pageTextSource.readPages(eq("kr.pdf"), any()))
                .willReturn(List.of(RawPage.fromText("kr.pdf", 1, KNIFE_RIVER_PAGE)));

        DocumentParseResult result = service.parsePdf("knife_river", pdf("kr.pdf"));

        assertThat(result.getDocumentId()).isEqualTo("kr.pdf");
        assertThat(result.getInvoices()).extracting("invoiceNumber").containsExactly("968457");
    }

    @Test
    void batchCarriesOnPastUnreadableDocument() {
        given(pageTextSource.readPages(eq("scan.pdf"), any()))
                .willThrow(new DocumentUnreadableException("scan.pdf", "Document scan.pdf has no extractable text"));
        given(pageTextSource.readPages(eq("kr.pdf"), any()))
                .willReturn(List.of(RawPage.fromText("kr.pdf", 1, KNIFE_RIVER_PAGE)));

        List<DocumentParseResult> results = service.parseBatch("knife_river",
                List.<MultipartFile>of(pdf("scan.pdf"), pdf("kr.pdf")));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).getStatus()).isEqualTo(DocumentParseResult.UNREADABLE);
        assertThat(results.get(0).getWarnings()).containsExactly("Document scan.pdf has no extractable text");
        assertThat(results.get(1).getStatus()).isEqualTo(DocumentParseResult.SUCCESS);
    }

    @Test
    void batchCarriesOnPastDocumentThatFailsToParse() {
        given(pageTextSource.readPages(eq("broken.pdf"), any()))
                .willThrow(new IllegalArgumentException("Blank line on page 1 of broken.pdf"));
        given(pageTextSource.readPages(eq("kr.pdf"), any()))
                .willReturn(List.of(RawPage.fromText("kr.pdf", 1, KNIFE_RIVER_PAGE)));

        List<DocumentParseResult> results = service.parseBatch("knife_river",
                List.<MultipartFile>of(pdf("broken.pdf"), pdf("kr.pdf")));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).getStatus()).isEqualTo(DocumentParseResult.ERROR);
        assertThat(results.get(0).getDocumentId()).isEqualTo("broken.pdf");
        assertThat(results.get(0).getWarnings()).containsExactly("Blank line on page 1 of broken.pdf");
        assertThat(results.get(1).getStatus()).isEqualTo(DocumentParseResult.SUCCESS);
        assertThat(results.get(1).getInvoices()).hasSize(1);
    }

    @Test
    void batchForUnknownVendorReadsNothing() {
        assertThrows(UnknownVendorException.class,
                () -> service.parseBatch("acme", List.<MultipartFile>of(pdf("a.pdf"))));
        verify(pageTextSource, never()).readPages(any(), any());
    }

    @Test
    void pagesWithNoFieldsAreReportedAsWarnings() {
        DocumentParseResult result = service.parseText("core_main", "cm.pdf", List.of("Nothing useful"));

        assertThat(result.getCompleteness()).isEqualTo(20.0);
        assertThat(result.getWarnings()).contains("Missing invoiceNumber on page 1", "Missing total on page 1");
        assertThat(result.getFileNames()).containsExactly("Core&Main_NOINV.pdf");
    }

    @Test
    void documentWithoutPagesIsEmpty() {
        DocumentParseResult result = service.parseText("farwest", "fw.pdf", List.of());

        assertThat(result.getStatus()).isEqualTo(DocumentParseResult.EMPTY);
        assertThat(result.getInvoices()).isEmpty();
    }
}
