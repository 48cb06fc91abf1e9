package com.invoice.sorter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.invoice.sorter.config.InvoiceParserProperties;
import com.invoice.sorter.exception.UnknownVendorException;
import com.invoice.sorter.model.InvoiceRecord;
import com.invoice.sorter.model.RawPage;

class InvoiceAssemblerTest {

    private InvoiceAssembler assembler;

    @BeforeEach
    void setUp() {
        VendorRegistry registry = new VendorRegistry(new FieldExtractionEngine(), new BlockExtractionEngine());
        assembler = new InvoiceAssembler(new VendorDispatcher(registry, new InvoiceParserProperties()));
    }

    private static RawPage knifeRiverPage(int index, String invoice, String job, String total) {
        return RawPage.fromText("kr.pdf", index, String.join("\n",
                "KNIFE RIVER",
                invoice,
                "09/08/25",
                job,
                "ORIGINAL",
                "TOTAL",
                total));
    }

    @Test
    void perPageVendorYieldsOneRecordPerPageInPageOrder() {
        List<InvoiceRecord> records = assembler.parseDocument("knife_river", List.of(
                knifeRiverPage(2, "968458", "PINE ST", "80.00"),
                knifeRiverPage(1, "968457", "GRANT CREEK", "1,025.28")));

        assertEquals(2, records.size());
        assertEquals(1, records.get(0).getPage());
        assertEquals("968457", records.get(0).getInvoiceNumber());
        assertEquals("GRANT CREEK", records.get(0).getJobName());
        assertEquals("1025.28", records.get(0).getTotal());
        assertEquals(2, records.get(1).getPage());
        assertEquals("PINE ST", records.get(1).getJobName());
    }

    @Test
    void perDocumentVendorMergesPages() {
        List<InvoiceRecord> records = assembler.parseDocument("Farwest", List.of(
                RawPage.fromText("fw.pdf", 1, "Invoice #\n40211\nJOB\nRattlesnake\n65.31\n641.34\n10/1/2025\n3/4 Base\n9.82"),
                RawPage.fromText("fw.pdf", 2, "20.00\n200.00\n10/2/2025\nPit Run\n10.00\nTotal\n$841.34")));

        assertEquals(1, records.size());
        InvoiceRecord record = records.get(0);
        assertEquals(1, record.getPage());
        assertEquals("40211", record.getInvoiceNumber());
        assertEquals("10/1/2025", record.getDate());
        assertEquals("841.34", record.getTotal());
        assertEquals(2, record.getItems().size());
    }

    @Test
    void missingFieldsAreEmptyStrings() {
        List<InvoiceRecord> records = assembler.parseDocument("core_main",
                List.of(RawPage.fromText("cm.pdf", 1, "Nothing useful")));

        InvoiceRecord record = records.get(0);
        assertEquals("Core & Main", record.getVendor());
        assertEquals("", record.getInvoiceNumber());
        assertEquals("", record.getJobName());
        assertEquals("", record.getDate());
        assertEquals("", record.getTotal());
        assertTrue(record.getItems().isEmpty());
    }

    @Test
    void noPagesNoRecordsButVendorStillChecked() {
        assertTrue(assembler.parseDocument("farwest", List.of()).isEmpty());
        assertThrows(UnknownVendorException.class, () -> assembler.parseDocument("acme", List.of()));
    }

    @Test
    void totalNormalisation() {
        RawPage page = new RawPage("doc.pdf", 1, List.of("x"));

        assertEquals("1025.28", assembler.normalizeTotal("$ 1,025.28", page));
        assertEquals("12.5", assembler.normalizeTotal("12.5", page));
        assertEquals("", assembler.normalizeTotal("1025", page));
        assertEquals("", assembler.normalizeTotal("12.50.1", page));
        assertEquals("", assembler.normalizeTotal("", page));
        assertEquals("", assembler.normalizeTotal(null, page));
    }
}
