package com.invoice.sorter.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class RawPageTest {

    @Test
    void rejectsBlankLinesAndZeroPageIndex() {
        assertThrows(IllegalArgumentException.class, () -> new RawPage("doc", 1, List.of("a", " ")));
        assertThrows(IllegalArgumentException.class, () -> new RawPage("doc", 0, List.of("a")));
    }

    @Test
    void linesAreTrimmedAndImmutable() {
        RawPage page = new RawPage("doc", 1, List.of(" Invoice # ", "12345"));

        assertEquals(List.of("Invoice #", "12345"), page.getLines());
        assertEquals("Invoice #\n12345", page.text());
        assertThrows(UnsupportedOperationException.class, () -> page.getLines().add("x"));
    }

    @Test
    void fromTextAcceptsThinSpaceLines() {
        RawPage page = RawPage.fromText("doc.pdf", 1, "Invoice #\n\u2009\n40211");

        assertEquals(List.of("Invoice #", "40211"), page.getLines());
    }

    @Test
    void mergeConcatenatesInOrderAndKeepsFirstIndex() {
        RawPage merged = RawPage.merge("doc", List.of(
                new RawPage("doc", 2, List.of("a", "b")),
                new RawPage("doc", 3, List.of("c"))));

        assertEquals(2, merged.getPageIndex());
        assertEquals(List.of("a", "b", "c"), merged.getLines());
    }
}
