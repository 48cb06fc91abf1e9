package com.invoice.sorter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.invoice.sorter.config.InvoiceParserProperties;
import com.invoice.sorter.exception.UnknownVendorException;

class VendorDispatcherTest {

    private VendorRegistry registry;
    private VendorDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new VendorRegistry(new FieldExtractionEngine(), new BlockExtractionEngine());
        InvoiceParserProperties properties = new InvoiceParserProperties();
        properties.getVendorAliases().put("KR", "knife_river");
        properties.getVendorAliases().put("landfill", "Missoula Landfill");
        dispatcher = new VendorDispatcher(registry, properties);
    }

    @Test
    void exactKeyIgnoringCaseAndPadding() {
        assertEquals("farwest", dispatcher.resolve("farwest").key());
        assertEquals("farwest", dispatcher.resolve("  FARWEST ").key());
    }

    @Test
    void folderNamesAreNormalised() {
        assertEquals("core_main", dispatcher.resolve("Core & Main").key());
        assertEquals("knife_river", dispatcher.resolve("Knife River").key());
        assertEquals("missoula_landfill", dispatcher.resolve("Missoula  Landfill").key());
    }

    @Test
    void aliasesResolveAfterNormalisation() {
        assertEquals("knife_river", dispatcher.resolve("kr").key());
        assertEquals("missoula_landfill", dispatcher.resolve("Landfill").key());
    }

    @Test
    void unknownVendorHasNoDefault() {
        UnknownVendorException e = assertThrows(UnknownVendorException.class, () -> dispatcher.resolve("acme"));
        assertEquals("acme", e.getVendorKey());

        assertThrows(UnknownVendorException.class, () -> dispatcher.resolve(""));
        assertThrows(UnknownVendorException.class, () -> dispatcher.resolve(null));
    }

    @Test
    void aliasToUnknownVendorFailsAtStartup() {
        InvoiceParserProperties properties = new InvoiceParserProperties();
        properties.getVendorAliases().put("acme", "acme_supply");

        assertThrows(IllegalStateException.class, () -> new VendorDispatcher(registry, properties));
    }

    @Test
    void normalize() {
        assertEquals("core_main", VendorDispatcher.normalize("Core & Main"));
        assertEquals("knife_river", VendorDispatcher.normalize(" knife__river "));
        assertEquals("a_b", VendorDispatcher.normalize("A-\tB"));
    }
}
