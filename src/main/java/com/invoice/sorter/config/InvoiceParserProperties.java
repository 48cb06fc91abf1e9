package com.invoice.sorter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "invoice-parser")
public class InvoiceParserProperties {

    /**
     * Extra vendor keys, e.g. folder names used by the scanning side, mapped to a registered vendor key.
     */
    private Map<String, String> vendorAliases = new LinkedHashMap<>();

    private Pdf pdf = new Pdf();

    @Data
    public static class Pdf {

        /**
         * Sort text by page position instead of content stream order. Item windows assume stream order.
         */
        private boolean sortByPosition = false;

        /**
         * Pages read per document; 0 reads all of them.
         */
        private int maxPages = 0;
    }
}
