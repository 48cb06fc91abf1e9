package com.invoice.sorter.model;

import com.invoice.sorter.pattern.LineTokenizer;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracted text of one document page as trimmed, non-blank lines.
 * Page indexes are 1-based.
 */
@Value
public class RawPage {

    String documentId;
    int pageIndex;
    List<String> lines;

    public RawPage(String documentId, int pageIndex, List<String> lines) {
        if (pageIndex < 1) {
            throw new IllegalArgumentException("Page index is 1-based, got " + pageIndex);
        }
        if (lines == null) {
            throw new IllegalArgumentException("Page lines must not be null");
        }
        List<String> trimmed = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                throw new IllegalArgumentException(
                        "Blank line on page " + pageIndex + " of " + documentId);
            }
            trimmed.add(line.strip());
        }
        this.documentId = documentId;
        this.pageIndex = pageIndex;
        this.lines = List.copyOf(trimmed);
    }

    public static RawPage fromText(String documentId, int pageIndex, String text) {
        return new RawPage(documentId, pageIndex, LineTokenizer.tokenize(text));
    }

    /**
     * Concatenates pages into a single page carrying the first page's index.
     */
    public static RawPage merge(String documentId, List<RawPage> pages) {
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge for " + documentId);
        }
        List<String> all = new ArrayList<>();
        for (RawPage page : pages) {
            all.addAll(page.getLines());
        }
        return new RawPage(documentId, pages.get(0).getPageIndex(), all);
    }

    /** Lines joined with {@code \n}, for rules whose anchor and value span a line break. */
    public String text() {
        return String.join("\n", lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
