package com.invoice.sorter.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns extracted page text into trimmed, non-blank lines in reading order.
 */
public final class LineTokenizer {

    private LineTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        // PDF text stripping leaves NULs and non-breaking spaces that neither \s nor strip() remove.
        String cleaned = text.replace("\u0000", "").replace('\u00A0', ' ');

        List<String> lines = new ArrayList<>();
        for (String raw : cleaned.split("\\r?\\n|\\r")) {
            String line = raw.strip();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return List.copyOf(lines);
    }
}
