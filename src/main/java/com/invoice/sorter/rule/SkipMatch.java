package com.invoice.sorter.rule;

import java.util.Locale;
import java.util.Set;

/**
 * How a candidate line is compared against a skip word list. Comparison ignores case.
 */
public enum SkipMatch {
    EXACT,
    PREFIX,
    CONTAINS;

    public boolean matchesAny(String line, Set<String> words) {
        String candidate = line.toLowerCase(Locale.ROOT);
        for (String word : words) {
            String w = word.toLowerCase(Locale.ROOT);
            boolean hit = switch (this) {
                case EXACT -> candidate.equals(w);
                case PREFIX -> candidate.startsWith(w);
                case CONTAINS -> candidate.contains(w);
            };
            if (hit) return true;
        }
        return false;
    }
}
