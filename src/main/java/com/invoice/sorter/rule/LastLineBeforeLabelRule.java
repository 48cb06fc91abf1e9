package com.invoice.sorter.rule;

import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.pattern.LinePattern;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds a label line and returns the nearest line around it that survives the skip filters.
 *
 * Used for job names, which vendors print next to a fixed marker ({@code ORIGINAL}, {@code Job Name})
 * but surrounded by other header noise. Returns empty when the label is missing and {@code ""}
 * when the label is there but no candidate qualifies.
 */
@Value
@Builder
public class LastLineBeforeLabelRule implements FieldRule {

    @NonNull
    LinePattern label;

    /** 1-based; the n-th line matching {@link #label} is used. */
    @Builder.Default
    int labelOccurrence = 1;

    @Builder.Default
    ScanDirection direction = ScanDirection.BACKWARD;

    /** Number of lines inspected from the label; 0 scans to the page edge. */
    @Builder.Default
    int maxDistance = 0;

    @Singular
    Set<String> skipWords;

    @Builder.Default
    SkipMatch skipMatch = SkipMatch.EXACT;

    /** Whole-line markers skipped whatever {@link #skipMatch} is, ignoring case. */
    @Singular
    Set<String> exactSkipWords;

    /** When no candidate follows the chosen label, move on to the next label line. */
    @Builder.Default
    boolean tryLaterOccurrences = false;

    LinePattern dateDetector;

    LinePattern codeDetector;

    /** When set, a candidate must also match this pattern. */
    LinePattern accept;

    @Override
    public Optional<String> extract(RawPage page) {
        List<String> lines = page.getLines();
        int labelIndex = findLabel(lines);
        if (labelIndex < 0) return Optional.empty();

        while (labelIndex >= 0) {
            String candidate = nearestCandidate(lines, labelIndex);
            if (candidate != null) return Optional.of(candidate);
            if (!tryLaterOccurrences) break;
            labelIndex = nextLabel(lines, labelIndex + 1);
        }
        return Optional.of("");
    }

    private String nearestCandidate(List<String> lines, int labelIndex) {
        int step = direction == ScanDirection.BACKWARD ? -1 : 1;
        int limit = maxDistance <= 0 ? lines.size() : maxDistance;

        for (int distance = 1; distance <= limit; distance++) {
            int idx = labelIndex + step * distance;
            if (idx < 0 || idx >= lines.size()) break;

            String candidate = lines.get(idx);
            if (qualifies(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private int findLabel(List<String> lines) {
        int seen = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (label.matches(lines.get(i)) && ++seen == labelOccurrence) {
                return i;
            }
        }
        return -1;
    }

    private int nextLabel(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (label.matches(lines.get(i))) return i;
        }
        return -1;
    }

    private boolean qualifies(String candidate) {
        if (!skipWords.isEmpty() && skipMatch.matchesAny(candidate, skipWords)) return false;
        if (!exactSkipWords.isEmpty() && SkipMatch.EXACT.matchesAny(candidate, exactSkipWords)) return false;
        if (dateDetector != null && dateDetector.matches(candidate)) return false;
        if (codeDetector != null && codeDetector.matches(candidate)) return false;
        return accept == null || accept.matches(candidate);
    }

    @Override
    public RuleKind kind() {
        return RuleKind.LAST_LINE_BEFORE_LABEL;
    }
}
