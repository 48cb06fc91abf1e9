package com.invoice.sorter.rule;

import com.invoice.sorter.pattern.LinePattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Shape of a vendor's repeating line-item block: a fixed run of lines, one validator per line.
 */
@Value
@Builder
public class ItemWindowSpec {

    @Singular
    List<ItemSlot> slots;

    /** Line that opens a window. Defaults to the first slot's validator. */
    LinePattern start;

    /** Lines containing any of these words (ignoring case) are skipped without closing the window. */
    @Singular("noiseWord")
    Set<String> noiseWords;

    /**
     * When true, a start line seen while a window is open throws the open window away and opens a new one.
     * Vendors whose start pattern also matches later slots must turn this off.
     */
    @Builder.Default
    boolean restartOnStart = true;

    public int getWindowLength() {
        return slots.size();
    }

    public boolean opensWindow(String line) {
        return (start != null ? start : slots.get(0).getValidator()).matches(line);
    }

    public boolean isNoise(String line) {
        return !noiseWords.isEmpty() && SkipMatch.CONTAINS.matchesAny(line, noiseWords);
    }
}
