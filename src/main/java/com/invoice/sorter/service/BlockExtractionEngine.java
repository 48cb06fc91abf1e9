package com.invoice.sorter.service;

import com.invoice.sorter.model.ItemField;
import com.invoice.sorter.model.LineItem;
import com.invoice.sorter.model.RawPage;
import com.invoice.sorter.rule.ItemSlot;
import com.invoice.sorter.rule.ItemWindowSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;

/**
 * Recognises repeating line-item blocks in a page's line sequence.
 *
 * The page is scanned top to bottom with two states:
 *
 *     SEEKING       no window open; a line matching the window start opens one
 *     ACCUMULATING  lines are buffered until the window holds one line per slot
 *
 * Noise lines are skipped in both states. A full window is validated slot by slot and either
 * becomes a {@link LineItem} or is dropped; nothing is coerced. After a dropped window the scan
 * resumes on the line following that window's first line, so an item behind a false start is
 * still found. While accumulating, a new start line resets the window unless the vendor
 * switched {@link ItemWindowSpec#isRestartOnStart()} off.
 */
@Service
@Slf4j
public class BlockExtractionEngine {

    private enum ScanState { SEEKING, ACCUMULATING }

    public List<LineItem> extract(RawPage page, ItemWindowSpec spec) {
        List<String> lines = page.getLines();
        List<LineItem> items = new ArrayList<>();
        List<String> window = new ArrayList<>(spec.getWindowLength());

        ScanState state = ScanState.SEEKING;
        int windowStart = -1;
        int i = 0;

        while (i < lines.size()) {
            String line = lines.get(i);

            if (spec.isNoise(line)) {
                i++;
                continue;
            }

            if (state == ScanState.SEEKING) {
                if (spec.opensWindow(line)) {
                    window.add(line);
                    windowStart = i;
                    state = ScanState.ACCUMULATING;
                }
            } else if (spec.isRestartOnStart() && spec.opensWindow(line)) {
                log.trace("Page {}: window at line {} restarted by '{}'", page.getPageIndex(), windowStart, line);
                window.clear();
                window.add(line);
                windowStart = i;
            } else {
                window.add(line);
            }
            i++;

            if (state == ScanState.ACCUMULATING && window.size() == spec.getWindowLength()) {
                Optional<LineItem> item = toLineItem(window, spec);
                if (item.isPresent()) {
                    items.add(item.get());
                } else {
                    log.debug("Page {}: discarded window {} starting at line {}",
                            page.getPageIndex(), window, windowStart);
                    i = windowStart + 1;
                }
                window.clear();
                state = ScanState.SEEKING;
            }
        }

        return items;
    }

    // ─── SLOT VALIDATION & MAPPING ─────────────────────────────────────

    private Optional<LineItem> toLineItem(List<String> window, ItemWindowSpec spec) {
        List<ItemSlot> slots = spec.getSlots();
        for (int s = 0; s < slots.size(); s++) {
            if (!slots.get(s).getValidator().matches(window.get(s))) {
                return Optional.empty();
            }
        }

        LineItem.LineItemBuilder item = LineItem.builder().sourceLines(window);
        for (int s = 0; s < slots.size(); s++) {
            ItemField field = slots.get(s).getField();
            if (field == null) continue;

            String value = window.get(s);
            if (field.isNumeric()) {
                BigDecimal number = parseNumber(value);
                if (number == null) return Optional.empty();
                applyNumber(item, field, number);
            } else {
                applyText(item, field, value);
            }
        }
        return Optional.of(item.build());
    }

    /** Strips unit suffixes and thousands separators: {@code "1,012.50 TN"} becomes 1012.50. */
    private BigDecimal parseNumber(String raw) {
        String digits = raw.replace(",", "").replaceAll("[^0-9.]", "");
        try {
            return digits.isEmpty() ? null : new BigDecimal(digits);
        } catch (NumberFormatException e) {
            log.debug("Slot value '{}' is not a number", raw);
            return null;
        }
    }

    private void applyNumber(LineItem.LineItemBuilder item, ItemField field, BigDecimal number) {
        switch (field) {
            case QUANTITY -> item.quantity(number);
            case UNIT_PRICE -> item.unitPrice(number);
            case EXTENDED_PRICE -> item.extendedPrice(number);
            default -> throw new IllegalStateException("Not a numeric item field: " + field);
        }
    }

    private void applyText(LineItem.LineItemBuilder item, ItemField field, String value) {
        switch (field) {
            case DATE -> item.date(value);
            case DESCRIPTION -> item.description(value);
            case TICKET_NUMBER -> item.ticketNumber(value);
            case TRUCK_CODE -> item.truckCode(value);
            default -> throw new IllegalStateException("Not a text item field: " + field);
        }
    }
}
