package com.invoice.sorter.rule;

import com.invoice.sorter.model.ItemField;
import com.invoice.sorter.pattern.LinePattern;
import lombok.NonNull;
import lombok.Value;

/**
 * One position of an item window. {@code field} is null for slots that are validated but not kept.
 */
@Value
public class ItemSlot {

    @NonNull
    LinePattern validator;

    ItemField field;

    public static ItemSlot of(LinePattern validator, ItemField field) {
        return new ItemSlot(validator, field);
    }

    public static ItemSlot unmapped(LinePattern validator) {
        return new ItemSlot(validator, null);
    }
}
