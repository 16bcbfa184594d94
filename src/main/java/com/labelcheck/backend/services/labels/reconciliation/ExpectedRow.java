package com.labelcheck.backend.services.labels.reconciliation;

import com.labelcheck.backend.services.labels.util.NormalizeUtil;

/**
 * One spreadsheet line. Text keys are stored uppercase with collapsed whitespace, UPCs as digits only.
 */
public record ExpectedRow(String style, String size, String color, String careUpc, String hangUpc) {

    public ExpectedRow {
        style = NormalizeUtil.normalizeKey(style);
        size = NormalizeUtil.normalizeKey(size);
        color = NormalizeUtil.normalizeKey(color);
        careUpc = NormalizeUtil.digitsOnly(careUpc);
        hangUpc = NormalizeUtil.digitsOnly(hangUpc);
    }

    /**
     * Sheets with a single generic UPC column use it as the care-label UPC.
     */
    public static ExpectedRow of(String style, String size, String color, String careUpc, String hangUpc, String genericUpc) {
        String care = NormalizeUtil.digitsOnly(careUpc);
        if (care.isEmpty()) {
            care = NormalizeUtil.digitsOnly(genericUpc);
        }
        return new ExpectedRow(style, size, color, care, hangUpc);
    }
}
