package com.labelcheck.backend.services.labels.spreadsheet;

/**
 * Column index per expected field, or {@link #MISSING}.
 */
public record ColumnMapping(int style, int size, int color, int careUpc, int hangUpc, int upc) {

    public static final int MISSING = -1;

    public boolean hasStyle() {
        return style != MISSING;
    }
}
