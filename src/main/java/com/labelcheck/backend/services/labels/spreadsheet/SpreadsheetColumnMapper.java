package com.labelcheck.backend.services.labels.spreadsheet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Finds the expected-row columns by loose header names ("Care Label UPC", "RFID", "Style #", ...).
 */
public final class SpreadsheetColumnMapper {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private SpreadsheetColumnMapper() {
    }

    public static ColumnMapping map(List<String> headers) {
        List<String> keys = new ArrayList<>();
        for (String header : headers) {
            keys.add(normalizeHeader(header));
        }
        return new ColumnMapping(
                find(keys, "style"),
                find(keys, "size"),
                find(keys, "color"),
                find(keys, "carelabelupc", "careupc", "carelabel"),
                find(keys, "hangtagupc", "hangupc", "rfidupc", "hangtag", "rfid"),
                find(keys, "upc"));
    }

    /**
     * "Care Label UPC" => "carelabelupc"
     */
    public static String normalizeHeader(String header) {
        if (header == null) return "";
        return NON_ALPHANUMERIC.matcher(header.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    // First header (left to right) containing any of the keywords.
    private static int find(List<String> keys, String... keywords) {
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            if (key.isEmpty()) continue;
            for (String keyword : keywords) {
                if (key.contains(keyword)) {
                    return i;
                }
            }
        }
        return ColumnMapping.MISSING;
    }
}
