package com.labelcheck.backend.services.labels.reconciliation;

import com.labelcheck.backend.enums.MatchLevel;
import com.labelcheck.backend.services.labels.layout.LabelItem;

/**
 * Outcome of pairing one row with one item collection. {@code item} is null when nothing matched.
 */
public record ItemMatch(
        MatchLevel match,
        String upcExpected,
        String upcActual,
        boolean upcMatches,
        LabelItem item
) {
    public static ItemMatch none(String upcExpected) {
        return new ItemMatch(MatchLevel.NONE, upcExpected, "", false, null);
    }
}
