package com.labelcheck.backend.services.labels.reconciliation;

import java.util.List;

public record ValidationSummary(int rows, int careLabelMatches, int hangTagMatches) {

    public static ValidationSummary of(List<MatchResult> results) {
        int care = 0;
        int hang = 0;
        for (MatchResult result : results) {
            if (result.careLabel().upcMatches()) care++;
            if (result.hangTag().upcMatches()) hang++;
        }
        return new ValidationSummary(results.size(), care, hang);
    }
}
