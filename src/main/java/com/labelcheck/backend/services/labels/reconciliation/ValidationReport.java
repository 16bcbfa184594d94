package com.labelcheck.backend.services.labels.reconciliation;

import java.util.List;

public record ValidationReport(ValidationSummary summary, List<MatchResult> results) {

    public ValidationReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ValidationReport of(List<MatchResult> results) {
        return new ValidationReport(ValidationSummary.of(results), results);
    }
}
