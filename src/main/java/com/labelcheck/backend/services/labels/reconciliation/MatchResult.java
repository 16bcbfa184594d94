package com.labelcheck.backend.services.labels.reconciliation;

public record MatchResult(ExpectedRow row, ItemMatch careLabel, ItemMatch hangTag) {
}
