package com.labelcheck.backend.services.labels.extraction;

public record CompositionEntry(int percent, String material) {
    public CompositionEntry {
        if (percent < 0 || percent > 100) throw new IllegalArgumentException("percent must be between 0 and 100");
        if (material == null || material.isBlank()) throw new IllegalArgumentException("material is required");
    }
}
