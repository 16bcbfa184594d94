package com.labelcheck.backend.services.labels.extraction;

import com.labelcheck.backend.services.labels.util.NormalizeUtil;

/**
 * Text of one region in both forms the rules need: raw keeps line breaks, normalized is single-spaced ASCII.
 */
public record LabelText(String raw, String normalized) {

    public static LabelText of(String raw) {
        String safe = raw == null ? "" : raw;
        return new LabelText(safe, NormalizeUtil.normalize(safe));
    }

    public String source(TextSource source) {
        return source == TextSource.RAW ? raw : normalized;
    }

    public enum TextSource {
        RAW,
        NORMALIZED
    }
}
