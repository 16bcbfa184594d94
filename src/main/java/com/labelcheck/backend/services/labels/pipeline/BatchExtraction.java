package com.labelcheck.backend.services.labels.pipeline;

import java.util.List;

import com.labelcheck.backend.services.labels.layout.LabelItem;

/**
 * Items of several documents pooled by kind, each already resolved against its own document header.
 */
public record BatchExtraction(List<LabelItem> careLabels, List<LabelItem> hangTags) {

    public BatchExtraction {
        careLabels = careLabels == null ? List.of() : List.copyOf(careLabels);
        hangTags = hangTags == null ? List.of() : List.copyOf(hangTags);
    }
}
