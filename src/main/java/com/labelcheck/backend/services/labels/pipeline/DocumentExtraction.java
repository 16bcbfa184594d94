package com.labelcheck.backend.services.labels.pipeline;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.labelcheck.backend.services.labels.classification.ClassificationResult;
import com.labelcheck.backend.services.labels.layout.LabelItem;
import com.labelcheck.backend.services.labels.layout.ParentInfo;

/**
 * Everything read from one document. Only one of the item lists is filled, depending on the routing.
 */
public record DocumentExtraction(
        @JsonIgnore ClassificationResult classification,
        ParentInfo parentInfo,
        List<LabelItem> careLabels,
        List<LabelItem> hangTags
) {
    public DocumentExtraction {
        careLabels = careLabels == null ? List.of() : List.copyOf(careLabels);
        hangTags = hangTags == null ? List.of() : List.copyOf(hangTags);
        parentInfo = parentInfo == null ? ParentInfo.empty() : parentInfo;
    }

    public static DocumentExtraction careLabels(ClassificationResult classification, ParentInfo parentInfo, List<LabelItem> items) {
        return new DocumentExtraction(classification, parentInfo, items, List.of());
    }

    public static DocumentExtraction hangTags(ClassificationResult classification, ParentInfo parentInfo, List<LabelItem> items) {
        return new DocumentExtraction(classification, parentInfo, List.of(), items);
    }

    /**
     * Items with style number and color filled from this document's header where missing.
     */
    public List<LabelItem> resolvedCareLabels() {
        return careLabels.stream().map(item -> item.resolvedAgainst(parentInfo)).toList();
    }

    public List<LabelItem> resolvedHangTags() {
        return hangTags.stream().map(item -> item.resolvedAgainst(parentInfo)).toList();
    }
}
