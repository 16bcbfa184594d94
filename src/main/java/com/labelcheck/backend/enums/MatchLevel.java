package com.labelcheck.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Key combination used to pair a spreadsheet row with an extracted item,
 * declared in priority order (most specific first).
 */
public enum MatchLevel {
    STYLE_SIZE_COLOR("style+size+color"),
    STYLE_SIZE("style+size"),
    STYLE_COLOR("style+color"),
    STYLE("style"),
    NONE("none");

    private final String label;

    MatchLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
