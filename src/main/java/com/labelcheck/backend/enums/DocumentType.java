package com.labelcheck.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    CARE_LABEL("care_label"),
    RFID("rfid"),
    UNKNOWN("unknown");

    private final String jsonName;

    DocumentType(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }
}
