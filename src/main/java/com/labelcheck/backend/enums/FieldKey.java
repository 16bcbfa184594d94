package com.labelcheck.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldKey {
    SIZE("size"),
    SIZE_RANGE("size_range"),
    RN_NUMBER("rn_number"),
    UPC("upc"),
    UPC_CANDIDATE("upc_candidate"),
    BARCODE("barcode"),
    COUNTRY_OF_ORIGIN("country_of_origin"),
    COMPOSITION("composition"),
    EXCLUSIVE_OF_DECORATION("exclusive_of_decoration"),
    STYLE_NUMBER("style_number"),
    COLOR("color"),
    COLOR_CODE("color_code");

    private final String jsonName;

    FieldKey(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }
}
