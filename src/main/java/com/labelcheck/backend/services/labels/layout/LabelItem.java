package com.labelcheck.backend.services.labels.layout;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.labels.extraction.ExtractedFields;

import lombok.Builder;
import lombok.Value;

/**
 * One physical label or tag: the fields read from its grid cell plus where the cell was.
 * Serialized flat, fields first, then {@code page}, {@code position} and {@code image_ref}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LabelItem {

    @JsonIgnore
    ExtractedFields fields;

    /**
     * 1-based.
     */
    int page;

    /**
     * 0-based column index on the sheet.
     */
    int position;

    String imageRef;

    @JsonAnyGetter
    public Map<String, Object> fieldValues() {
        return fields == null ? Map.of() : fields.asMap();
    }

    public String styleNumber() {
        return field(FieldKey.STYLE_NUMBER);
    }

    public String size() {
        return field(FieldKey.SIZE);
    }

    public String color() {
        return field(FieldKey.COLOR);
    }

    /**
     * Code compared against the spreadsheet: checksum-valid UPC, then decoded barcode, then the unvalidated candidate.
     */
    @JsonProperty("match_upc")
    public String matchUpc() {
        for (FieldKey key : new FieldKey[] { FieldKey.UPC, FieldKey.BARCODE, FieldKey.UPC_CANDIDATE }) {
            String value = field(key);
            if (!value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    public boolean hasAnyField() {
        return fields != null && !fields.isEmpty();
    }

    /**
     * Fills style number and color from the sheet header when the label itself did not carry them.
     */
    public LabelItem resolvedAgainst(ParentInfo parent) {
        if (parent == null || fields == null) {
            return this;
        }
        ExtractedFields resolved = fields.toBuilder()
                .putIfAbsent(FieldKey.STYLE_NUMBER, parent.getStyleNumber())
                .putIfAbsent(FieldKey.COLOR, parent.getColor())
                .build();
        return toBuilder().fields(resolved).build();
    }

    private String field(FieldKey key) {
        return fields == null ? "" : fields.getOrEmpty(key);
    }
}
