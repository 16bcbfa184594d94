package com.labelcheck.backend.services.labels.layout;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configured crop grid of a print sheet: equal-width columns inside a horizontal band.
 * Geometry is in page points; ratios are fractions of the page height.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridLayout {

    @Min(1)
    @Builder.Default
    private int columns = 8;

    /**
     * The first column of a sheet usually carries printing instructions, not product data.
     */
    @Builder.Default
    private boolean skipFirstColumn = true;

    @Positive
    @Builder.Default
    private float zoom = 3.0f;

    /**
     * Null or non-positive means page width / columns.
     */
    private Float columnWidth;

    @Builder.Default
    private float leftOffset = 0f;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private float topRatio = 0f;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private float bottomRatio = 1f;

    public static GridLayout careLabelDefaults() {
        return GridLayout.builder()
                .columnWidth(88f)
                .leftOffset(45f)
                .topRatio(0.22f)
                .bottomRatio(0.61f)
                .build();
    }

    public static GridLayout hangTagDefaults() {
        return GridLayout.builder()
                .topRatio(0.22f)
                .bottomRatio(0.92f)
                .build();
    }

    public int startIndex() {
        return skipFirstColumn ? 1 : 0;
    }

    public float effectiveColumnWidth(float pageWidth) {
        if (columnWidth != null && columnWidth > 0) {
            return columnWidth;
        }
        return columns > 0 ? pageWidth / columns : 0f;
    }
}
