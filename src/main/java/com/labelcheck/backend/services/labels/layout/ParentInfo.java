package com.labelcheck.backend.services.labels.layout;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Header data printed once per sheet and shared by every label on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParentInfo {
    private String reference;
    private String jobNumber;
    private String styleNumber;
    private String poNumber;
    private String date;
    private String productName;
    private String manufacturer;
    private String manufacturerLocation;
    private String color;

    public static ParentInfo empty() {
        return new ParentInfo();
    }
}
