package com.labelcheck.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.labelcheck.backend.services.labels.layout.GridLayout;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Crop grids per document type. Carrega de application.properties com prefixo "labelcheck.layout".
 *
 * Exemplo:
 * labelcheck.layout.care-label.columns=8
 * labelcheck.layout.care-label.column-width=88
 * labelcheck.layout.hang-tag.bottom-ratio=0.92
 * labelcheck.layout.image-output-dir=/tmp/labels
 */
@Data
@Validated
@ConfigurationProperties(prefix = "labelcheck.layout")
public class LayoutProperties {

    @Valid
    @NotNull
    private GridLayout careLabel = GridLayout.careLabelDefaults();

    @Valid
    @NotNull
    private GridLayout hangTag = GridLayout.hangTagDefaults();

    /**
     * When set, every retained crop is saved here as PNG.
     */
    private String imageOutputDir;
}
