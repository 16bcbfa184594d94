package com.labelcheck.backend.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Catalog-specific vocabulary the label rules match against.
 *
 * Exemplo:
 * labelcheck.catalog.brand-prefix=AV
 * labelcheck.catalog.colors=BLACK SOOT,SALSA DELIGHT
 * labelcheck.catalog.product-names[STRETCH WOVEN DRESS]=Stretch Woven Dress
 */
@ConfigurationProperties(prefix = "labelcheck.catalog")
public record CatalogProperties(
        String brandPrefix,
        List<String> colors,
        String manufacturer,
        String manufacturerLocation,
        Map<String, String> productNames
) {
    public CatalogProperties {
        if (brandPrefix == null || brandPrefix.isBlank()) {
            brandPrefix = "AV";
        }
        if (colors == null) {
            colors = List.of("BLACK SOOT", "SALSA DELIGHT");
        }
        if (manufacturer == null) {
            manufacturer = "r-pac International Corporation";
        }
        if (manufacturerLocation == null) {
            manufacturerLocation = "Taiwan";
        }
        if (productNames == null) {
            Map<String, String> defaults = new LinkedHashMap<>();
            defaults.put("STRETCH WOVEN DRESS", "Stretch Woven Dress");
            productNames = defaults;
        }
    }

    public static CatalogProperties defaults() {
        return new CatalogProperties(null, null, null, null, null);
    }
}
