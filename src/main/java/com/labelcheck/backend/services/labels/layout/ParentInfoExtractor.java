package com.labelcheck.backend.services.labels.layout;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.labelcheck.backend.config.CatalogProperties;
import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.labels.extraction.ColorRule;
import com.labelcheck.backend.services.labels.extraction.ExtractedFields;
import com.labelcheck.backend.services.labels.extraction.LabelText;
import com.labelcheck.backend.services.pdf.LabelPage;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the sheet header from the first page: labelled header lines plus known catalog literals.
 */
@Slf4j
public class ParentInfoExtractor {

    private static final Pattern REFERENCE = header("Reference #:");
    private static final Pattern JOB_NUMBER = header("Job #:");
    private static final Pattern STYLE_NUMBER = header("Style #:");
    private static final Pattern PO_NUMBER = header("PO #:");
    private static final Pattern DATE = header("Date:");

    private final TextLayerReader textReader;
    private final CatalogProperties catalog;
    private final ColorRule colorRule;
    private final float zoom;

    public ParentInfoExtractor(TextLayerReader textReader, CatalogProperties catalog, float zoom) {
        this.textReader = textReader;
        this.catalog = catalog == null ? CatalogProperties.defaults() : catalog;
        this.colorRule = new ColorRule(this.catalog.colors());
        this.zoom = zoom > 0 ? zoom : 2.0f;
    }

    public ParentInfo extract(LabelPage firstPage) {
        if (firstPage == null) {
            return ParentInfo.empty();
        }
        String text = textReader.read(firstPage, null, zoom);
        ParentInfo info = extractFromText(text);
        log.debug("[Segmenter] Parent info page={}: {}", firstPage.pageNumber(), info);
        return info;
    }

    public ParentInfo extractFromText(String text) {
        String raw = text == null ? "" : text;
        ParentInfo.ParentInfoBuilder info = ParentInfo.builder()
                .reference(firstLine(REFERENCE, raw))
                .jobNumber(firstLine(JOB_NUMBER, raw))
                .styleNumber(firstLine(STYLE_NUMBER, raw))
                .poNumber(firstLine(PO_NUMBER, raw))
                .date(firstLine(DATE, raw));

        for (Map.Entry<String, String> product : catalog.productNames().entrySet()) {
            if (raw.contains(product.getKey())) {
                info.productName(product.getValue());
                break;
            }
        }

        String manufacturer = catalog.manufacturer();
        if (manufacturer != null && !manufacturer.isBlank() && raw.contains(manufacturer)) {
            info.manufacturer(manufacturer);
            info.manufacturerLocation(catalog.manufacturerLocation());
        }

        ExtractedFields.Builder color = ExtractedFields.builder();
        colorRule.apply(LabelText.of(raw), color);
        info.color(color.build().get(FieldKey.COLOR).orElse(null));

        return info.build();
    }

    private static Pattern header(String label) {
        return Pattern.compile(Pattern.quote(label) + "\\s*([^\\r\\n]+)");
    }

    private static String firstLine(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        String value = m.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
