package com.labelcheck.backend.services.labels.extraction;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.labelcheck.backend.config.CatalogProperties;
import com.labelcheck.backend.enums.DocumentType;
import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.labels.extraction.LabelText.TextSource;

/**
 * Rule table for one document type. Care labels and hang tags share most rules and differ
 * only where their print layouts differ.
 */
public record LabelRuleSet(DocumentType documentType, List<FieldRule> rules) {

    private static final Pattern RN_PATTERN = Pattern.compile("RN#?\\s*(\\d+)");
    private static final Pattern COUNTRY_PATTERN = Pattern.compile("(?i)(?:Made In|Hecho En)\\s+([A-Za-z ]+)");
    private static final Pattern EXCLUSIVE_PATTERN = Pattern.compile("(?i)Exclusive\\s+of\\s+Decoration");

    public LabelRuleSet {
        rules = List.copyOf(rules);
    }

    public static LabelRuleSet careLabel(CatalogProperties catalog) {
        return new LabelRuleSet(DocumentType.CARE_LABEL, List.of(
                SizeRule.lenient(),
                new PatternFieldRule(FieldKey.RN_NUMBER, RN_PATTERN, TextSource.NORMALIZED),
                new UpcRule(),
                new PatternFieldRule(FieldKey.COUNTRY_OF_ORIGIN, COUNTRY_PATTERN, TextSource.RAW),
                new CompositionRule(),
                new PhraseFlagRule(FieldKey.EXCLUSIVE_OF_DECORATION, EXCLUSIVE_PATTERN),
                styleRule(catalog),
                new ColorRule(catalog.colors())
        ));
    }

    public static LabelRuleSet hangTag(CatalogProperties catalog) {
        return new LabelRuleSet(DocumentType.RFID, List.of(
                SizeRule.withRangeOnly(),
                new UpcRule(),
                new ColorRule(catalog.colors()),
                styleRule(catalog),
                new PatternFieldRule(FieldKey.RN_NUMBER, RN_PATTERN, TextSource.NORMALIZED)
        ));
    }

    // Brand prefix followed by alphanumerics with at least one digit, so brand words like "AVIA" don't count.
    static PatternFieldRule styleRule(CatalogProperties catalog) {
        String prefix = Pattern.quote(catalog.brandPrefix().trim().toUpperCase(Locale.ROOT));
        Pattern pattern = Pattern.compile("\\b(" + prefix + "(?=[A-Z0-9]*\\d)[A-Z0-9]+)\\b");
        return new PatternFieldRule(FieldKey.STYLE_NUMBER, pattern, TextSource.NORMALIZED);
    }
}
