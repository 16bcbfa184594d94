package com.labelcheck.backend.services.labels.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.labelcheck.backend.config.CatalogProperties;
import com.labelcheck.backend.enums.DocumentType;
import com.labelcheck.backend.enums.FieldKey;

class FieldExtractorTest {

    private final LabelExtractorFactory factory = new LabelExtractorFactory(CatalogProperties.defaults());
    private final LabelExtractionStrategy careLabel = factory.careLabel();
    private final LabelExtractionStrategy hangTag = factory.hangTag();

    @Test
    void careLabelColumn_withValidUpc() {
        ExtractedFields fields = careLabel.extractFields("L (10-12) RN#12345 UPC 036000291452");

        assertEquals(Optional.of("L"), fields.get(FieldKey.SIZE));
        assertEquals(Optional.of("10-12"), fields.get(FieldKey.SIZE_RANGE));
        assertEquals(Optional.of("12345"), fields.get(FieldKey.RN_NUMBER));
        assertEquals(Optional.of("036000291452"), fields.get(FieldKey.UPC));
        assertFalse(fields.has(FieldKey.UPC_CANDIDATE));
    }

    @Test
    void careLabelColumn_withBadCheckDigit_keepsCandidate() {
        ExtractedFields fields = careLabel.extractFields("L (10-12) RN#12345 UPC 036000291453");

        assertEquals(Optional.of("L"), fields.get(FieldKey.SIZE));
        assertEquals(Optional.of("036000291453"), fields.get(FieldKey.UPC_CANDIDATE));
        assertFalse(fields.has(FieldKey.UPC));
    }

    @Test
    void careLabelColumn_ean13() {
        ExtractedFields fields = careLabel.extractFields("M (8-10)\nEAN 1234567890128");

        assertEquals(Optional.of("1234567890128"), fields.get(FieldKey.UPC));
    }

    @Test
    void careLabelColumn_fullText() {
        String text = String.join("\n",
                "AV12345BS",
                "L (10-12)",
                "RN#12345",
                "UPC 036000291452",
                "Made In China",
                "60% Cotton",
                "40% Polyester",
                "Exclusive of Decoration",
                "BLACK  SOOT 001");

        ExtractedFields fields = careLabel.extractFields(text);

        assertEquals(Optional.of("AV12345BS"), fields.get(FieldKey.STYLE_NUMBER));
        assertEquals(Optional.of("China"), fields.get(FieldKey.COUNTRY_OF_ORIGIN));
        assertEquals(List.of(new CompositionEntry(60, "Cotton"), new CompositionEntry(40, "Polyester")),
                fields.composition());
        assertTrue(fields.isExclusiveOfDecoration());
        assertEquals(Optional.of("BLACK SOOT"), fields.get(FieldKey.COLOR));
        assertEquals(Optional.of("001"), fields.get(FieldKey.COLOR_CODE));
        assertEquals(Optional.of("036000291452"), fields.get(FieldKey.UPC));
    }

    @Test
    void spanishCountryAndCompositionWithSymbols() {
        ExtractedFields fields = careLabel.extractFields("Hecho En Vietnam\n95% Rayon/Viscose;\n5% Spandex.");

        assertEquals(Optional.of("Vietnam"), fields.get(FieldKey.COUNTRY_OF_ORIGIN));
        assertEquals(List.of(new CompositionEntry(95, "Rayon/Viscose"), new CompositionEntry(5, "Spandex")),
                fields.composition());
    }

    @Test
    void numericSize_mapsToLetter() {
        ExtractedFields fields = careLabel.extractFields("SIZE 8-10");

        assertEquals(Optional.of("M"), fields.get(FieldKey.SIZE));
        assertEquals(Optional.of("8-10"), fields.get(FieldKey.SIZE_RANGE));
    }

    @Test
    void compositionPercentages_areNotSizes() {
        ExtractedFields fields = careLabel.extractFields("60% Cotton\n40% Polyester");

        assertFalse(fields.has(FieldKey.SIZE));
        assertFalse(fields.has(FieldKey.SIZE_RANGE));
        assertEquals(2, fields.composition().size());

        assertFalse(careLabel.extractFields("95 % Rayon").has(FieldKey.SIZE_RANGE));
    }

    @Test
    void rnFollowedByBareCode_mergesIntoOneNumber() {
        // Digit runs separated only by spaces are rejoined, so the RN swallows the code after it.
        ExtractedFields fields = careLabel.extractFields("L (10-12) RN#12345 1234567890128");

        assertEquals(Optional.of("L"), fields.get(FieldKey.SIZE));
        assertEquals(Optional.of("10-12"), fields.get(FieldKey.SIZE_RANGE));
        assertEquals(Optional.of("123451234567890128"), fields.get(FieldKey.RN_NUMBER));
        assertFalse(fields.has(FieldKey.UPC));
        assertFalse(fields.has(FieldKey.UPC_CANDIDATE));
    }

    @Test
    void unmappedNumericSize_keepsRangeOnly() {
        ExtractedFields fields = careLabel.extractFields("SIZE 7");

        assertFalse(fields.has(FieldKey.SIZE));
        assertEquals(Optional.of("7"), fields.get(FieldKey.SIZE_RANGE));
    }

    @Test
    void longestLetterSizeWins() {
        ExtractedFields fields = careLabel.extractFields("XXL (20)");

        assertEquals(Optional.of("XXL"), fields.get(FieldKey.SIZE));
        assertEquals(Optional.of("20"), fields.get(FieldKey.SIZE_RANGE));
    }

    @Test
    void brandWordIsNotAStyleNumber() {
        ExtractedFields fields = careLabel.extractFields("AVIA AV9876XY");

        assertEquals(Optional.of("AV9876XY"), fields.get(FieldKey.STYLE_NUMBER));
    }

    @Test
    void blankText_yieldsEmptyRecord() {
        assertTrue(careLabel.extractFields("").isEmpty());
        assertTrue(careLabel.extractFields(null).isEmpty());
        assertTrue(careLabel.extractFields("   \n").isEmpty());
    }

    @Test
    void unmatchedText_omitsKeys() {
        ExtractedFields fields = careLabel.extractFields("Machine wash cold with like colors");

        assertTrue(fields.isEmpty());
    }

    @Test
    void hangTag_requiresRangeNextToSize() {
        ExtractedFields withRange = hangTag.extractFields("AVIA STRETCH\nM (8-10)\nSALSA DELIGHT 650\nAV1001DR2\nUPC 036000291452");

        assertEquals(DocumentType.RFID, hangTag.documentType());
        assertEquals(Optional.of("M"), withRange.get(FieldKey.SIZE));
        assertEquals(Optional.of("8-10"), withRange.get(FieldKey.SIZE_RANGE));
        assertEquals(Optional.of("SALSA DELIGHT"), withRange.get(FieldKey.COLOR));
        assertEquals(Optional.of("650"), withRange.get(FieldKey.COLOR_CODE));
        assertEquals(Optional.of("AV1001DR2"), withRange.get(FieldKey.STYLE_NUMBER));
        assertEquals(Optional.of("036000291452"), withRange.get(FieldKey.UPC));

        ExtractedFields withoutRange = hangTag.extractFields("SIZE M 8");
        assertFalse(withoutRange.has(FieldKey.SIZE));
        assertFalse(withoutRange.has(FieldKey.SIZE_RANGE));
    }

    @Test
    void factory_returnsStrategyPerDocumentType() {
        assertEquals(DocumentType.CARE_LABEL, factory.getStrategy(DocumentType.CARE_LABEL).orElseThrow().documentType());
        assertEquals(DocumentType.RFID, factory.getStrategy(DocumentType.RFID).orElseThrow().documentType());
        assertTrue(factory.getStrategy(DocumentType.UNKNOWN).isEmpty());
        assertTrue(factory.getStrategy(null).isEmpty());
    }
}
