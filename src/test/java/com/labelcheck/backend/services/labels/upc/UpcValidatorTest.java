package com.labelcheck.backend.services.labels.upc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class UpcValidatorTest {

    @Test
    void upcA_validAndInvalidCheckDigit() {
        assertTrue(UpcValidator.isValidUpcEan("036000291452"));
        assertFalse(UpcValidator.isValidUpcEan("036000291453"));
        assertTrue(UpcValidator.isValidUpcEan("123456789012"));
    }

    @Test
    void ean13_usesOppositeParity() {
        assertTrue(UpcValidator.isValidUpcEan("4006381333931"));
        assertTrue(UpcValidator.isValidUpcEan("1234567890128"));
        assertFalse(UpcValidator.isValidUpcEan("1234567890127"));
        // A UPC-A with a leading zero is the same product as EAN-13
        assertTrue(UpcValidator.isValidUpcEan("0036000291452"));
    }

    @Test
    void rejectsWrongLengthOrNonDigits() {
        assertFalse(UpcValidator.isValidUpcEan(null));
        assertFalse(UpcValidator.isValidUpcEan(""));
        assertFalse(UpcValidator.isValidUpcEan("03600029145"));
        assertFalse(UpcValidator.isValidUpcEan("03600029145200"));
        assertFalse(UpcValidator.isValidUpcEan("03600029145A"));
        assertFalse(UpcValidator.isValidUpcEan("0360 0029145"));
    }

    @Test
    void extractUpcCandidate_stripsInternalSpaces() {
        assertEquals("036000291452", UpcValidator.extractUpcCandidate("EAN/UPC 0 36000 29145 2"));
        assertEquals("036000291453", UpcValidator.extractUpcCandidate("UPC 036000291453"));
        assertEquals("4006381333931", UpcValidator.extractUpcCandidate("EAN 4006381333931"));
    }

    @Test
    void extractUpcCandidate_emptyWhenLengthIsWrong() {
        assertEquals("", UpcValidator.extractUpcCandidate("UPC 12345"));
        assertEquals("", UpcValidator.extractUpcCandidate("RN#12345"));
        assertEquals("", UpcValidator.extractUpcCandidate(""));
        assertEquals("", UpcValidator.extractUpcCandidate(null));
    }

    @Test
    void extractValidUpc_requiresChecksum() {
        assertEquals("036000291452", UpcValidator.extractValidUpc("UPC 036000291452"));
        assertEquals("", UpcValidator.extractValidUpc("UPC 036000291453"));
    }
}
