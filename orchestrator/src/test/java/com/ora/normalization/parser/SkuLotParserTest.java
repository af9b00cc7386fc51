package com.ora.normalization.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SkuLotParserTest {

    private final SkuLotParser parser = new SkuLotParser();

    // ========== Valid Identifiers ==========

    @Test
    @DisplayName("Should split SKU and lot around a spaced dash")
    void testSkuLotWithSpaces() {
        ParseResult result = parser.parse("17612 - 250300");

        ParseResult.Valid valid = assertInstanceOf(ParseResult.Valid.class, result);
        assertEquals("17612", valid.baseCode());
        assertEquals("250300", valid.subCode());
        assertEquals("17612 - 250300", valid.raw());
        assertTrue(valid.isValid());
    }

    @ParameterizedTest
    @ValueSource(strings = {"17612-250300", "17612 -250300", "17612-  250300", "  17612 - 250300  "})
    @DisplayName("Should tolerate whitespace variants around the dash")
    void testWhitespaceVariants(String raw) {
        ParseResult.Valid valid = assertInstanceOf(ParseResult.Valid.class, parser.parse(raw));
        assertEquals("17612", valid.baseCode());
        assertEquals("250300", valid.subCode());
    }

    @Test
    @DisplayName("Should accept a bare SKU without lot")
    void testBareSku() {
        ParseResult.Valid valid = assertInstanceOf(ParseResult.Valid.class, parser.parse("18795"));
        assertEquals("18795", valid.baseCode());
        assertNull(valid.subCode());
        assertTrue(valid.sub().isEmpty());
    }

    @Test
    @DisplayName("Should keep the trimmed input as the audit copy")
    void testRawIsTrimmed() {
        assertEquals("18795", parser.parse("  18795\t").raw());
    }

    // ========== Invalid Identifiers ==========

    @Test
    @DisplayName("Should report an invalid format without throwing")
    void testInvalidFormat() {
        ParseResult.Invalid invalid = assertInstanceOf(ParseResult.Invalid.class, parser.parse("UNKNOWN99"));
        assertEquals("Invalid SKU format: UNKNOWN99", invalid.error());
        assertFalse(invalid.isValid());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Should reject empty input")
    void testEmptyInput(String raw) {
        ParseResult.Invalid invalid = assertInstanceOf(ParseResult.Invalid.class, parser.parse(raw));
        assertEquals("Empty SKU provided", invalid.error());
    }

    @Test
    @DisplayName("Should reject null input")
    void testNullInput() {
        assertFalse(parser.parse(null).isValid());
    }

    @ParameterizedTest
    @ValueSource(strings = {"17612 - ", "- 250300", "17612 - 2503A0", "17612 - 250300 - 1", "17612 250300"})
    @DisplayName("Should reject malformed SKU-lot values")
    void testMalformedSkuLot(String raw) {
        assertInstanceOf(ParseResult.Invalid.class, parser.parse(raw));
    }

    @Test
    @DisplayName("Should return the same result for the same input")
    void testDeterministic() {
        assertEquals(parser.parse("17612 - 250300"), parser.parse("17612 - 250300"));
        assertEquals(parser.parse("bad"), parser.parse("bad"));
    }
}
