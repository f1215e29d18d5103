package com.propertyintel.listings.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class ValueCoercionTest {

    @Test void testMissingMarkersCoerceToNull() {
        assertNull(ValueCoercion.toDouble(null));
        assertNull(ValueCoercion.toDouble(""));
        assertNull(ValueCoercion.toDouble("."));
        assertNull(ValueCoercion.toDouble("   "));
    }

    @Test void testDecimalKeepsWrittenValue() {
        assertEquals(new BigDecimal("16.1"), ValueCoercion.toDecimal(" 16.1 "));
        assertNull(ValueCoercion.toDecimal("."));
        assertNull(ValueCoercion.toDecimal("abc"));
    }

    @Test void testGarbageCoercesToNull() {
        assertNull(ValueCoercion.toDouble("abc"));
        assertNull(ValueCoercion.toDouble("12 500"));
        assertNull(ValueCoercion.toDouble("NaN"));
        assertNull(ValueCoercion.toDouble("Infinity"));
        assertNull(ValueCoercion.toDouble("0x10"));
        assertNull(ValueCoercion.toDouble("12d"));
    }

    @Test void testNumbersKeepFraction() {
        assertEquals(123.5, ValueCoercion.toDouble("123.5"));
        assertEquals(3000000.0, ValueCoercion.toDouble("3000000"));
        assertEquals(49.1951, ValueCoercion.toDouble(" 49.1951 "));
        assertEquals(1500.0, ValueCoercion.toDouble("1.5E3"));
        assertEquals(-2.0, ValueCoercion.toDouble("-2"));
    }

    @Test void testIsMissing() {
        assertTrue(ValueCoercion.isMissing(null));
        assertTrue(ValueCoercion.isMissing(""));
        assertTrue(ValueCoercion.isMissing(" . "));
        assertFalse(ValueCoercion.isMissing("Praha"));
        assertFalse(ValueCoercion.isMissing("0"));
    }

    @Test void testYearFromTimestamps() {
        assertEquals(2025, ValueCoercion.yearOf("2025-03-01T10:15:30.123Z"));
        assertEquals(2024, ValueCoercion.yearOf("2024-12-31T23:30:00+01:00"));
        // wall-clock year as written, 2025 in UTC
        assertEquals(2024, ValueCoercion.yearOf("2024-12-31T23:30:00-02:00"));
        assertEquals(2024, ValueCoercion.yearOf("2024-06-01T08:00:00"));
        assertEquals(2023, ValueCoercion.yearOf("2023-01-15 12:00:00"));
        assertEquals(2023, ValueCoercion.yearOf("2023-01-15 12:00:00.250"));
        assertEquals(2022, ValueCoercion.yearOf("2022-07-04"));
    }

    @Test void testUnparseableYearIsNull() {
        assertNull(ValueCoercion.yearOf(null));
        assertNull(ValueCoercion.yearOf(""));
        assertNull(ValueCoercion.yearOf("yesterday"));
        assertNull(ValueCoercion.yearOf("2025-13-01"));
    }
}
