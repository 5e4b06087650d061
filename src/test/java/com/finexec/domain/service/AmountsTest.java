package com.finexec.domain.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lenient amount parsing
 */
class AmountsTest {

    @Test
    void testParseNumbersAndText() {
        assertEquals(0, new BigDecimal("12.5").compareTo(Amounts.parse(12.5)));
        assertEquals(0, new BigDecimal("7").compareTo(Amounts.parse(7)));
        assertEquals(0, new BigDecimal("1000.25").compareTo(Amounts.parse(" 1000.25 ")));
    }

    @Test
    void testParseInvalidInputBecomesZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(Amounts.parse("abc")));
        assertEquals(0, BigDecimal.ZERO.compareTo(Amounts.parse(Double.NaN)));
        assertEquals(0, BigDecimal.ZERO.compareTo(Amounts.parse(Double.POSITIVE_INFINITY)));
    }

    @Test
    void testParseMissingInputStaysUnreported() {
        assertNull(Amounts.parse(null));
        assertNull(Amounts.parse("  "));
    }
}
