package com.pavan.orderedmap.json;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumericTextTest {
    
    @Test
    void testIntegers() {
        assertEquals(42L, NumericText.parse("42"));
        assertEquals(-7L, NumericText.parse("-7"));
        assertEquals(0L, NumericText.parse("0"));
        assertEquals(Long.MAX_VALUE, NumericText.parse("9223372036854775807"));
    }
    
    @Test
    void testIntegerOutOfRangeBecomesDouble() {
        assertEquals(9.223372036854775808E18, NumericText.parse("9223372036854775808"));
    }
    
    @Test
    void testFloatingPoint() {
        assertEquals(3.14, NumericText.parse("3.14"));
        assertEquals(123000.0, NumericText.parse("1.23e5"));
        assertEquals(-0.5, NumericText.parse("-0.5"));
    }
    
    @Test
    void testRejectsNonJsonNumbers() {
        assertNull(NumericText.parse("abc"));
        assertNull(NumericText.parse(""));
        assertNull(NumericText.parse("+1"));
        assertNull(NumericText.parse("007"));
        assertNull(NumericText.parse("1."));
        assertNull(NumericText.parse(".5"));
        assertNull(NumericText.parse("NaN"));
        assertNull(NumericText.parse("Infinity"));
        assertNull(NumericText.parse("1e999"));
        assertNull(NumericText.parse("12 "));
    }
}
