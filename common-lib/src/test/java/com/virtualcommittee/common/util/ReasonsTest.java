package com.virtualcommittee.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReasonsTest {

    @Test
    @DisplayName("lines carry their tag and use a locale-neutral decimal point")
    void tagsAndFormatting() {
        assertEquals("✓ R:R 3.5:1", Reasons.pass("R:R %.1f:1", 3.5));
        assertEquals("~ Volume 1.3x", Reasons.borderline("Volume %.1fx", 1.3));
        assertEquals("✗ No ATR data", Reasons.fail("No ATR data"));
    }

    @Test
    @DisplayName("rounding is half-up to 2dp; non-finite → 0")
    void rounding() {
        assertEquals(2.82, Rounding.twoDecimals(7.75 / 2.75));
        assertEquals(15.58, Rounding.twoDecimals(7.75 / 49.75 * 100));
        assertEquals(1.01, Rounding.twoDecimals(1.005));
        assertEquals(0.0, Rounding.twoDecimals(Double.NaN));
        assertEquals(0.0, Rounding.twoDecimals(Double.POSITIVE_INFINITY));
    }
}
