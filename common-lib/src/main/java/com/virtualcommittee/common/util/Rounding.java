package com.virtualcommittee.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {

    private Rounding() {}

    /** Half-up rounding to two decimals; non-finite input returns 0. */
    public static double twoDecimals(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
