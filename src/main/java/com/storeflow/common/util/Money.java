package com.storeflow.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic helpers. Amounts are held at two decimal places (the currency minor unit)
 * and persisted as whole minor units.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    /** Rounds to the minor unit with banker's rounding. Call once, at the end of a computation. */
    public static BigDecimal round(BigDecimal value) {
        if (value == null) return ZERO;
        return value.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    public static long toMinorUnits(BigDecimal value) {
        return round(value).movePointRight(SCALE).longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }

    public static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }
}
