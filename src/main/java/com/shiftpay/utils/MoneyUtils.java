package com.shiftpay.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Money and ratio arithmetic shared by the calculators.
 * Intermediate values keep {@link #PRECISION}; rounding to {@link #SCALE} happens only on output.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;
    public static final RoundingMode RM = RoundingMode.HALF_UP;
    public static final MathContext PRECISION = MathContext.DECIMAL128;

    private MoneyUtils() {
    }

    public static BigDecimal round(BigDecimal value) {
        if (value == null) return BigDecimal.ZERO.setScale(SCALE, RM);
        return value.setScale(SCALE, RM);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, PRECISION);
    }

    /**
     * Ratio of value to target, capped at 1.
     */
    public static BigDecimal cappedRatio(BigDecimal value, BigDecimal target) {
        BigDecimal ratio = divide(value, target);
        return ratio.compareTo(BigDecimal.ONE) > 0 ? BigDecimal.ONE : ratio;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static int percentage(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) return 0;
        return divide(part, whole).multiply(BigDecimal.valueOf(100)).setScale(0, RM).intValue();
    }
}
