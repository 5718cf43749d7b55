package com.pairtrader.engine.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for exchange quantities. Values are snapped to a tick or lot
 * size, never to a fixed scale.
 */
public final class MoneyUtils {

    /** Precision for intermediate divisions before a result is snapped to its step. */
    public static final MathContext CALC = MathContext.DECIMAL128;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.FLOOR);
    }

    public static BigDecimal ceilToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.CEILING);
    }

    public static BigDecimal roundToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.HALF_UP);
    }

    /** True when {@code value} is an exact multiple of {@code step}. */
    public static boolean isMultipleOf(BigDecimal value, BigDecimal step) {
        if (value == null || step == null || step.signum() <= 0) {
            return false;
        }
        return value.remainder(step).signum() == 0;
    }

    /** 0.1 (percent) becomes 0.001. */
    public static BigDecimal percentToFraction(BigDecimal percent) {
        return orZero(percent).divide(HUNDRED, CALC);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, CALC);
    }

    private static BigDecimal toStep(BigDecimal value, BigDecimal step, RoundingMode mode) {
        if (value == null || step == null || step.signum() <= 0) {
            return value;
        }
        BigDecimal steps = value.divide(step, 0, mode);
        return steps.multiply(step).setScale(Math.max(step.stripTrailingZeros().scale(), 0), RoundingMode.UNNECESSARY);
    }
}
