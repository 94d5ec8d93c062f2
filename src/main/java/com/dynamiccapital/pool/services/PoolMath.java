package com.dynamiccapital.pool.services;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic rounding and clamping for every persisted pool figure.
 *
 * <p>Money is kept at 2 decimals and ownership percentages at 6. Rounding is half away
 * from zero ({@link RoundingMode#HALF_UP} on the decimal representation), so repeated
 * recomputation from the same events always lands on the same stored value.</p>
 *
 * <p>All methods are static.</p>
 */
public final class PoolMath {

    public static final int MONEY_DIGITS = 2;
    public static final int PERCENTAGE_DIGITS = 6;

    /** Tolerance when comparing rounded money amounts. */
    public static final double MONEY_EPSILON = 0.01;

    private PoolMath() {}

    /**
     * Round {@code value} to {@code digits} decimal places, half away from zero.
     *
     * @throws IllegalArgumentException if {@code digits} is negative or {@code value} is not finite
     */
    public static double round(double value, int digits) {
        if (digits < 0) {
            throw new IllegalArgumentException("digits must be >= 0, got " + digits);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("cannot round non-finite value " + value);
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Round a USDT amount to 2 decimal places.
     */
    public static double roundMoney(double amount) {
        return round(amount, MONEY_DIGITS);
    }

    /**
     * Round an ownership percentage to 6 decimal places.
     */
    public static double roundPercentage(double percentage) {
        return round(percentage, PERCENTAGE_DIGITS);
    }

    /**
     * Bound {@code value} into [min, max].
     */
    public static double clamp(double value, double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * True when two money amounts agree once rounded to cents.
     */
    public static boolean moneyEquals(double a, double b) {
        return Math.abs(roundMoney(a) - roundMoney(b)) < MONEY_EPSILON / 2;
    }
}
