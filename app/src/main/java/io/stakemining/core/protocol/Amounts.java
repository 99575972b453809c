package io.stakemining.core.protocol;

import java.math.BigInteger;

/**
 * Fixed-point helpers for token amounts. Both tokens use 8 decimals, so one whole token is
 * {@link #UNIT} minor units.
 */
public final class Amounts {
    public static final long UNIT = 100_000_000L;
    public static final long BPS_DENOMINATOR = 10_000L;

    private Amounts() {}

    /** floor(a * b / d) with an exact intermediate; throws if the result does not fit a long. */
    public static long mulDiv(long a, long b, long d) {
        if (d <= 0) {
            throw new IllegalArgumentException("Divisor must be > 0");
        }
        return BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(d))
                .longValueExact();
    }

    public static long applyBps(long amount, long bps) {
        return mulDiv(amount, bps, BPS_DENOMINATOR);
    }

    /** Subtraction floored at zero. */
    public static long saturatingSub(long a, long b) {
        return a > b ? a - b : 0L;
    }

    public static long parseDecimal(String value) {
        return new java.math.BigDecimal(value.trim())
                .movePointRight(8)
                .setScale(0, java.math.RoundingMode.UNNECESSARY)
                .longValueExact();
    }

    public static String format(long minor) {
        return java.math.BigDecimal.valueOf(minor, 8).stripTrailingZeros().toPlainString();
    }
}
