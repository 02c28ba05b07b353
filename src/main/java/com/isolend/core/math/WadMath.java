package com.isolend.core.math;

import com.isolend.domain.enums.Rounding;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Unsigned fixed-point arithmetic on {@link BigInteger} with 18 decimals (WAD).
 *
 * <p>Rates, fees, LTVs, the close factor and discounts are all WAD fractions where
 * {@code 1e18 == 1.0}. Amounts and shares are plain integers.
 */
public final class WadMath {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    /** Largest uint256; used as "everything" for repayments and infinite allowances. */
    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    /** Seconds in a 365-day year; the denominator for annual interest rates. */
    public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);

    private WadMath() {}

    /**
     * Computes {@code x * y / denominator} at full precision, rounded as requested.
     *
     * @throws ArithmeticException if the denominator is zero or any operand is negative
     */
    public static BigInteger mulDiv(BigInteger x, BigInteger y, BigInteger denominator, Rounding rounding) {
        requireUnsigned(x);
        requireUnsigned(y);
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("mulDiv denominator must be positive: " + denominator);
        }
        BigInteger[] qr = x.multiply(y).divideAndRemainder(denominator);
        if (rounding == Rounding.UP && qr[1].signum() != 0) {
            return qr[0].add(BigInteger.ONE);
        }
        return qr[0];
    }

    public static BigInteger mulWad(BigInteger x, BigInteger y) {
        return mulDiv(x, y, WAD, Rounding.DOWN);
    }

    public static BigInteger mulWadUp(BigInteger x, BigInteger y) {
        return mulDiv(x, y, WAD, Rounding.UP);
    }

    public static BigInteger divWad(BigInteger x, BigInteger y) {
        return mulDiv(x, WAD, y, Rounding.DOWN);
    }

    public static BigInteger divWadUp(BigInteger x, BigInteger y) {
        return mulDiv(x, WAD, y, Rounding.UP);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** {@code a - b}, or zero when {@code b > a}. */
    public static BigInteger saturatingSub(BigInteger a, BigInteger b) {
        return a.compareTo(b) > 0 ? a.subtract(b) : BigInteger.ZERO;
    }

    /** Parses a decimal fraction such as {@code "0.95"} into WAD. */
    public static BigInteger wad(String decimal) {
        return new BigDecimal(decimal)
                .multiply(new BigDecimal(WAD))
                .toBigIntegerExact();
    }

    public static BigInteger requireUnsigned(BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new ArithmeticException("unsigned value required, got " + value);
        }
        return value;
    }
}
