package com.vaultledger.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Fixed-point arithmetic helpers for share and value amounts.
 *
 * Prices and rates carry 18 decimals ({@link #PRECISION}). Value and share amounts
 * are plain integers in their smallest unit. Every division rounds toward zero,
 * which for the non-negative amounts handled here is a floor.
 */
public final class FixedPoint {

    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /**
     * Price of one share-unit before any share exists: one value unit.
     */
    public static final BigInteger INITIAL_SHARE_PRICE = PRECISION;

    private FixedPoint() {
    }

    /**
     * Computes {@code a * b / denominator}, rounded down.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Division by zero in mulDiv");
        }
        return a.multiply(b).divide(denominator);
    }

    /**
     * Applies an 18-decimal fraction to an amount, rounded down.
     */
    public static BigInteger applyRate(BigInteger amount, BigInteger rate) {
        return mulDiv(amount, rate, PRECISION);
    }

    /**
     * Parses a decimal fraction such as {@code "0.2"} into its 18-decimal representation.
     */
    public static BigInteger fraction(String decimal) {
        return new BigDecimal(decimal)
            .movePointRight(18)
            .toBigIntegerExact();
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
