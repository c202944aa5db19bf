package com.vaultledger.common;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FixedPointTest {

    @Test
    void testFractionParsesDecimals() {
        assertEquals(new BigInteger("200000000000000000"), FixedPoint.fraction("0.2"));
        assertEquals(FixedPoint.PRECISION, FixedPoint.fraction("1"));
        assertThrows(ArithmeticException.class, () -> FixedPoint.fraction("0.0000000000000000001"));
    }

    @Test
    void testMulDivFloorsAndRejectsZeroDenominator() {
        assertEquals(BigInteger.valueOf(3), FixedPoint.mulDiv(BigInteger.valueOf(7), BigInteger.ONE, BigInteger.TWO));
        assertThrows(ArithmeticException.class,
            () -> FixedPoint.mulDiv(BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO));
    }

    @Test
    void testApplyRate() {
        assertEquals(BigInteger.valueOf(20_000),
            FixedPoint.applyRate(BigInteger.valueOf(100_000), FixedPoint.fraction("0.2")));
    }
}
