package com.vaultledger.pricing;

import com.vaultledger.common.FixedPoint;
import com.vaultledger.ledger.VaultState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NAV and price derivation.
 */
class PricingEngineTest {

    private final PricingEngine pricingEngine = new PricingEngine();

    private VaultState state;

    @BeforeEach
    void setUp() {
        state = new VaultState("USDC", "venue", "treasury", Instant.EPOCH);
    }

    @Test
    void testEmptyVaultUsesInitialPrice() {
        assertEquals(BigInteger.ZERO, pricingEngine.totalAssets(state));
        assertEquals(FixedPoint.INITIAL_SHARE_PRICE, pricingEngine.sharePrice(state));
        assertEquals(BigInteger.valueOf(1_000_000), pricingEngine.valueToShares(state, BigInteger.valueOf(1_000_000)));
    }

    @Test
    void testNavIncludesWithdrawalsAndYield() {
        state.setTotalDeposited(BigInteger.valueOf(1_000));
        state.setTotalWithdrawn(BigInteger.valueOf(300));
        state.setAccumulatedYield(BigInteger.valueOf(-50));

        assertEquals(BigInteger.valueOf(650), pricingEngine.totalAssets(state));
    }

    @Test
    void testConversionsRoundDown() {
        // price 1.5
        state.setTotalDeposited(BigInteger.valueOf(3));
        state.setTotalShareSupply(BigInteger.valueOf(2));

        assertEquals(new BigInteger("1500000000000000000"), pricingEngine.sharePrice(state));
        assertEquals(BigInteger.ZERO, pricingEngine.valueToShares(state, BigInteger.ONE));
        assertEquals(BigInteger.ONE, pricingEngine.valueToShares(state, BigInteger.TWO));
        assertEquals(BigInteger.ONE, pricingEngine.sharesToValue(state, BigInteger.ONE));
        assertEquals(BigInteger.valueOf(4), pricingEngine.sharesToValue(state, BigInteger.valueOf(3)));
    }

    @Test
    void testNegativeNavClampedToZero() {
        state.setTotalDeposited(BigInteger.valueOf(100));
        state.setAccumulatedYield(BigInteger.valueOf(-200));
        state.setTotalShareSupply(BigInteger.valueOf(100));

        assertEquals(BigInteger.ZERO, pricingEngine.totalAssets(state));
        assertEquals(BigInteger.ZERO, pricingEngine.sharePrice(state));
        assertEquals(BigInteger.ZERO, pricingEngine.valueToShares(state, BigInteger.valueOf(50)));
        assertEquals(BigInteger.ZERO, pricingEngine.sharesToValue(state, BigInteger.valueOf(50)));
    }

    @Test
    void testRoundTripAtNonUnitPriceLosesAtMostOneShare() {
        // 1,000,000 deposited, +100,000 yield, 18,518 fee shares minted
        state.setTotalDeposited(BigInteger.valueOf(1_000_000));
        state.setAccumulatedYield(BigInteger.valueOf(100_000));
        state.setTotalShareSupply(BigInteger.valueOf(1_018_518));
        BigInteger price = pricingEngine.sharePrice(state);
        assertNotEquals(FixedPoint.INITIAL_SHARE_PRICE, price);

        BigInteger totalValue = BigInteger.ZERO;
        for (long n : new long[] {700_000, 300_000, 18_518}) {
            BigInteger shares = BigInteger.valueOf(n);
            BigInteger value = pricingEngine.sharesToValue(state, shares);
            BigInteger back = pricingEngine.valueToShares(state, value);

            BigInteger lost = shares.subtract(back);
            assertTrue(lost.signum() >= 0 && lost.compareTo(BigInteger.ONE) <= 0,
                "round trip of " + n + " shares lost " + lost);
            totalValue = totalValue.add(value);
        }
        assertTrue(totalValue.compareTo(pricingEngine.totalAssets(state)) <= 0);
    }

    @Test
    void testSnapshot() {
        state.setTotalDeposited(BigInteger.valueOf(2_000));
        state.setTotalShareSupply(BigInteger.valueOf(1_000));
        state.setPriceHighWaterMark(FixedPoint.PRECISION);

        NavSnapshot snapshot = pricingEngine.snapshot(state);

        assertEquals(BigInteger.valueOf(2_000), snapshot.getTotalAssets());
        assertEquals(FixedPoint.PRECISION.multiply(BigInteger.TWO), snapshot.getSharePrice());
        assertEquals(FixedPoint.PRECISION, snapshot.getPriceHighWaterMark());
    }
}
