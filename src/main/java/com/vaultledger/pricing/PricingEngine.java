package com.vaultledger.pricing;

import com.vaultledger.common.FixedPoint;
import com.vaultledger.ledger.VaultState;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Derives NAV and share price from vault state.
 *
 * Every method is a pure function of the state passed in. Nothing is cached,
 * so deposits, withdrawals and fee collection always see the current price.
 * Conversions round down, in favour of the vault.
 */
@Component
public class PricingEngine {

    /**
     * Net asset value: deposits minus withdrawals plus accumulated yield, never below zero.
     */
    public BigInteger totalAssets(VaultState state) {
        BigInteger nav = state.getTotalDeposited()
            .subtract(state.getTotalWithdrawn())
            .add(state.getAccumulatedYield());
        return nav.signum() < 0 ? BigInteger.ZERO : nav;
    }

    /**
     * Value of one share with 18 decimals.
     */
    public BigInteger sharePrice(VaultState state) {
        BigInteger supply = state.getTotalShareSupply();
        if (supply.signum() == 0) {
            return FixedPoint.INITIAL_SHARE_PRICE;
        }
        return FixedPoint.mulDiv(totalAssets(state), FixedPoint.PRECISION, supply);
    }

    public BigInteger valueToShares(VaultState state, BigInteger value) {
        BigInteger price = sharePrice(state);
        if (price.signum() == 0) {
            // NAV wiped out while shares exist; nothing can be bought at a zero price
            return BigInteger.ZERO;
        }
        return FixedPoint.mulDiv(value, FixedPoint.PRECISION, price);
    }

    public BigInteger sharesToValue(VaultState state, BigInteger shares) {
        return FixedPoint.mulDiv(shares, sharePrice(state), FixedPoint.PRECISION);
    }

    public NavSnapshot snapshot(VaultState state) {
        return new NavSnapshot(
            totalAssets(state),
            state.getTotalShareSupply(),
            sharePrice(state),
            state.getPriceHighWaterMark()
        );
    }
}
