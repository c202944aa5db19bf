package com.vaultledger.fees;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a yield report, including any performance fee taken.
 */
@Value
public class YieldReport {
    BigInteger yieldDelta;
    BigInteger navBefore;
    BigInteger navAfter;
    BigInteger sharePrice;
    BigInteger feeValue;
    BigInteger feeShares;
    BigInteger priceHighWaterMark;

    public boolean isFeeCollected() {
        return feeShares.signum() > 0;
    }
}
