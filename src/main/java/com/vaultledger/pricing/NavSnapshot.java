package com.vaultledger.pricing;

import lombok.Value;

import java.math.BigInteger;

/**
 * NAV, supply and price observed at one instant.
 */
@Value
public class NavSnapshot {
    BigInteger totalAssets;
    BigInteger totalShareSupply;
    BigInteger sharePrice;
    BigInteger priceHighWaterMark;
}
