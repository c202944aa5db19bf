package com.vaultledger.deposit;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a deposit.
 */
@Value
public class DepositReceipt {
    String holder;
    BigInteger amount;
    BigInteger shares;
    BigInteger sharePrice;
    BigInteger forwardedToVenue;
}
