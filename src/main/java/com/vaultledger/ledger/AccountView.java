package com.vaultledger.ledger;

import lombok.Value;

import java.math.BigInteger;

/**
 * A holder's share balance with its value at the current price.
 */
@Value
public class AccountView {
    String holderId;
    BigInteger shares;
    BigInteger value;
    BigInteger totalDeposited;
    long pendingWithdrawals;
}
