package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a currency wallet cannot cover a transfer.
 */
public class InsufficientFundsException extends VaultLedgerException {

    public InsufficientFundsException(String wallet, BigInteger required, BigInteger available) {
        super(String.format("Insufficient funds in wallet %s. Required: %s, Available: %s",
            wallet, required, available));
    }
}
