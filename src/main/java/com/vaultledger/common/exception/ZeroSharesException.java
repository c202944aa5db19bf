package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a deposit is too small to mint a single share-unit at the current price.
 */
public class ZeroSharesException extends VaultLedgerException {

    public ZeroSharesException(BigInteger amount, BigInteger sharePrice) {
        super(String.format("Deposit of %s mints zero shares at price %s", amount, sharePrice));
    }
}
