package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when an amount is missing, zero or negative.
 */
public class InvalidAmountException extends VaultLedgerException {

    public InvalidAmountException(String field, BigInteger amount) {
        super(String.format("%s must be positive, got %s", field, amount));
    }
}
