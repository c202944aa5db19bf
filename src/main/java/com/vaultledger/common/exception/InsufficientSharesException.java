package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a holder does not have enough liquid shares for an operation.
 */
public class InsufficientSharesException extends VaultLedgerException {

    public InsufficientSharesException(String holder, BigInteger required, BigInteger available) {
        super(String.format("Insufficient shares for %s. Required: %s, Available: %s",
            holder, required, available));
    }
}
