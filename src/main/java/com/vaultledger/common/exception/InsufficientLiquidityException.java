package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a single forced payout cannot be covered by the buffer plus
 * whatever the custody venue returns.
 */
public class InsufficientLiquidityException extends VaultLedgerException {

    public InsufficientLiquidityException(BigInteger required, BigInteger available) {
        super(String.format("Insufficient liquidity. Required: %s, Available: %s",
            required, available));
    }
}
