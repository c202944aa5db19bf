package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a yield report moves NAV by more than the configured bound.
 */
public class YieldBoundExceededException extends VaultLedgerException {

    public YieldBoundExceededException(BigInteger delta, BigInteger bound) {
        super(String.format("Yield change %s exceeds bound %s", delta, bound));
    }
}
