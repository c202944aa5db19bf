package com.vaultledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a deposit would push a holder or the whole vault past its cap.
 */
public class CapExceededException extends VaultLedgerException {

    private final String capName;

    public CapExceededException(String capName, BigInteger cap, BigInteger resulting) {
        super(String.format("%s exceeded. Cap: %s, resulting: %s", capName, cap, resulting));
        this.capName = capName;
    }

    public String getCapName() {
        return capName;
    }
}
