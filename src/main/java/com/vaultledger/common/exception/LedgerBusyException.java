package com.vaultledger.common.exception;

/**
 * Thrown when the ledger lock could not be acquired in time.
 */
public class LedgerBusyException extends VaultLedgerException {

    public LedgerBusyException(String operation) {
        super("Ledger busy, could not start " + operation);
    }
}
