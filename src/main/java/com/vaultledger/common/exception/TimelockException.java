package com.vaultledger.common.exception;

/**
 * Thrown when a timelocked parameter change cannot be queued, executed or cancelled.
 */
public class TimelockException extends VaultLedgerException {

    public TimelockException(String message) {
        super(message);
    }
}
