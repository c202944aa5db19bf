package com.vaultledger.common.exception;

/**
 * Thrown when a ledger operation is invoked while another one is running on the same thread,
 * typically from inside a value-transfer hook.
 */
public class ReentrantCallException extends VaultLedgerException {

    public ReentrantCallException(String operation, String inProgress) {
        super(String.format("Re-entrant call to %s while %s is in progress", operation, inProgress));
    }
}
