package com.vaultledger.common.exception;

/**
 * Thrown when acting on a withdrawal request that was already fulfilled or cancelled.
 */
public class RequestAlreadyResolvedException extends VaultLedgerException {

    public RequestAlreadyResolvedException(long requestId, String status) {
        super(String.format("Withdrawal request %d is already %s", requestId, status));
    }
}
