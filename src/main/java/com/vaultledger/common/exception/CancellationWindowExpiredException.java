package com.vaultledger.common.exception;

/**
 * Thrown when a requester tries to cancel after the self-cancellation window closed.
 */
public class CancellationWindowExpiredException extends VaultLedgerException {

    public CancellationWindowExpiredException(long requestId) {
        super("Cancellation window has expired for withdrawal request " + requestId);
    }
}
