package com.vaultledger.common.exception;

/**
 * Thrown when a holder already has the maximum number of pending withdrawal requests.
 */
public class TooManyPendingWithdrawalsException extends VaultLedgerException {

    public TooManyPendingWithdrawalsException(String holder, int maxPending) {
        super(String.format("Holder %s already has %d pending withdrawal requests", holder, maxPending));
    }
}
