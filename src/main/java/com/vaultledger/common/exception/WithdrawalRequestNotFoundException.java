package com.vaultledger.common.exception;

/**
 * Thrown when a withdrawal request id does not exist or has been purged.
 */
public class WithdrawalRequestNotFoundException extends VaultLedgerException {

    public WithdrawalRequestNotFoundException(long requestId) {
        super("Withdrawal request not found: " + requestId);
    }
}
