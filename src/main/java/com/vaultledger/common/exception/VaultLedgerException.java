package com.vaultledger.common.exception;

/**
 * Base exception for all recoverable vault ledger failures.
 *
 * These are caller-correctable conditions: the operation is rejected and no
 * ledger state changes. Broken accounting is reported through
 * {@link InvariantViolationException} instead, which is deliberately not a subtype.
 */
public class VaultLedgerException extends RuntimeException {

    public VaultLedgerException(String message) {
        super(message);
    }

    public VaultLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
