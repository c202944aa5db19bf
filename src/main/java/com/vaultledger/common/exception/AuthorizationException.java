package com.vaultledger.common.exception;

/**
 * Base type for failures caused by the caller's capabilities or the pause state.
 */
public abstract class AuthorizationException extends VaultLedgerException {

    protected AuthorizationException(String message) {
        super(message);
    }
}
