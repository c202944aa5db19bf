package com.vaultledger.common.exception;

/**
 * Thrown when the ledger, or the operation class, is paused.
 */
public class OperationPausedException extends AuthorizationException {

    public OperationPausedException(String operation) {
        super("Operation is paused: " + operation);
    }
}
