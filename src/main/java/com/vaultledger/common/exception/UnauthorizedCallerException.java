package com.vaultledger.common.exception;

/**
 * Thrown when the caller lacks the capability an operation requires.
 */
public class UnauthorizedCallerException extends AuthorizationException {

    public UnauthorizedCallerException(String caller, String capability, String operation) {
        super(String.format("Caller %s lacks capability %s required for %s",
            caller, capability, operation));
    }
}
