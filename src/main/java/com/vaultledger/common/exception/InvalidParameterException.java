package com.vaultledger.common.exception;

/**
 * Thrown when a configuration value is out of range or malformed.
 */
public class InvalidParameterException extends VaultLedgerException {

    public InvalidParameterException(String parameter, String reason) {
        super(String.format("Invalid value for %s: %s", parameter, reason));
    }
}
