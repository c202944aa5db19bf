package com.vaultledger.custody;

import com.vaultledger.common.exception.VaultLedgerException;

/**
 * Exception thrown when an external custody or transfer operation fails.
 *
 * This wraps errors from the custody venue and the currency rail, allowing the
 * ledger to handle them consistently.
 */
public class CustodyException extends VaultLedgerException {

    private final String venueRef;
    private final String operation;

    public CustodyException(String message, String venueRef, String operation) {
        super(message);
        this.venueRef = venueRef;
        this.operation = operation;
    }

    public CustodyException(String message, String venueRef, String operation, Throwable cause) {
        super(message, cause);
        this.venueRef = venueRef;
        this.operation = operation;
    }

    public String getVenueRef() {
        return venueRef;
    }

    public String getOperation() {
        return operation;
    }
}
