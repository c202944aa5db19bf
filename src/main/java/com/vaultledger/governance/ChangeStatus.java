package com.vaultledger.governance;

/**
 * Lifecycle of a queued parameter change.
 */
public enum ChangeStatus {
    QUEUED,
    EXECUTED,
    CANCELLED
}
