package com.vaultledger.ledger;

/**
 * Types of journal entries the ledger emits for external auditing.
 */
public enum LedgerEventType {
    /**
     * Currency deposited and shares minted.
     */
    DEPOSIT,

    /**
     * Shares moved into escrow and a withdrawal request appended to the queue.
     */
    WITHDRAWAL_REQUESTED,

    /**
     * Escrowed shares burned and currency paid out.
     */
    WITHDRAWAL_FULFILLED,

    /**
     * Payout refused by the rail; the request stays pending.
     */
    WITHDRAWAL_PAYOUT_FAILED,

    /**
     * Escrowed shares returned to the requester.
     */
    WITHDRAWAL_CANCELLED,

    /**
     * Fee shares minted to the treasury.
     */
    FEE_COLLECTED,

    /**
     * Yield delta applied to the accumulator.
     */
    YIELD_REPORTED,

    /**
     * High-water-mark forced to the current price.
     */
    HWM_RESET,

    /**
     * Holder-to-holder share transfer.
     */
    SHARES_TRANSFERRED,

    /**
     * Escrow balance above pending shares burned.
     */
    ORPHANED_SHARES_RECOVERED,

    /**
     * Operational parameter changed.
     */
    PARAMETER_CHANGED
}
