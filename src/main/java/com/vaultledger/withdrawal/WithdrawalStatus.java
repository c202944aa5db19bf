package com.vaultledger.withdrawal;

/**
 * Status of a withdrawal request.
 *
 * PENDING is the only non-terminal state.
 */
public enum WithdrawalStatus {
    /**
     * Shares are escrowed and the request waits in the queue.
     */
    PENDING,

    /**
     * Escrowed shares were burned and currency paid out.
     */
    FULFILLED,

    /**
     * Escrowed shares were returned to the requester.
     */
    CANCELLED
}
