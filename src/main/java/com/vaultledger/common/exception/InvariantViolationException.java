package com.vaultledger.common.exception;

/**
 * Critical fault: the ledger's accounting invariants do not hold.
 *
 * This indicates a defect, not bad input. It aborts the unit of work (rolling back
 * the transaction) and must reach an operator. It is intentionally outside the
 * {@link VaultLedgerException} hierarchy so callers cannot handle it as a routine
 * rejection.
 */
public class InvariantViolationException extends RuntimeException {

    private final String invariant;

    public InvariantViolationException(String invariant, String detail) {
        super(String.format("Ledger invariant violated [%s]: %s", invariant, detail));
        this.invariant = invariant;
    }

    public String getInvariant() {
        return invariant;
    }
}
