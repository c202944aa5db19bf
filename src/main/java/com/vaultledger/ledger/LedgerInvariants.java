package com.vaultledger.ledger;

import com.vaultledger.common.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Assertions over the vault's accounting invariants.
 *
 * A failure here means the accounting is broken, not that a caller made a
 * mistake: it is logged as critical and thrown as
 * {@link InvariantViolationException}, which aborts the running operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerInvariants {

    /**
     * Upper bound for the fee rate: 50% of profit, 18 decimals.
     */
    public static final BigInteger MAX_FEE_RATE = BigInteger.TEN.pow(17).multiply(BigInteger.valueOf(5));

    private final ShareLedger shareLedger;

    /**
     * Escrow must cover every pending request. Donated shares make the escrow
     * larger than needed, which is tolerated.
     */
    public void requireEscrowCoverage(VaultState state) {
        BigInteger escrow = shareLedger.escrowBalance();
        if (escrow.compareTo(state.getPendingWithdrawalShares()) < 0) {
            throw violation("ESCROW_COVERAGE", String.format(
                "escrow balance %s below pending withdrawal shares %s",
                escrow, state.getPendingWithdrawalShares()));
        }
    }

    public void requireBurnForPayout(BigInteger sharesBurned, BigInteger valuePaid) {
        if (valuePaid.signum() > 0 && sharesBurned.signum() <= 0) {
            throw violation("PAYOUT_WITHOUT_BURN", String.format(
                "paying %s without burning shares", valuePaid));
        }
    }

    public void requireFeeBelowNav(BigInteger fee, BigInteger nav) {
        if (fee.compareTo(nav) >= 0) {
            throw violation("FEE_BELOW_NAV", String.format("fee %s not below NAV %s", fee, nav));
        }
    }

    /**
     * Full check run at the end of every mutating operation.
     */
    public void verify(VaultState state) {
        BigInteger balances = shareLedger.sumOfBalances();
        if (balances.compareTo(state.getTotalShareSupply()) != 0) {
            throw violation("SUPPLY_CONSERVATION", String.format(
                "sum of balances %s differs from total supply %s",
                balances, state.getTotalShareSupply()));
        }

        requireEscrowCoverage(state);

        if (state.getPendingWithdrawalShares().signum() < 0) {
            throw violation("PENDING_NON_NEGATIVE",
                "pending withdrawal shares negative: " + state.getPendingWithdrawalShares());
        }

        if (state.getFeeRate().compareTo(MAX_FEE_RATE) > 0) {
            throw violation("FEE_RATE_BOUND", String.format(
                "fee rate %s above maximum %s", state.getFeeRate(), MAX_FEE_RATE));
        }

        if (state.getWithdrawalQueueHead() > state.getWithdrawalQueueLength()) {
            throw violation("QUEUE_HEAD_BOUND", String.format(
                "queue head %d beyond length %d",
                state.getWithdrawalQueueHead(), state.getWithdrawalQueueLength()));
        }

        if (state.getLiquidBalance().signum() < 0) {
            throw violation("LIQUIDITY_NON_NEGATIVE",
                "liquid balance negative: " + state.getLiquidBalance());
        }
    }

    private InvariantViolationException violation(String invariant, String detail) {
        log.error("CRITICAL ledger invariant violation [{}]: {}", invariant, detail);
        return new InvariantViolationException(invariant, detail);
    }
}
