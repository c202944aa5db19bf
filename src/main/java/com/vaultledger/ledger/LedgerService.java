package com.vaultledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Append-only journal of ledger events.
 *
 * Every state change of the vault is recorded here with the identities and
 * amounts involved, so the ledger can be audited from outside.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final Clock clock;

    @Transactional
    public LedgerEntry recordDeposit(String holder, BigInteger amount, BigInteger shares) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.DEPOSIT, holder, null,
            shares, amount, null, "Deposit", clock.instant()));
        log.info("Recorded DEPOSIT: holder={}, amount={}, shares={}", holder, amount, shares);
        return entry;
    }

    @Transactional
    public LedgerEntry recordWithdrawalRequested(String holder, BigInteger shares, long requestId) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.WITHDRAWAL_REQUESTED, holder, null,
            shares, null, requestId, "Withdrawal requested", clock.instant()));
        log.info("Recorded WITHDRAWAL_REQUESTED: holder={}, shares={}, request={}",
            holder, shares, requestId);
        return entry;
    }

    @Transactional
    public LedgerEntry recordWithdrawalFulfilled(String holder, BigInteger shares, BigInteger amount,
                                                 long requestId, boolean forced) {
        String description = forced ? "Withdrawal force-processed" : "Withdrawal fulfilled";
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.WITHDRAWAL_FULFILLED, holder, null,
            shares, amount, requestId, description, clock.instant()));
        log.info("Recorded WITHDRAWAL_FULFILLED: holder={}, shares={}, amount={}, request={}, forced={}",
            holder, shares, amount, requestId, forced);
        return entry;
    }

    @Transactional
    public LedgerEntry recordWithdrawalPayoutFailed(String holder, BigInteger amount, long requestId,
                                                    String reason) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.WITHDRAWAL_PAYOUT_FAILED, holder, null,
            null, amount, requestId, "Payout failed: " + reason, clock.instant()));
        log.warn("Recorded WITHDRAWAL_PAYOUT_FAILED: holder={}, amount={}, request={}, reason={}",
            holder, amount, requestId, reason);
        return entry;
    }

    @Transactional
    public LedgerEntry recordWithdrawalCancelled(String holder, BigInteger shares, long requestId,
                                                 String cancelledBy) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.WITHDRAWAL_CANCELLED, holder,
            cancelledBy, shares, null, requestId, "Withdrawal cancelled", clock.instant()));
        log.info("Recorded WITHDRAWAL_CANCELLED: holder={}, shares={}, request={}, by={}",
            holder, shares, requestId, cancelledBy);
        return entry;
    }

    @Transactional
    public LedgerEntry recordFeeCollected(String treasury, BigInteger feeValue, BigInteger feeShares) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.FEE_COLLECTED, treasury, null,
            feeShares, feeValue, null, "Performance fee", clock.instant()));
        log.info("Recorded FEE_COLLECTED: treasury={}, fee={}, shares={}", treasury, feeValue, feeShares);
        return entry;
    }

    @Transactional
    public LedgerEntry recordYieldReported(String reporter, BigInteger delta, BigInteger navAfter) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.YIELD_REPORTED, null, reporter,
            null, delta, null, "Yield reported, NAV " + navAfter, clock.instant()));
        log.info("Recorded YIELD_REPORTED: delta={}, nav={}, by={}", delta, navAfter, reporter);
        return entry;
    }

    @Transactional
    public LedgerEntry recordHighWaterMarkReset(String actor, BigInteger previous, BigInteger current) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.HWM_RESET, null, actor,
            null, null, null, String.format("HWM reset from %s to %s", previous, current),
            clock.instant()));
        log.warn("Recorded HWM_RESET: {} -> {} by {}", previous, current, actor);
        return entry;
    }

    @Transactional
    public LedgerEntry recordTransfer(String from, String to, BigInteger shares) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.SHARES_TRANSFERRED, from, to,
            shares, null, null, "Share transfer", clock.instant()));
        log.info("Recorded SHARES_TRANSFERRED: from={}, to={}, shares={}", from, to, shares);
        return entry;
    }

    @Transactional
    public LedgerEntry recordOrphanedSharesRecovered(String actor, BigInteger shares) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.ORPHANED_SHARES_RECOVERED,
            ShareLedger.ESCROW_HOLDER, actor, shares, null, null, "Orphaned escrow shares burned",
            clock.instant()));
        log.info("Recorded ORPHANED_SHARES_RECOVERED: shares={}, by={}", shares, actor);
        return entry;
    }

    @Transactional
    public LedgerEntry recordParameterChange(String actor, String parameter, Object previous, Object current) {
        LedgerEntry entry = save(new LedgerEntry(LedgerEventType.PARAMETER_CHANGED, null, actor,
            null, null, null, String.format("%s: %s -> %s", parameter, previous, current),
            clock.instant()));
        log.info("Recorded PARAMETER_CHANGED: {} {} -> {} by {}", parameter, previous, current, actor);
        return entry;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getHolderJournal(String holderId) {
        return ledgerRepository.findByHolderIdOrderByCreatedAtDesc(holderId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getRequestJournal(long requestId) {
        return ledgerRepository.findByRequestId(requestId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntries(LedgerEventType eventType) {
        return ledgerRepository.findByEventType(eventType);
    }

    private LedgerEntry save(LedgerEntry entry) {
        return ledgerRepository.save(entry);
    }
}
