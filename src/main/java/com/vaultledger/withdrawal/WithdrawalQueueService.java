package com.vaultledger.withdrawal;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.CancellationWindowExpiredException;
import com.vaultledger.common.exception.InsufficientLiquidityException;
import com.vaultledger.common.exception.InsufficientSharesException;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.common.exception.RequestAlreadyResolvedException;
import com.vaultledger.common.exception.TooManyPendingWithdrawalsException;
import com.vaultledger.common.exception.UnauthorizedCallerException;
import com.vaultledger.common.exception.VaultLedgerException;
import com.vaultledger.common.exception.WithdrawalRequestNotFoundException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyException;
import com.vaultledger.custody.LiquidityManager;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import com.vaultledger.pricing.PricingEngine;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service for the escrowed FIFO withdrawal queue.
 *
 * A withdrawal is two separate operations connected only by persisted state:
 * the request moves shares into the ledger's escrow, and a later fulfillment
 * (after the cooldown) burns them and pays out at the price current at that
 * moment. Requests are processed strictly in queue order; the head pointer only
 * moves forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalQueueService {

    public static final int MAX_PENDING_PER_USER = 10;

    public static final Duration CANCELLATION_WINDOW = Duration.ofHours(1);

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final PricingEngine pricingEngine;
    private final ShareLedger shareLedger;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final LiquidityManager liquidityManager;
    private final AssetTransferAdapter assetTransferAdapter;
    private final AccessAuthority accessAuthority;
    private final Clock clock;

    /**
     * Escrow {@code shares} from the caller and append a request to the queue.
     *
     * @return the request id (its index in the queue)
     */
    public long requestWithdrawal(String caller, BigInteger shares) {
        return operationGuard.run("requestWithdrawal", () -> {
            if (shares == null || shares.signum() <= 0) {
                throw new InvalidAmountException("shares", shares);
            }
            if (caller == null || caller.isBlank() || ShareLedger.ESCROW_HOLDER.equals(caller)) {
                throw new InvalidParameterException("caller", "not a valid requester identity");
            }
            accessAuthority.requireWithdrawalsOpen("requestWithdrawal");

            BigInteger balance = shareLedger.balanceOf(caller);
            if (balance.compareTo(shares) < 0) {
                throw new InsufficientSharesException(caller, shares, balance);
            }

            long pending = withdrawalRequestRepository.countByRequesterAndStatus(caller, WithdrawalStatus.PENDING);
            if (pending >= MAX_PENDING_PER_USER) {
                throw new TooManyPendingWithdrawalsException(caller, MAX_PENDING_PER_USER);
            }

            VaultState state = vaultStateService.load();
            Instant now = clock.instant();
            long requestId = state.getWithdrawalQueueLength();

            shareLedger.transfer(caller, ShareLedger.ESCROW_HOLDER, shares);
            state.setPendingWithdrawalShares(state.getPendingWithdrawalShares().add(shares));
            state.setWithdrawalQueueLength(requestId + 1);
            state.touch(now);

            withdrawalRequestRepository.save(new WithdrawalRequest(requestId, caller, shares, now));
            ledgerService.recordWithdrawalRequested(caller, shares, requestId);

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return requestId;
        });
    }

    /**
     * Return escrowed shares to the requester.
     *
     * The requester may cancel within {@link #CANCELLATION_WINDOW} of the request;
     * the owner may cancel at any time.
     */
    public void cancelWithdrawal(String caller, long requestId) {
        operationGuard.run("cancelWithdrawal", () -> {
            WithdrawalRequest request = findRequest(requestId);
            if (!request.isPending()) {
                throw new RequestAlreadyResolvedException(requestId, request.getStatus().name());
            }

            Instant now = clock.instant();
            if (!accessAuthority.isOwner(caller)) {
                if (!request.getRequester().equals(caller)) {
                    throw new UnauthorizedCallerException(caller, "REQUESTER", "cancelWithdrawal");
                }
                if (now.isAfter(request.getRequestedAt().plus(CANCELLATION_WINDOW))) {
                    throw new CancellationWindowExpiredException(requestId);
                }
            }

            VaultState state = vaultStateService.load();
            ledgerInvariants.requireEscrowCoverage(state);

            BigInteger shares = request.getShares();
            shareLedger.transfer(ShareLedger.ESCROW_HOLDER, request.getRequester(), shares);
            state.setPendingWithdrawalShares(state.getPendingWithdrawalShares().subtract(shares));
            state.touch(now);

            request.cancel(caller, now);
            withdrawalRequestRepository.save(request);
            ledgerService.recordWithdrawalCancelled(request.getRequester(), shares, requestId, caller);

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return null;
        });
    }

    /**
     * Process up to {@code count} pending requests from the head of the queue.
     *
     * Cleared entries at the head are skipped and the head moves past them. The
     * pass stops at the first request still in cooldown (measured with the
     * current cooldown setting), at the first one that cannot be covered by the
     * buffer plus what the venue returns, and at the first payout the rail
     * refuses. None of these fail the call: payouts already made and value
     * already recalled are committed.
     */
    public FulfillmentResult fulfillWithdrawals(String caller, int count) {
        return operationGuard.run("fulfillWithdrawals", () -> {
            accessAuthority.requireOperator(caller, "fulfillWithdrawals");
            if (count <= 0) {
                throw new InvalidParameterException("count", "must be positive");
            }
            accessAuthority.requireWithdrawalsOpen("fulfillWithdrawals");

            VaultState state = vaultStateService.load();
            ledgerInvariants.requireEscrowCoverage(state);

            Instant now = clock.instant();
            int processed = 0;
            BigInteger totalPaid = BigInteger.ZERO;
            FulfillmentResult.StopReason stopReason = FulfillmentResult.StopReason.QUEUE_EXHAUSTED;

            while (state.getWithdrawalQueueHead() < state.getWithdrawalQueueLength()) {
                if (processed >= count) {
                    stopReason = FulfillmentResult.StopReason.COUNT_REACHED;
                    break;
                }

                long head = state.getWithdrawalQueueHead();
                Optional<WithdrawalRequest> entry = withdrawalRequestRepository.findById(head);
                if (entry.isEmpty() || !entry.get().isPending()) {
                    log.debug("Skipping cleared withdrawal request {}", head);
                    state.setWithdrawalQueueHead(head + 1);
                    continue;
                }

                WithdrawalRequest request = entry.get();
                Instant eligibleAt = request.getRequestedAt().plusSeconds(state.getCooldownPeriodSeconds());
                if (now.isBefore(eligibleAt)) {
                    log.debug("Withdrawal request {} in cooldown until {}", head, eligibleAt);
                    stopReason = FulfillmentResult.StopReason.COOLDOWN_PENDING;
                    break;
                }

                BigInteger payout = pricingEngine.sharesToValue(state, request.getShares());
                if (!liquidityManager.ensureLiquidity(state, payout)) {
                    log.warn("Insufficient liquidity for withdrawal request {}: need {}, have {}",
                        head, payout, state.getLiquidBalance());
                    stopReason = FulfillmentResult.StopReason.INSUFFICIENT_LIQUIDITY;
                    break;
                }

                if (!settle(state, request, payout, caller, false)) {
                    stopReason = FulfillmentResult.StopReason.PAYOUT_FAILED;
                    break;
                }
                state.setWithdrawalQueueHead(head + 1);
                processed++;
                totalPaid = totalPaid.add(payout);
            }

            state.touch(now);
            vaultStateService.save(state);
            ledgerInvariants.verify(state);

            log.info("Fulfillment pass by {}: processed={}, paid={}, head={}, stop={}",
                caller, processed, totalPaid, state.getWithdrawalQueueHead(), stopReason);
            return new FulfillmentResult(processed, totalPaid, state.getWithdrawalQueueHead(), stopReason);
        });
    }

    /**
     * Owner emergency path: settle one request regardless of queue order and cooldown.
     *
     * Value recalled from the venue is committed even when the call fails.
     *
     * @return the amount paid out
     * @throws InsufficientLiquidityException if the payout cannot be covered
     * @throws CustodyException if the rail refuses the payout
     */
    public BigInteger forceProcessWithdrawal(String caller, long requestId) {
        ForcedSettlement outcome = operationGuard.run("forceProcessWithdrawal", () -> {
            accessAuthority.requireOwner(caller, "forceProcessWithdrawal");

            WithdrawalRequest request = findRequest(requestId);
            if (!request.isPending()) {
                throw new RequestAlreadyResolvedException(requestId, request.getStatus().name());
            }

            VaultState state = vaultStateService.load();
            ledgerInvariants.requireEscrowCoverage(state);

            BigInteger payout = pricingEngine.sharesToValue(state, request.getShares());
            ForcedSettlement result;
            if (!liquidityManager.ensureLiquidity(state, payout)) {
                result = ForcedSettlement.failed(
                    new InsufficientLiquidityException(payout, state.getLiquidBalance()));
            } else if (!settle(state, request, payout, caller, true)) {
                result = ForcedSettlement.failed(
                    new CustodyException("Payout refused by rail", request.getRequester(), "pay"));
            } else {
                if (state.getWithdrawalQueueHead() == requestId) {
                    state.setWithdrawalQueueHead(requestId + 1);
                }
                result = ForcedSettlement.paid(payout);
            }

            state.touch(clock.instant());
            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return result;
        });

        if (outcome.getFailure() != null) {
            throw outcome.getFailure();
        }
        log.warn("Withdrawal request {} force-processed by {}: paid {}", requestId, caller, outcome.getPayout());
        return outcome.getPayout();
    }

    /**
     * Delete up to {@code maxCount} resolved entries behind the head.
     *
     * Pure housekeeping: ids are never reused and no balance changes.
     *
     * @return number of entries deleted
     */
    public int purgeProcessedWithdrawals(int maxCount) {
        return operationGuard.run("purgeProcessedWithdrawals", () -> {
            if (maxCount <= 0) {
                throw new InvalidParameterException("maxCount", "must be positive");
            }
            VaultState state = vaultStateService.load();
            List<WithdrawalRequest> resolved = withdrawalRequestRepository
                .findByRequestIdLessThanAndStatusNotOrderByRequestIdAsc(
                    state.getWithdrawalQueueHead(), WithdrawalStatus.PENDING, PageRequest.of(0, maxCount));

            withdrawalRequestRepository.deleteAll(resolved);
            log.info("Purged {} resolved withdrawal requests behind head {}",
                resolved.size(), state.getWithdrawalQueueHead());
            return resolved.size();
        });
    }

    /**
     * Burn escrowed shares that no pending request accounts for, e.g. shares
     * transferred straight into escrow.
     *
     * @return the number of shares burned
     */
    public BigInteger recoverOrphanedShares(String caller) {
        return operationGuard.run("recoverOrphanedShares", () -> {
            accessAuthority.requireOwner(caller, "recoverOrphanedShares");

            VaultState state = vaultStateService.load();
            BigInteger orphaned = shareLedger.escrowBalance().subtract(state.getPendingWithdrawalShares());
            if (orphaned.signum() <= 0) {
                log.info("No orphaned escrow shares to recover");
                return BigInteger.ZERO;
            }

            shareLedger.burn(state, ShareLedger.ESCROW_HOLDER, orphaned);
            state.touch(clock.instant());
            ledgerService.recordOrphanedSharesRecovered(caller, orphaned);

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return orphaned;
        });
    }

    @Transactional(readOnly = true)
    public WithdrawalRequest getRequest(long requestId) {
        return findRequest(requestId);
    }

    @Transactional(readOnly = true)
    public List<WithdrawalRequest> getRequestsForHolder(String holder) {
        return withdrawalRequestRepository.findByRequesterOrderByRequestIdAsc(holder);
    }

    @Transactional(readOnly = true)
    public long countPending(String holder) {
        return withdrawalRequestRepository.countByRequesterAndStatus(holder, WithdrawalStatus.PENDING);
    }

    /**
     * Burn, update counters, then pay. A refused payout puts the shares back in
     * escrow and restores the counters, so the request stays pending.
     *
     * @return whether the requester was paid
     */
    private boolean settle(VaultState state, WithdrawalRequest request, BigInteger payout,
                           String resolvedBy, boolean forced) {
        BigInteger shares = request.getShares();
        ledgerInvariants.requireBurnForPayout(shares, payout);

        shareLedger.burn(state, ShareLedger.ESCROW_HOLDER, shares);
        state.setPendingWithdrawalShares(state.getPendingWithdrawalShares().subtract(shares));
        state.setTotalWithdrawn(state.getTotalWithdrawn().add(payout));
        state.setLiquidBalance(state.getLiquidBalance().subtract(payout));

        if (payout.signum() > 0) {
            try {
                assetTransferAdapter.pay(request.getRequester(), payout);
            } catch (RuntimeException e) {
                log.error("Payout of {} for withdrawal request {} failed, request stays pending",
                    payout, request.getRequestId(), e);
                shareLedger.mint(state, ShareLedger.ESCROW_HOLDER, shares);
                state.setPendingWithdrawalShares(state.getPendingWithdrawalShares().add(shares));
                state.setTotalWithdrawn(state.getTotalWithdrawn().subtract(payout));
                state.setLiquidBalance(state.getLiquidBalance().add(payout));
                ledgerService.recordWithdrawalPayoutFailed(request.getRequester(), payout,
                    request.getRequestId(), e.getClass().getSimpleName());
                return false;
            }
        }

        request.fulfill(payout, resolvedBy, clock.instant());
        withdrawalRequestRepository.save(request);
        ledgerService.recordWithdrawalFulfilled(request.getRequester(), shares, payout,
            request.getRequestId(), forced);
        return true;
    }

    private WithdrawalRequest findRequest(long requestId) {
        return withdrawalRequestRepository.findById(requestId)
            .orElseThrow(() -> new WithdrawalRequestNotFoundException(requestId));
    }

    @Value
    private static class ForcedSettlement {
        BigInteger payout;
        VaultLedgerException failure;

        static ForcedSettlement paid(BigInteger payout) {
            return new ForcedSettlement(payout, null);
        }

        static ForcedSettlement failed(VaultLedgerException failure) {
            return new ForcedSettlement(null, failure);
        }
    }
}
