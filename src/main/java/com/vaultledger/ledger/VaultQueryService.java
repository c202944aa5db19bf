package com.vaultledger.ledger;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.pricing.NavSnapshot;
import com.vaultledger.pricing.PricingEngine;
import com.vaultledger.withdrawal.WithdrawalRequestRepository;
import com.vaultledger.withdrawal.WithdrawalStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only queries over the vault. Nothing here takes the operation guard.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VaultQueryService {

    private final VaultStateService vaultStateService;
    private final PricingEngine pricingEngine;
    private final ShareLedger shareLedger;
    private final ShareAccountRepository shareAccountRepository;
    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final LedgerService ledgerService;
    private final AccessAuthority accessAuthority;

    public VaultSummary getSummary() {
        VaultState state = vaultStateService.load();
        NavSnapshot nav = pricingEngine.snapshot(state);
        return VaultSummary.builder()
            .currency(state.getCurrency())
            .totalAssets(nav.getTotalAssets())
            .totalShareSupply(nav.getTotalShareSupply())
            .sharePrice(nav.getSharePrice())
            .priceHighWaterMark(nav.getPriceHighWaterMark())
            .totalDeposited(state.getTotalDeposited())
            .totalWithdrawn(state.getTotalWithdrawn())
            .accumulatedYield(state.getAccumulatedYield())
            .pendingWithdrawalShares(state.getPendingWithdrawalShares())
            .escrowBalance(shareLedger.escrowBalance())
            .liquidBalance(state.getLiquidBalance())
            .withdrawalQueueHead(state.getWithdrawalQueueHead())
            .withdrawalQueueLength(state.getWithdrawalQueueLength())
            .feeRate(state.getFeeRate())
            .cooldownPeriodSeconds(state.getCooldownPeriodSeconds())
            .perUserCap(state.getPerUserCap())
            .globalCap(state.getGlobalCap())
            .liquidityBuffer(state.getLiquidityBuffer())
            .maxYieldChangePercent(state.getMaxYieldChangePercent())
            .treasury(state.getTreasuryRef())
            .custodyVenue(state.getCustodyVenueRef())
            .lastYieldReportAt(state.getLastYieldReportAt())
            .paused(accessAuthority.paused())
            .depositsPaused(accessAuthority.depositsPaused())
            .withdrawalsPaused(accessAuthority.withdrawalsPaused())
            .build();
    }

    public AccountView getAccount(String holderId) {
        VaultState state = vaultStateService.load();
        BigInteger shares = shareLedger.balanceOf(holderId);
        BigInteger deposited = shareAccountRepository.findById(holderId)
            .map(ShareAccount::getTotalDeposited)
            .orElse(BigInteger.ZERO);
        long pending = withdrawalRequestRepository.countByRequesterAndStatus(holderId, WithdrawalStatus.PENDING);
        return new AccountView(holderId, shares, pricingEngine.sharesToValue(state, shares), deposited, pending);
    }

    public BigInteger convertToShares(BigInteger value) {
        requireNonNegative("value", value);
        return pricingEngine.valueToShares(vaultStateService.load(), value);
    }

    public BigInteger convertToValue(BigInteger shares) {
        requireNonNegative("shares", shares);
        return pricingEngine.sharesToValue(vaultStateService.load(), shares);
    }

    public List<LedgerEntry> getJournal(String holderId) {
        return ledgerService.getHolderJournal(holderId);
    }

    private void requireNonNegative(String field, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidAmountException(field, amount);
        }
    }
}
