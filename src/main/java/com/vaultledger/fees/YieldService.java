package com.vaultledger.fees;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.FixedPoint;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.YieldBoundExceededException;
import com.vaultledger.common.exception.YieldReportTooFrequentException;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import com.vaultledger.pricing.PricingEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Yield reporting and high-water-mark performance fees.
 *
 * Fee flow on a positive report:
 * 1. Apply the delta to accumulated yield
 * 2. If the new price is above the HWM, take the fee rate of the profit above it
 * 3. Mint shares worth the fee to the treasury, diluting existing holders
 * 4. Move the HWM to the post-fee price
 *
 * Losses never produce a fee and never lower the HWM; the price has to recover
 * past the old mark before fees resume.
 */
@Service
@Slf4j
public class YieldService {

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final PricingEngine pricingEngine;
    private final ShareLedger shareLedger;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final AccessAuthority accessAuthority;
    private final Clock clock;
    private final Duration minReportInterval;

    public YieldService(OperationGuard operationGuard,
                        VaultStateService vaultStateService,
                        PricingEngine pricingEngine,
                        ShareLedger shareLedger,
                        LedgerService ledgerService,
                        LedgerInvariants ledgerInvariants,
                        AccessAuthority accessAuthority,
                        Clock clock,
                        @Value("${vault-ledger.yield.min-report-interval:PT0S}") Duration minReportInterval) {
        this.operationGuard = operationGuard;
        this.vaultStateService = vaultStateService;
        this.pricingEngine = pricingEngine;
        this.shareLedger = shareLedger;
        this.ledgerService = ledgerService;
        this.ledgerInvariants = ledgerInvariants;
        this.accessAuthority = accessAuthority;
        this.clock = clock;
        this.minReportInterval = minReportInterval;
    }

    /**
     * Apply a signed change in the deployed capital's value and collect any fee it earns.
     *
     * @param delta signed yield in currency units
     * @throws YieldBoundExceededException if |delta| exceeds the allowed share of current NAV
     * @throws YieldReportTooFrequentException if the minimum report interval has not elapsed
     */
    public YieldReport reportYieldAndCollectFees(String caller, BigInteger delta) {
        return operationGuard.run("reportYieldAndCollectFees", () -> {
            accessAuthority.requireOwner(caller, "reportYieldAndCollectFees");
            if (delta == null) {
                throw new InvalidAmountException("delta", null);
            }

            VaultState state = vaultStateService.load();
            BigInteger navBefore = pricingEngine.totalAssets(state);
            checkBound(state, navBefore, delta);

            Instant now = clock.instant();
            checkInterval(state, now);

            state.setAccumulatedYield(state.getAccumulatedYield().add(delta));
            state.setLastYieldReportAt(now);
            state.touch(now);

            BigInteger navAfter = pricingEngine.totalAssets(state);
            ledgerService.recordYieldReported(caller, delta, navAfter);

            FeeCollection fee = FeeCollection.NONE;
            if (delta.signum() > 0 && state.getTotalShareSupply().signum() > 0) {
                fee = collectFee(state, delta, navAfter);
            }

            vaultStateService.save(state);
            ledgerInvariants.verify(state);

            log.info("Yield report by {}: delta={}, nav {} -> {}, price={}, fee={}, hwm={}",
                caller, delta, navBefore, navAfter, pricingEngine.sharePrice(state),
                fee.getValue(), state.getPriceHighWaterMark());
            return new YieldReport(delta, navBefore, pricingEngine.totalAssets(state),
                pricingEngine.sharePrice(state), fee.getValue(), fee.getShares(),
                state.getPriceHighWaterMark());
        });
    }

    /**
     * Re-base the high-water mark to the current price, e.g. after an accepted loss.
     *
     * @return the new high-water mark
     */
    public BigInteger resetPriceHWM(String caller) {
        return operationGuard.run("resetPriceHWM", () -> {
            accessAuthority.requireOwner(caller, "resetPriceHWM");

            VaultState state = vaultStateService.load();
            BigInteger previous = state.getPriceHighWaterMark();
            BigInteger current = pricingEngine.sharePrice(state);

            state.setPriceHighWaterMark(current);
            state.touch(clock.instant());
            ledgerService.recordHighWaterMarkReset(caller, previous, current);

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return current;
        });
    }

    private FeeCollection collectFee(VaultState state, BigInteger delta, BigInteger nav) {
        BigInteger supply = state.getTotalShareSupply();
        BigInteger price = pricingEngine.sharePrice(state);
        BigInteger hwm = state.getPriceHighWaterMark();
        if (price.compareTo(hwm) <= 0) {
            log.debug("Price {} not above high-water mark {}, no fee", price, hwm);
            return FeeCollection.NONE;
        }

        BigInteger gainAboveMark = FixedPoint.mulDiv(price.subtract(hwm), supply, FixedPoint.PRECISION);
        BigInteger profit = FixedPoint.min(delta, gainAboveMark);
        BigInteger fee = FixedPoint.applyRate(profit, state.getFeeRate());

        if (fee.signum() == 0) {
            state.setPriceHighWaterMark(price);
            return FeeCollection.NONE;
        }
        if (fee.compareTo(nav) >= 0) {
            log.warn("Fee {} not below NAV {}, skipping fee collection", fee, nav);
            return FeeCollection.NONE;
        }
        ledgerInvariants.requireFeeBelowNav(fee, nav);

        // shares worth exactly `fee` after they are minted
        BigInteger feeShares = FixedPoint.mulDiv(fee, supply, nav.subtract(fee));
        if (feeShares.signum() > 0) {
            shareLedger.mint(state, state.getTreasuryRef(), feeShares);
            ledgerService.recordFeeCollected(state.getTreasuryRef(), fee, feeShares);
        }

        BigInteger postFeePrice = pricingEngine.sharePrice(state);
        state.setPriceHighWaterMark(postFeePrice);
        log.info("Collected performance fee {} as {} shares to {}, high-water mark now {}",
            fee, feeShares, state.getTreasuryRef(), postFeePrice);
        return new FeeCollection(fee, feeShares);
    }

    private void checkBound(VaultState state, BigInteger nav, BigInteger delta) {
        BigInteger maxChange = state.getMaxYieldChangePercent();
        if (maxChange.signum() <= 0) {
            return;
        }
        BigInteger bound = FixedPoint.applyRate(nav, maxChange);
        if (delta.abs().compareTo(bound) > 0) {
            throw new YieldBoundExceededException(delta, bound);
        }
    }

    private void checkInterval(VaultState state, Instant now) {
        if (minReportInterval.isZero() || minReportInterval.isNegative() || state.getLastYieldReportAt() == null) {
            return;
        }
        Instant nextAllowed = state.getLastYieldReportAt().plus(minReportInterval);
        if (now.isBefore(nextAllowed)) {
            throw new YieldReportTooFrequentException(nextAllowed);
        }
    }

    @lombok.Value
    private static class FeeCollection {
        static final FeeCollection NONE = new FeeCollection(BigInteger.ZERO, BigInteger.ZERO);

        BigInteger value;
        BigInteger shares;
    }
}
