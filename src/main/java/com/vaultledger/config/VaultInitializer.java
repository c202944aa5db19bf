package com.vaultledger.config;

import com.vaultledger.common.FixedPoint;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Creates the vault state row on first start-up.
 *
 * Identity parameters (currency, custody venue, treasury) and the initial
 * operational parameters come from {@code vault-ledger.init.*}. An existing
 * vault is never re-initialized.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultInitializer implements ApplicationRunner {

    private final VaultStateService vaultStateService;
    private final Clock clock;

    @Value("${vault-ledger.init.currency:USDC}")
    private String currency;

    @Value("${vault-ledger.init.custody-venue}")
    private String custodyVenue;

    @Value("${vault-ledger.init.treasury}")
    private String treasury;

    @Value("${vault-ledger.init.fee-rate:0.2}")
    private String feeRate;

    @Value("${vault-ledger.init.cooldown-period:P7D}")
    private Duration cooldownPeriod;

    @Value("${vault-ledger.init.per-user-cap:0}")
    private BigInteger perUserCap;

    @Value("${vault-ledger.init.global-cap:0}")
    private BigInteger globalCap;

    @Value("${vault-ledger.init.liquidity-buffer:0}")
    private BigInteger liquidityBuffer;

    @Value("${vault-ledger.init.max-yield-change:0.1}")
    private String maxYieldChange;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (vaultStateService.isInitialized()) {
            log.info("Vault state already initialized");
            return;
        }

        BigInteger feeRateFixed = FixedPoint.fraction(feeRate);
        if (feeRateFixed.compareTo(LedgerInvariants.MAX_FEE_RATE) > 0) {
            throw new InvalidParameterException("fee-rate", "above maximum " + LedgerInvariants.MAX_FEE_RATE);
        }

        VaultState state = new VaultState(currency, custodyVenue, treasury, clock.instant());
        state.setFeeRate(feeRateFixed);
        state.setCooldownPeriodSeconds(cooldownPeriod.getSeconds());
        state.setPriceHighWaterMark(FixedPoint.INITIAL_SHARE_PRICE);
        state.setPerUserCap(perUserCap);
        state.setGlobalCap(globalCap);
        state.setLiquidityBuffer(liquidityBuffer);
        state.setMaxYieldChangePercent(FixedPoint.fraction(maxYieldChange));
        vaultStateService.save(state);

        log.info("Initialized vault: currency={}, venue={}, treasury={}, feeRate={}, cooldown={}",
            currency, custodyVenue, treasury, feeRateFixed, cooldownPeriod);
    }
}
