package com.vaultledger.deposit;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.CapExceededException;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.common.exception.ZeroSharesException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.LiquidityManager;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import com.vaultledger.pricing.PricingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Service for processing deposits.
 *
 * Deposit flow:
 * 1. Validate amount, pause state and caps
 * 2. Price the deposit at the current share price
 * 3. Mint shares and update counters
 * 4. Pull currency from the depositor
 * 5. Forward anything above the liquidity buffer to the custody venue
 *
 * The ledger is saved and verified before step 4, so the collect is the last
 * step that can fail the deposit. A refused forward only leaves the value in
 * the buffer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositService {

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final PricingEngine pricingEngine;
    private final ShareLedger shareLedger;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final LiquidityManager liquidityManager;
    private final AssetTransferAdapter assetTransferAdapter;
    private final AccessAuthority accessAuthority;
    private final Clock clock;

    public DepositReceipt deposit(String caller, BigInteger amount) {
        return operationGuard.run("deposit", () -> doDeposit(caller, amount));
    }

    private DepositReceipt doDeposit(String caller, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("amount", amount);
        }
        if (caller == null || caller.isBlank() || ShareLedger.ESCROW_HOLDER.equals(caller)) {
            throw new InvalidParameterException("caller", "not a valid depositor identity");
        }
        accessAuthority.requireDepositsOpen();

        VaultState state = vaultStateService.load();

        BigInteger price = pricingEngine.sharePrice(state);
        BigInteger shares = pricingEngine.valueToShares(state, amount);
        if (shares.signum() == 0) {
            throw new ZeroSharesException(amount, price);
        }

        checkCaps(state, caller, amount);

        log.info("Processing deposit of {} {} from {} at price {}",
            amount, state.getCurrency(), caller, price);

        shareLedger.mint(state, caller, shares);
        shareLedger.recordDeposit(caller, amount);
        state.setTotalDeposited(state.getTotalDeposited().add(amount));
        state.setLiquidBalance(state.getLiquidBalance().add(amount));
        state.touch(clock.instant());
        ledgerService.recordDeposit(caller, amount, shares);

        vaultStateService.save(state);
        ledgerInvariants.verify(state);

        assetTransferAdapter.collect(caller, amount);
        BigInteger forwarded = liquidityManager.forwardExcess(state);
        vaultStateService.save(state);

        log.info("Deposit complete: holder={}, amount={}, shares={}, rail={}",
            caller, amount, shares, assetTransferAdapter.getAdapterName());
        return new DepositReceipt(caller, amount, shares, price, forwarded);
    }

    private void checkCaps(VaultState state, String caller, BigInteger amount) {
        if (state.getPerUserCap().signum() > 0) {
            BigInteger holding = pricingEngine.sharesToValue(state, shareLedger.balanceOf(caller));
            BigInteger resulting = holding.add(amount);
            if (resulting.compareTo(state.getPerUserCap()) > 0) {
                throw new CapExceededException("Per-user cap", state.getPerUserCap(), resulting);
            }
        }

        if (state.getGlobalCap().signum() > 0) {
            BigInteger resulting = pricingEngine.totalAssets(state).add(amount);
            if (resulting.compareTo(state.getGlobalCap()) > 0) {
                throw new CapExceededException("Global cap", state.getGlobalCap(), resulting);
            }
        }
    }
}
