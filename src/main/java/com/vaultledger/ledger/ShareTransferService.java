package com.vaultledger.ledger;

import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.InsufficientSharesException;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Holder-to-holder share transfers.
 *
 * Shares may be sent to the escrow holder; such shares are not tied to any
 * request and are only removed by orphaned-share recovery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShareTransferService {

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final ShareLedger shareLedger;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final Clock clock;

    public void transferShares(String caller, String to, BigInteger shares) {
        operationGuard.run("transferShares", () -> {
            if (shares == null || shares.signum() <= 0) {
                throw new InvalidAmountException("shares", shares);
            }
            if (caller == null || caller.isBlank() || ShareLedger.ESCROW_HOLDER.equals(caller)) {
                throw new InvalidParameterException("caller", "not a valid sender identity");
            }
            if (to == null || to.isBlank()) {
                throw new InvalidParameterException("to", "recipient required");
            }

            BigInteger balance = shareLedger.balanceOf(caller);
            if (balance.compareTo(shares) < 0) {
                throw new InsufficientSharesException(caller, shares, balance);
            }

            VaultState state = vaultStateService.load();
            shareLedger.transfer(caller, to, shares);
            state.touch(clock.instant());
            ledgerService.recordTransfer(caller, to, shares);

            if (ShareLedger.ESCROW_HOLDER.equals(to)) {
                log.warn("{} shares sent directly to escrow by {}; recoverable as orphaned shares",
                    shares, caller);
            }

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return null;
        });
    }
}
