package com.vaultledger.governance;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.FixedPoint;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Owner-only parameters that take effect immediately.
 *
 * Caps and the liquidity buffer only restrict future deposits or change where
 * value sits, so they carry no timelock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParameterService {

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final AccessAuthority accessAuthority;
    private final Clock clock;

    /**
     * Zero disables the cap.
     */
    public void setPerUserCap(String caller, BigInteger cap) {
        update(caller, "perUserCap", cap, null, VaultState::getPerUserCap, VaultState::setPerUserCap);
    }

    /**
     * Zero disables the cap.
     */
    public void setGlobalCap(String caller, BigInteger cap) {
        update(caller, "globalCap", cap, null, VaultState::getGlobalCap, VaultState::setGlobalCap);
    }

    public void setLiquidityBuffer(String caller, BigInteger buffer) {
        update(caller, "liquidityBuffer", buffer, null, VaultState::getLiquidityBuffer, VaultState::setLiquidityBuffer);
    }

    /**
     * 18-decimal fraction of NAV, at most 100%. Zero disables the yield bound.
     */
    public void setMaxYieldChangePercent(String caller, BigInteger fraction) {
        update(caller, "maxYieldChangePercent", fraction, FixedPoint.PRECISION,
            VaultState::getMaxYieldChangePercent, VaultState::setMaxYieldChangePercent);
    }

    private void update(String caller, String parameter, BigInteger value, BigInteger max,
                        Function<VaultState, BigInteger> getter, BiConsumer<VaultState, BigInteger> setter) {
        operationGuard.run("set " + parameter, () -> {
            accessAuthority.requireOwner(caller, "set " + parameter);
            if (value == null || value.signum() < 0) {
                throw new InvalidParameterException(parameter, "must be zero or positive");
            }
            if (max != null && value.compareTo(max) > 0) {
                throw new InvalidParameterException(parameter, "must not exceed " + max);
            }

            VaultState state = vaultStateService.load();
            BigInteger previous = getter.apply(state);
            setter.accept(state, value);
            state.touch(clock.instant());
            ledgerService.recordParameterChange(caller, parameter, previous, value);

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return null;
        });
    }
}
