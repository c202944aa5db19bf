package com.vaultledger.custody;

import com.vaultledger.ledger.VaultState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Moves value between the ledger's liquidity buffer and the custody venue.
 *
 * Only {@link VaultState#getLiquidBalance()} changes here; NAV does not depend
 * on where the value sits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiquidityManager {

    private final CustodyVenueAdapter custodyVenue;

    /**
     * Forward everything above the configured buffer to the custody venue.
     *
     * A venue that refuses the transfer leaves the value in the buffer; the next
     * operation that forwards picks it up again.
     *
     * @return the amount forwarded
     */
    public BigInteger forwardExcess(VaultState state) {
        BigInteger excess = state.getLiquidBalance().subtract(state.getLiquidityBuffer());
        if (excess.signum() <= 0) {
            return BigInteger.ZERO;
        }
        try {
            custodyVenue.forward(state.getCustodyVenueRef(), excess);
        } catch (CustodyException e) {
            log.warn("Forward of {} to venue {} failed, keeping it in the buffer: {}",
                excess, state.getCustodyVenueRef(), e.getMessage());
            return BigInteger.ZERO;
        }
        state.setLiquidBalance(state.getLiquidBalance().subtract(excess));
        log.info("Forwarded {} above buffer {} to venue {} via {}",
            excess, state.getLiquidityBuffer(), state.getCustodyVenueRef(), custodyVenue.getAdapterName());
        return excess;
    }

    /**
     * Make sure the buffer holds at least {@code required}, recalling the
     * shortfall from the venue if needed.
     *
     * A venue that returns too little, or fails outright, is not a ledger fault:
     * the method reports {@code false} and the caller degrades.
     */
    public boolean ensureLiquidity(VaultState state, BigInteger required) {
        if (state.getLiquidBalance().compareTo(required) >= 0) {
            return true;
        }

        BigInteger shortfall = required.subtract(state.getLiquidBalance());
        BigInteger recalled;
        try {
            recalled = custodyVenue.recall(state.getCustodyVenueRef(), shortfall);
        } catch (CustodyException e) {
            log.warn("Recall of {} from venue {} failed: {}",
                shortfall, state.getCustodyVenueRef(), e.getMessage());
            return false;
        }

        state.setLiquidBalance(state.getLiquidBalance().add(recalled));
        log.info("Recalled {} of {} shortfall from venue {}", recalled, shortfall, state.getCustodyVenueRef());
        return state.getLiquidBalance().compareTo(required) >= 0;
    }
}
