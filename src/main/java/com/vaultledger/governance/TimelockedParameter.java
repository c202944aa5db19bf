package com.vaultledger.governance;

/**
 * Parameters that can only change after a delay.
 */
public enum TimelockedParameter {
    /**
     * Performance fee rate, 18-decimal fraction of profit.
     */
    FEE_RATE,

    /**
     * Minimum wait between a withdrawal request and its fulfillment, ISO-8601 duration.
     */
    COOLDOWN_PERIOD,

    /**
     * Holder receiving fee shares.
     */
    TREASURY,

    /**
     * Venue receiving value above the liquidity buffer.
     */
    CUSTODY_VENUE
}
