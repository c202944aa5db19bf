package com.vaultledger.common.exception;

import java.time.Instant;

/**
 * Thrown when a yield report arrives before the minimum report interval has elapsed.
 */
public class YieldReportTooFrequentException extends VaultLedgerException {

    public YieldReportTooFrequentException(Instant nextAllowed) {
        super("Next yield report allowed at " + nextAllowed);
    }
}
