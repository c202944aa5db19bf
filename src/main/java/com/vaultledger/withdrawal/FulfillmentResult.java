package com.vaultledger.withdrawal;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a batch fulfillment pass.
 *
 * A partial result is normal: the pass stops at the first request still in
 * cooldown, at the first one the available liquidity cannot cover, or at the
 * first payout the rail refuses.
 */
@Value
public class FulfillmentResult {
    int processed;
    BigInteger totalPaid;
    long queueHead;
    StopReason stopReason;

    public enum StopReason {
        COUNT_REACHED,
        QUEUE_EXHAUSTED,
        COOLDOWN_PENDING,
        INSUFFICIENT_LIQUIDITY,
        PAYOUT_FAILED
    }
}
