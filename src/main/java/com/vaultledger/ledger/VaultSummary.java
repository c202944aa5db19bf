package com.vaultledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only view of the vault's accounting and parameters.
 */
@Value
@Builder
public class VaultSummary {
    String currency;
    BigInteger totalAssets;
    BigInteger totalShareSupply;
    BigInteger sharePrice;
    BigInteger priceHighWaterMark;
    BigInteger totalDeposited;
    BigInteger totalWithdrawn;
    BigInteger accumulatedYield;
    BigInteger pendingWithdrawalShares;
    BigInteger escrowBalance;
    BigInteger liquidBalance;
    long withdrawalQueueHead;
    long withdrawalQueueLength;
    BigInteger feeRate;
    long cooldownPeriodSeconds;
    BigInteger perUserCap;
    BigInteger globalCap;
    BigInteger liquidityBuffer;
    BigInteger maxYieldChangePercent;
    String treasury;
    String custodyVenue;
    Instant lastYieldReportAt;
    boolean paused;
    boolean depositsPaused;
    boolean withdrawalsPaused;
}
