package com.vaultledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Persisted scalar state of the vault.
 *
 * There is exactly one row, created at first start-up. Every amount is an
 * integer: value amounts in the currency's smallest unit, shares in
 * share-units, rates and prices with 18 decimals.
 */
@Entity
@Table(name = "vault_state")
@Data
@NoArgsConstructor
public class VaultState {

    public static final String PRIMARY_ID = "primary";

    @Id
    private String vaultId;

    /**
     * Currency code of the deposited asset, e.g. USDC.
     */
    @Column(nullable = false, updatable = false)
    private String currency;

    /**
     * Reference of the custody venue that receives value above the liquidity buffer.
     */
    private String custodyVenueRef;

    /**
     * Holder that receives minted fee shares.
     */
    private String treasuryRef;

    @Column(precision = 78, scale = 0)
    private BigInteger totalDeposited = BigInteger.ZERO;

    @Column(precision = 78, scale = 0)
    private BigInteger totalWithdrawn = BigInteger.ZERO;

    /**
     * Signed sum of all reported yield deltas.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger accumulatedYield = BigInteger.ZERO;

    /**
     * Shares escrowed for requests that are still pending.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger pendingWithdrawalShares = BigInteger.ZERO;

    @Column(precision = 78, scale = 0)
    private BigInteger totalShareSupply = BigInteger.ZERO;

    /**
     * Currency physically held by the ledger (the buffer), as opposed to deployed at the venue.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger liquidBalance = BigInteger.ZERO;

    @Column(precision = 78, scale = 0)
    private BigInteger feeRate = BigInteger.ZERO;

    private long cooldownPeriodSeconds;

    @Column(precision = 78, scale = 0)
    private BigInteger priceHighWaterMark = BigInteger.ZERO;

    /**
     * Maximum value one holder may hold. Zero means unlimited.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger perUserCap = BigInteger.ZERO;

    /**
     * Maximum total assets under management. Zero means unlimited.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger globalCap = BigInteger.ZERO;

    @Column(precision = 78, scale = 0)
    private BigInteger liquidityBuffer = BigInteger.ZERO;

    private Instant lastYieldReportAt;

    /**
     * Largest allowed yield delta as a fraction of current NAV. Zero disables the bound.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger maxYieldChangePercent = BigInteger.ZERO;

    private long withdrawalQueueHead;

    private long withdrawalQueueLength;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public VaultState(String currency, String custodyVenueRef, String treasuryRef, Instant now) {
        this.vaultId = PRIMARY_ID;
        this.currency = currency;
        this.custodyVenueRef = custodyVenueRef;
        this.treasuryRef = treasuryRef;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
