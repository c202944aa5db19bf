package com.vaultledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Share balance of one holder.
 *
 * The ledger's escrow and the treasury are ordinary share accounts. Balances
 * change only through {@link ShareLedger}.
 */
@Entity
@Table(name = "share_accounts")
@Data
@NoArgsConstructor
public class ShareAccount {

    @Id
    private String holderId;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger shares = BigInteger.ZERO;

    /**
     * Cumulative currency deposited by this holder.
     */
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalDeposited = BigInteger.ZERO;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ShareAccount(String holderId, Instant now) {
        this.holderId = holderId;
        this.createdAt = now;
        this.updatedAt = now;
    }

    void credit(BigInteger amount, Instant now) {
        this.shares = this.shares.add(amount);
        this.updatedAt = now;
    }

    void debit(BigInteger amount, Instant now) {
        this.shares = this.shares.subtract(amount);
        this.updatedAt = now;
    }

    void recordDeposit(BigInteger value, Instant now) {
        this.totalDeposited = this.totalDeposited.add(value);
        this.updatedAt = now;
    }
}
