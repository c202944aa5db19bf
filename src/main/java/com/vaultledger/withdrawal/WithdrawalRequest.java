package com.vaultledger.withdrawal;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One entry of the withdrawal queue.
 *
 * The id is the entry's position in the queue and is never reused. Once the
 * request is resolved its escrowed amount is zeroed; {@link #originalShares}
 * keeps what was requested.
 */
@Entity
@Table(name = "withdrawal_requests", indexes = {
    @Index(name = "idx_withdrawal_requester", columnList = "requester"),
    @Index(name = "idx_withdrawal_status", columnList = "status")
})
@Data
@NoArgsConstructor
public class WithdrawalRequest {

    @Id
    private Long requestId;

    @Column(nullable = false)
    private String requester;

    /**
     * Shares still escrowed for this request; zero once resolved.
     */
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger shares;

    @Column(precision = 78, scale = 0, nullable = false, updatable = false)
    private BigInteger originalShares;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WithdrawalStatus status;

    @Column(nullable = false, updatable = false)
    private Instant requestedAt;

    private Instant resolvedAt;

    private String resolvedBy;

    /**
     * Currency paid out on fulfillment.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger payoutAmount;

    public WithdrawalRequest(long requestId, String requester, BigInteger shares, Instant requestedAt) {
        this.requestId = requestId;
        this.requester = requester;
        this.shares = shares;
        this.originalShares = shares;
        this.status = WithdrawalStatus.PENDING;
        this.requestedAt = requestedAt;
    }

    public boolean isPending() {
        return status == WithdrawalStatus.PENDING;
    }

    public void fulfill(BigInteger payout, String resolvedBy, Instant now) {
        this.status = WithdrawalStatus.FULFILLED;
        this.payoutAmount = payout;
        this.shares = BigInteger.ZERO;
        this.resolvedBy = resolvedBy;
        this.resolvedAt = now;
    }

    public void cancel(String resolvedBy, Instant now) {
        this.status = WithdrawalStatus.CANCELLED;
        this.shares = BigInteger.ZERO;
        this.resolvedBy = resolvedBy;
        this.resolvedAt = now;
    }
}
