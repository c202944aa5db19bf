package com.vaultledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable journal entry describing one ledger event.
 *
 * Entries are never updated or deleted - they are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_holder_id", columnList = "holder_id"),
    @Index(name = "idx_ledger_request_id", columnList = "request_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LedgerEventType eventType;

    /**
     * The holder the event is about (depositor, requester, treasury...).
     */
    @Column(name = "holder_id")
    private String holderId;

    /**
     * Other side of a transfer, or the actor of an administrative event.
     */
    private String counterparty;

    @Column(precision = 78, scale = 0)
    private BigInteger shares;

    /**
     * Currency amount; for yield reports the signed delta.
     */
    @Column(precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "request_id")
    private Long requestId;

    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(LedgerEventType eventType, String holderId, String counterparty,
                       BigInteger shares, BigInteger amount, Long requestId,
                       String description, Instant createdAt) {
        this.entryId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.holderId = holderId;
        this.counterparty = counterparty;
        this.shares = shares;
        this.amount = amount;
        this.requestId = requestId;
        this.description = description;
        this.createdAt = createdAt;
    }
}
