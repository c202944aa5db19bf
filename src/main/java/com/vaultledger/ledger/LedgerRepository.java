package com.vaultledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for journal entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByHolderIdOrderByCreatedAtDesc(String holderId);

    List<LedgerEntry> findByRequestId(Long requestId);

    List<LedgerEntry> findByEventType(LedgerEventType eventType);
}
