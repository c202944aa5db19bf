package com.vaultledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the singleton vault state row.
 */
@Repository
public interface VaultStateRepository extends JpaRepository<VaultState, String> {
}
