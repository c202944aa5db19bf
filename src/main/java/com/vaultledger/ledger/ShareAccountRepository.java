package com.vaultledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;

/**
 * Repository for share accounts.
 */
@Repository
public interface ShareAccountRepository extends JpaRepository<ShareAccount, String> {

    @Query("select sum(a.shares) from ShareAccount a")
    BigInteger sumAllShares();
}
