package com.vaultledger.withdrawal;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for withdrawal queue entries.
 */
@Repository
public interface WithdrawalRequestRepository extends JpaRepository<WithdrawalRequest, Long> {

    long countByRequesterAndStatus(String requester, WithdrawalStatus status);

    List<WithdrawalRequest> findByRequesterOrderByRequestIdAsc(String requester);

    List<WithdrawalRequest> findByRequestIdLessThanAndStatusNotOrderByRequestIdAsc(
        Long requestId, WithdrawalStatus status, Pageable pageable);
}
