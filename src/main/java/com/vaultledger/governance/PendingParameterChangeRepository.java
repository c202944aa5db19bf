package com.vaultledger.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PendingParameterChangeRepository extends JpaRepository<PendingParameterChange, String> {

    boolean existsByParameterAndStatus(TimelockedParameter parameter, ChangeStatus status);

    List<PendingParameterChange> findByStatusOrderByQueuedAtAsc(ChangeStatus status);

    List<PendingParameterChange> findAllByOrderByQueuedAtDesc();
}
